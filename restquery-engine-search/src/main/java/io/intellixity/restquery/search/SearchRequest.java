package io.intellixity.restquery.search;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/** Search request {@code {index, body}}; {@code body} is sent as-is to {@code /{index}/_search}. */
public record SearchRequest(String index, ObjectNode body) {
  public SearchRequest {
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(body, "body");
  }
}
