package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/** Provenance of a converted query; {@code timestamp} is epoch millis. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryMetadata(Map<String, String> originalParams, List<String> roles, String source, Long timestamp) {
  public static final String REST_SOURCE = "rest-api";

  public QueryMetadata {
    originalParams = originalParams == null ? Map.of() : java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(originalParams));
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
