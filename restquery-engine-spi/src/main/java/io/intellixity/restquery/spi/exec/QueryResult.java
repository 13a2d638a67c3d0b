package io.intellixity.restquery.spi.exec;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/** Result envelope {@code {data, metadata, pagination?}}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(List<Map<String, Object>> data, ResultMetadata metadata, PaginationInfo pagination) {
  public QueryResult {
    data = data == null ? List.of() : data;
  }
}
