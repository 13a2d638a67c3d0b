package io.intellixity.restquery.spi.exec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One capability violation; {@code path} points into the IR (e.g. {@code filter.nested[0].conditions[1].operator}). */
public record ValidationError(String code, String message, String path) {
  public static final String MISSING_COLLECTION = "MISSING_COLLECTION";
  public static final String UNSUPPORTED_OPERATOR = "UNSUPPORTED_OPERATOR";
  public static final String UNSUPPORTED_JOIN_TYPE = "UNSUPPORTED_JOIN_TYPE";
  public static final String UNSUPPORTED_AGGREGATION = "UNSUPPORTED_AGGREGATION";
  public static final String UNSUPPORTED_QUERY_TYPE = "UNSUPPORTED_QUERY_TYPE";
  public static final String QUERY_TOO_COMPLEX = "QUERY_TOO_COMPLEX";
  public static final String RESULT_SIZE_EXCEEDED = "RESULT_SIZE_EXCEEDED";

  public ValidationError {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("code", code);
    m.put("message", message);
    if (path != null) m.put("path", path);
    return m;
  }
}
