package io.intellixity.restquery.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base of every error raised by the query pipeline.
 * <p>
 * Carries a stable {@link ErrorCode} and structured details (collection, role, path, ...).
 */
public class RestQueryException extends RuntimeException {
  private final ErrorCode code;
  private final Map<String, Object> details;

  public RestQueryException(ErrorCode code, String message, Map<String, ?> details) {
    this(code, message, details, null);
  }

  public RestQueryException(ErrorCode code, String message, Map<String, ?> details, Throwable cause) {
    super(message == null ? Objects.requireNonNull(code, "code").description() : message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public ErrorCode code() { return code; }
  public Map<String, Object> details() { return details; }
  public int httpStatus() { return code.httpStatus(); }

  static Map<String, Object> detail(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      if (kv[i + 1] != null) m.put(String.valueOf(kv[i]), kv[i + 1]);
    }
    return m;
  }
}
