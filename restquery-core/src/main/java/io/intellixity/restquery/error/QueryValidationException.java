package io.intellixity.restquery.error;

import java.util.List;
import java.util.Map;

/**
 * Raised when a query fails validation against a backend's declared capabilities.
 * <p>
 * The adapter's structured error list is exposed under the {@code errors} detail key.
 */
public final class QueryValidationException extends RestQueryException {
  public QueryValidationException(String adapter, List<? extends Map<String, ?>> errors) {
    super(ErrorCode.COR_QUERY_VALIDATION_FAILED,
        "Query validation failed for adapter '" + adapter + "'",
        detail("adapter", adapter, "errors", errors == null ? List.of() : List.copyOf(errors)));
  }

  @SuppressWarnings("unchecked")
  public List<Map<String, Object>> errors() {
    Object v = details().get("errors");
    return v instanceof List<?> l ? (List<Map<String, Object>>) l : List.of();
  }
}
