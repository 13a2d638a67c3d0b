package io.intellixity.restquery.error;

/** Adapter lookup or backend execution failure. */
public final class AdapterException extends RestQueryException {
  private AdapterException(ErrorCode code, String message, String adapter, Throwable cause) {
    super(code, message, detail("adapter", adapter), cause);
  }

  public static AdapterException notFound(String backendType) {
    return new AdapterException(ErrorCode.COR_ADAPTER_NOT_FOUND,
        "No adapter found for database type: " + backendType, backendType, null);
  }

  /** Wraps a driver failure as {@code "<backend> query execution failed: <cause>"}. */
  public static AdapterException executionFailed(String backend, Throwable cause) {
    String msg = cause == null ? "unknown error" : String.valueOf(cause.getMessage());
    return new AdapterException(ErrorCode.ADP_EXECUTION_FAILED,
        backend + " query execution failed: " + msg, backend, cause);
  }
}
