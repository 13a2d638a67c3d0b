package io.intellixity.restquery.error;

/** Internal parsing context violated; never raised for merely unparseable tokens. */
public final class MalformedInputException extends RestQueryException {
  public MalformedInputException(String message, String token) {
    super(ErrorCode.QRY_CURRENT_QUERY_NOT_INITIALIZED, message, detail("token", token));
  }
}
