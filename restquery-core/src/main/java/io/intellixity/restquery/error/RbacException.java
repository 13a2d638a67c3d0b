package io.intellixity.restquery.error;

public final class RbacException extends RestQueryException {
  private RbacException(ErrorCode code, String message, String collection) {
    super(code, message, detail("collection", collection));
  }

  public static RbacException collectionNotFound(String collection) {
    return new RbacException(ErrorCode.RBC_COLLECTION_NOT_FOUND,
        "Collection '" + collection + "' not found in RBAC configuration", collection);
  }
}
