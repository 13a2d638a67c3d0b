package io.intellixity.restquery.error;

public final class ResourceNotFoundException extends RestQueryException {
  public ResourceNotFoundException(String collection, Object id) {
    super(ErrorCode.COR_RESOURCE_NOT_FOUND,
        "Resource '" + id + "' not found in collection '" + collection + "'",
        detail("collection", collection, "id", id == null ? null : String.valueOf(id)));
  }
}
