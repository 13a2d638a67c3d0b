package io.intellixity.restquery.error;

/** Join enhancement cannot proceed: registry missing or relationship unknown. */
public final class RelationshipException extends RestQueryException {
  private RelationshipException(ErrorCode code, String message, String collection, String relationship) {
    super(code, message, detail("collection", collection, "relationship", relationship));
  }

  public static RelationshipException notInitialized() {
    return new RelationshipException(ErrorCode.COR_RELATIONSHIP_NOT_INITIALIZED,
        "Relationship registry not initialized", null, null);
  }

  public static RelationshipException notFound(String collection, String relationship) {
    return new RelationshipException(ErrorCode.COR_RELATIONSHIP_NOT_FOUND,
        "Relationship '" + relationship + "' not found for collection '" + collection + "'", collection, relationship);
  }
}
