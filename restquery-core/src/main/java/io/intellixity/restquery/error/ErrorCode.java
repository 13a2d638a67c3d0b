package io.intellixity.restquery.error;

/** Stable error codes; clients branch on {@link #code()} and never on messages. */
public enum ErrorCode {
  COR_ACCESS_DENIED_READ(403, "Access denied for read operation"),
  COR_ACCESS_DENIED_CREATE(403, "Access denied for create operation"),
  COR_ACCESS_DENIED_UPDATE(403, "Access denied for update operation"),
  COR_ACCESS_DENIED_DELETE(403, "Access denied for delete operation"),
  COR_RESOURCE_NOT_FOUND(404, "Resource not found"),
  COR_QUERY_VALIDATION_FAILED(400, "Query validation failed"),
  COR_ADAPTER_NOT_FOUND(404, "No adapter found for database type"),
  COR_RELATIONSHIP_NOT_INITIALIZED(500, "Relationship registry not initialized"),
  COR_RELATIONSHIP_NOT_FOUND(500, "Relationship not found"),
  QRY_CURRENT_QUERY_NOT_INITIALIZED(400, "Current query not initialized"),
  ADP_EXECUTION_FAILED(500, "Backend query execution failed"),
  RBC_COLLECTION_NOT_FOUND(400, "Collection not found in RBAC configuration");

  private final int httpStatus;
  private final String description;

  ErrorCode(int httpStatus, String description) {
    this.httpStatus = httpStatus;
    this.description = description;
  }

  public String code() { return name(); }
  public int httpStatus() { return httpStatus; }
  public String description() { return description; }
}
