package io.intellixity.restquery.error;

import java.util.List;

/** Collection/action/role mismatch; raised before any query is built. */
public final class AccessDeniedException extends RestQueryException {
  public AccessDeniedException(ErrorCode code, String collection, String action, List<String> roles) {
    super(code,
        "Access denied: roles " + roles + " may not " + action + " collection '" + collection + "'",
        detail("collection", collection, "action", action, "roles", roles == null ? List.of() : List.copyOf(roles)));
  }

  public static AccessDeniedException read(String collection, List<String> roles) {
    return new AccessDeniedException(ErrorCode.COR_ACCESS_DENIED_READ, collection, "read", roles);
  }

  public static AccessDeniedException create(String collection, List<String> roles) {
    return new AccessDeniedException(ErrorCode.COR_ACCESS_DENIED_CREATE, collection, "create", roles);
  }

  public static AccessDeniedException update(String collection, List<String> roles) {
    return new AccessDeniedException(ErrorCode.COR_ACCESS_DENIED_UPDATE, collection, "update", roles);
  }

  public static AccessDeniedException delete(String collection, List<String> roles) {
    return new AccessDeniedException(ErrorCode.COR_ACCESS_DENIED_DELETE, collection, "delete", roles);
  }
}
