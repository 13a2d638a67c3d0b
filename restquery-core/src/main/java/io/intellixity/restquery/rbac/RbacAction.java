package io.intellixity.restquery.rbac;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Permission action; create and update both check {@code WRITE}. */
public enum RbacAction {
  READ, WRITE, DELETE;

  @JsonValue
  public String token() { return name().toLowerCase(Locale.ROOT); }
}
