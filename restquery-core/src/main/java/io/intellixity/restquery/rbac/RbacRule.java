package io.intellixity.restquery.rbac;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Ordered patterns granted to one role. */
public record RbacRule(@JsonProperty("user_role") String userRole,
                       @JsonProperty("patterns") List<RbacPattern> patterns) {
  public RbacRule {
    Objects.requireNonNull(userRole, "userRole");
    patterns = patterns == null ? List.of() : List.copyOf(patterns);
  }
}
