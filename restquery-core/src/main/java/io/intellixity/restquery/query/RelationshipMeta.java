package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipMeta(String name, JunctionConfig junction, Boolean preserveNull) {
  public RelationshipMeta {
    Objects.requireNonNull(name, "name");
  }

  public static RelationshipMeta named(String name) {
    return new RelationshipMeta(name, null, null);
  }

  /** Singular lookups keep parent rows without a match unless explicitly disabled. */
  public boolean preserveNullOrDefault() {
    return preserveNull == null || preserveNull;
  }

  public RelationshipMeta withJunction(JunctionConfig junction) {
    return new RelationshipMeta(name, junction, preserveNull);
  }
}
