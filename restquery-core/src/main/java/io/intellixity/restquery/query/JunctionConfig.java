package io.intellixity.restquery.query;

import java.util.Objects;

/**
 * Junction table of a many-to-many pairing: {@code localKey} references the source row,
 * {@code foreignKey} references the target row.
 */
public record JunctionConfig(String table, String localKey, String foreignKey) {
  public JunctionConfig {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(localKey, "localKey");
    Objects.requireNonNull(foreignKey, "foreignKey");
  }
}
