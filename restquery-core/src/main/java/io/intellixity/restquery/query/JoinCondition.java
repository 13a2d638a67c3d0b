package io.intellixity.restquery.query;

import java.util.Objects;

/** Equality between a field of the enclosing collection and a field of the join target. */
public record JoinCondition(String local, String foreign) {
  public JoinCondition {
    Objects.requireNonNull(local, "local");
    Objects.requireNonNull(foreign, "foreign");
  }
}
