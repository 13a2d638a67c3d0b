package io.intellixity.restquery.relation;

import com.fasterxml.jackson.annotation.JsonValue;
import io.intellixity.restquery.query.JoinType;

public enum Cardinality {
  ONE_TO_ONE("one-to-one", JoinType.ONE_TO_ONE),
  ONE_TO_MANY("one-to-many", JoinType.ONE_TO_MANY),
  MANY_TO_ONE("many-to-one", JoinType.MANY_TO_ONE),
  MANY_TO_MANY("many-to-many", JoinType.MANY_TO_MANY);

  private final String token;
  private final JoinType joinType;

  Cardinality(String token, JoinType joinType) {
    this.token = token;
    this.joinType = joinType;
  }

  @JsonValue
  public String token() { return token; }

  /** Join type a resolved stub takes on. */
  public JoinType joinType() { return joinType; }

  public static Cardinality fromToken(String token) {
    for (Cardinality c : values()) {
      if (c.token.equalsIgnoreCase(token)) return c;
    }
    throw new IllegalArgumentException("Unknown relationship type: " + token);
  }
}
