package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Join flavour of a {@link JoinClause}: either a relational keyword, a document-store lookup/embed,
 * a declared relationship cardinality, or a search-engine join model.
 */
public enum JoinType {
  INNER("inner"),
  LEFT("left"),
  RIGHT("right"),
  FULL("full"),
  CROSS("cross"),
  LOOKUP("lookup"),
  EMBED("embed"),
  ONE_TO_ONE("one-to-one"),
  ONE_TO_MANY("one-to-many"),
  MANY_TO_ONE("many-to-one"),
  MANY_TO_MANY("many-to-many"),
  NESTED("nested"),
  PARENT_CHILD("parent-child");

  private final String token;

  JoinType(String token) { this.token = token; }

  @JsonValue
  public String token() { return token; }

  public static JoinType fromToken(String token) {
    if (token == null) return null;
    for (JoinType t : values()) {
      if (t.token.equalsIgnoreCase(token.trim())) return t;
    }
    return null;
  }
}
