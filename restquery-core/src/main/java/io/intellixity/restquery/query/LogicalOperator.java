package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Combinator of a {@link FilterCondition}; {@code NOT} negates the conjunction of its children. */
public enum LogicalOperator {
  AND, OR, NOT;

  @JsonValue
  public String token() { return name().toLowerCase(Locale.ROOT); }

  /** Returns null for anything that is not and/or/not. */
  public static LogicalOperator fromToken(String token) {
    if (token == null) return null;
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "and" -> AND;
      case "or" -> OR;
      case "not" -> NOT;
      default -> null;
    };
  }
}
