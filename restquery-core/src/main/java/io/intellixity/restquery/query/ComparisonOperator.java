package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Closed set of field comparison operators understood by every backend lowering. */
public enum ComparisonOperator {
  EQ, NEQ, GT, GTE, LT, LTE,
  IN, NIN,
  LIKE, ILIKE, REGEX,
  EXISTS, NULL, NOTNULL,
  CONTAINS, STARTSWITH, ENDSWITH;

  @JsonValue
  public String token() { return name().toLowerCase(Locale.ROOT); }

  /** True for operators whose value is a list ({@code in}, {@code nin}). */
  public boolean isSetOperator() { return this == IN || this == NIN; }

  /** Resolves a REST token such as {@code gte}; returns null when unknown. */
  public static ComparisonOperator fromToken(String token) {
    if (token == null || token.isBlank()) return null;
    String t = token.trim().toUpperCase(Locale.ROOT);
    for (ComparisonOperator op : values()) {
      if (op.name().equals(t)) return op;
    }
    return null;
  }
}
