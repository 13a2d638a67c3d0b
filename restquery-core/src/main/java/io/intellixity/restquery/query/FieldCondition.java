package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/** Leaf predicate {@code field operator value}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldCondition(String field, ComparisonOperator operator, Object value, Map<String, Object> modifiers) {
  public FieldCondition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    modifiers = (modifiers == null || modifiers.isEmpty()) ? null : Map.copyOf(modifiers);
  }

  public FieldCondition(String field, ComparisonOperator operator, Object value) {
    this(field, operator, value, null);
  }

  public static FieldCondition eq(String field, Object value) {
    return new FieldCondition(field, ComparisonOperator.EQ, value);
  }
}
