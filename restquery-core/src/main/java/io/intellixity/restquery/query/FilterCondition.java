package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter tree node. Children are {@link #conditions()} followed by {@link #nested()}; an absent operator
 * means AND.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FilterCondition(LogicalOperator operator, List<FieldCondition> conditions, List<FilterCondition> nested) {
  public FilterCondition {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    nested = nested == null ? List.of() : List.copyOf(nested);
  }

  public static FilterCondition of(FieldCondition... conditions) {
    return new FilterCondition(null, List.of(conditions), null);
  }

  public static FilterCondition and(FilterCondition... nested) {
    return new FilterCondition(LogicalOperator.AND, null, List.of(nested));
  }

  public static FilterCondition or(FieldCondition... conditions) {
    return new FilterCondition(LogicalOperator.OR, List.of(conditions), null);
  }

  public static FilterCondition not(FieldCondition... conditions) {
    return new FilterCondition(LogicalOperator.NOT, List.of(conditions), null);
  }

  /** Effective combinator ({@code AND} when unset). */
  public LogicalOperator effectiveOperator() {
    return operator == null ? LogicalOperator.AND : operator;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return conditions.isEmpty() && nested.isEmpty();
  }

  /** True when another condition can be appended without changing the meaning of this node. */
  @JsonIgnore
  public boolean isPlainConjunction() {
    return effectiveOperator() == LogicalOperator.AND && nested.isEmpty();
  }

  public FilterCondition withCondition(FieldCondition c) {
    List<FieldCondition> next = new ArrayList<>(conditions);
    next.add(c);
    return new FilterCondition(operator, next, nested);
  }
}
