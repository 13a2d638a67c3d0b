package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Join against {@code target}. Nested {@code joins} are scoped to {@code target}, not to the root collection.
 * A join with an empty {@code on} and a {@code relationship} name is a stub awaiting registry resolution.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record JoinClause(JoinType type,
                         String target,
                         String alias,
                         List<JoinCondition> on,
                         SelectClause select,
                         FilterCondition filter,
                         List<JoinClause> joins,
                         RelationshipMeta relationship) {
  public JoinClause {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(target, "target");
    on = on == null ? List.of() : List.copyOf(on);
    joins = joins == null ? List.of() : List.copyOf(joins);
  }

  /** Stub produced by the converter for an embedded relationship expression. */
  public static JoinClause stub(String relationName, String tentativeTarget, String alias) {
    return new JoinClause(JoinType.LOOKUP, tentativeTarget, alias, List.of(), null, null, List.of(),
        RelationshipMeta.named(relationName));
  }

  @JsonIgnore
  public boolean isStub() {
    return on.isEmpty() && relationship != null && relationship.name() != null;
  }

  /** Output key of the joined rows. */
  public String outputName() {
    return (alias == null || alias.isBlank()) ? target : alias;
  }

  public JoinClause withType(JoinType type) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }

  public JoinClause withTarget(String target) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }

  public JoinClause withOn(List<JoinCondition> on) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }

  public JoinClause withSelect(SelectClause select) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }

  public JoinClause withFilter(FilterCondition filter) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }

  public JoinClause withJoins(List<JoinClause> joins) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }

  public JoinClause withRelationship(RelationshipMeta relationship) {
    return new JoinClause(type, target, alias, on, select, filter, joins, relationship);
  }
}
