package io.intellixity.restquery.relation;

import io.intellixity.restquery.query.JoinCondition;
import io.intellixity.restquery.query.JoinType;

/** Join condition derived from a relationship: {@code source.localField = target.foreignField}. */
public record JoinSpec(String localField, String foreignField, JoinType joinType) {
  public JoinCondition toCondition() {
    return new JoinCondition(localField, foreignField);
  }
}
