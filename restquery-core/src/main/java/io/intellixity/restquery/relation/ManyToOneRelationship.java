package io.intellixity.restquery.relation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Singular relationship: one correlated lookup, unwound to a single object. */
public record ManyToOneRelationship(RelationshipDefinition definition) implements Relationship {
  public ManyToOneRelationship {
    Objects.requireNonNull(definition, "definition");
    if (definition.type() != Cardinality.MANY_TO_ONE) {
      throw new IllegalArgumentException("Expected MANY_TO_ONE definition, got " + definition.type());
    }
  }

  @Override
  public JoinSpec joinCondition() {
    return Relationship.directJoin(definition);
  }

  @Override
  public List<Map<String, Object>> lookupStages(EmbedRequest request) {
    return List.of(
        LookupStages.correlatedLookup(targetTable(), localField(), foreignField(),
            LookupStages.basePipeline(request), request.alias()),
        LookupStages.unwind(request.alias(), request.preserveNull()));
  }

  @Override
  public boolean isMultiResult() {
    return false;
  }
}
