package io.intellixity.restquery.relation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** One correlated lookup; the joined rows stay an array. */
public record OneToManyRelationship(RelationshipDefinition definition) implements Relationship {
  public OneToManyRelationship {
    Objects.requireNonNull(definition, "definition");
    if (definition.type() != Cardinality.ONE_TO_MANY) {
      throw new IllegalArgumentException("Expected ONE_TO_MANY definition, got " + definition.type());
    }
  }

  @Override
  public JoinSpec joinCondition() {
    return Relationship.directJoin(definition);
  }

  @Override
  public List<Map<String, Object>> lookupStages(EmbedRequest request) {
    return List.of(LookupStages.correlatedLookup(targetTable(), localField(), foreignField(),
        LookupStages.basePipeline(request), request.alias()));
  }

  @Override
  public boolean isMultiResult() {
    return true;
  }
}
