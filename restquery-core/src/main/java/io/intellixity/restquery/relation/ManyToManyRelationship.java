package io.intellixity.restquery.relation;

import io.intellixity.restquery.query.JoinType;
import io.intellixity.restquery.query.JunctionConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.intellixity.restquery.relation.LookupStages.*;

/**
 * Two-hop relationship through a junction: junction rows where {@code junction.localKey == source.localField},
 * then target rows whose {@code foreignField} is among the collected {@code junction.foreignKey} values.
 * The intermediate junction array is removed before the stage list ends.
 */
public record ManyToManyRelationship(RelationshipDefinition definition) implements Relationship {
  public ManyToManyRelationship {
    Objects.requireNonNull(definition, "definition");
    if (definition.type() != Cardinality.MANY_TO_MANY) {
      throw new IllegalArgumentException("Expected MANY_TO_MANY definition, got " + definition.type());
    }
  }

  @Override
  public JoinSpec joinCondition() {
    return new JoinSpec(localField(), junction().localKey(), JoinType.LEFT);
  }

  @Override
  public List<Map<String, Object>> lookupStages(EmbedRequest request) {
    JunctionConfig j = junction();
    String junctionField = JUNCTION_PREFIX + request.alias();

    Map<String, Object> junctionLookup = correlatedLookup(j.table(), localField(), j.localKey(), List.of(), junctionField);

    List<Map<String, Object>> targetPipeline = new ArrayList<>();
    targetPipeline.add(stage("$match", doc("$expr", doc("$in", List.of("$" + foreignField(), "$$" + JUNCTION_IDS)))));
    targetPipeline.addAll(basePipeline(request));
    Map<String, Object> targetLookup = stage("$lookup", doc(
        "from", targetTable(),
        "let", doc(JUNCTION_IDS, doc("$map", doc(
            "input", "$" + junctionField,
            "as", "j",
            "in", "$$j." + j.foreignKey()))),
        "pipeline", targetPipeline,
        "as", request.alias()));

    return List.of(junctionLookup, targetLookup, stage("$unset", junctionField));
  }

  @Override
  public boolean isMultiResult() {
    return true;
  }
}
