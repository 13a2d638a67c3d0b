package io.intellixity.restquery.relation;

import io.intellixity.restquery.query.JoinType;
import io.intellixity.restquery.query.JunctionConfig;

import java.util.List;
import java.util.Map;

/**
 * Closed set of relationship variants, one per {@link Cardinality}. Each variant owns its join condition and
 * its document-store lowering.
 */
public sealed interface Relationship
    permits OneToOneRelationship, OneToManyRelationship, ManyToOneRelationship, ManyToManyRelationship {

  RelationshipDefinition definition();

  /** Condition used to fill a join stub. */
  JoinSpec joinCondition();

  /** Lookup stages embedding the related rows under {@code request.alias()}. */
  List<Map<String, Object>> lookupStages(EmbedRequest request);

  /** True when the embedded value is an array. */
  boolean isMultiResult();

  default String name() { return definition().name(); }
  default String targetTable() { return definition().targetTable(); }
  default String localField() { return definition().localField(); }
  default String foreignField() { return definition().foreignField(); }
  default Cardinality cardinality() { return definition().type(); }
  default JunctionConfig junction() { return definition().junction(); }

  static Relationship of(RelationshipDefinition def) {
    return switch (def.type()) {
      case ONE_TO_ONE -> new OneToOneRelationship(def);
      case ONE_TO_MANY -> new OneToManyRelationship(def);
      case MANY_TO_ONE -> new ManyToOneRelationship(def);
      case MANY_TO_MANY -> new ManyToManyRelationship(def);
    };
  }

  static JoinSpec directJoin(RelationshipDefinition def) {
    return new JoinSpec(def.localField(), def.foreignField(), JoinType.LEFT);
  }
}
