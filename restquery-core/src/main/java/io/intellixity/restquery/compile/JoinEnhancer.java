package io.intellixity.restquery.compile;

import io.intellixity.restquery.error.RelationshipException;
import io.intellixity.restquery.query.IntermediateQuery;
import io.intellixity.restquery.query.JoinClause;
import io.intellixity.restquery.relation.Cardinality;
import io.intellixity.restquery.relation.Relationship;
import io.intellixity.restquery.relation.RelationshipRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves join stubs against a {@link RelationshipRegistry}.
 * <p>
 * A stub is looked up by the collection it hangs off: the root collection for top-level joins, the resolved
 * target of the enclosing join for nested ones. Unknown stubs are left untouched unless {@code strict}.
 */
public final class JoinEnhancer {
  private static final Logger log = LoggerFactory.getLogger(JoinEnhancer.class);

  private final RelationshipRegistry registry;
  private final boolean strict;

  public JoinEnhancer(RelationshipRegistry registry) {
    this(registry, false);
  }

  /** {@code registry} may be null; enhancing a query with joins then fails. */
  public JoinEnhancer(RelationshipRegistry registry, boolean strict) {
    this.registry = registry;
    this.strict = strict;
  }

  public IntermediateQuery enhance(IntermediateQuery query) {
    if (query.joins().isEmpty()) return query;
    if (registry == null) throw RelationshipException.notInitialized();
    return query.withJoins(enhanceJoins(query.collection(), query.joins()));
  }

  List<JoinClause> enhanceJoins(String sourceCollection, List<JoinClause> joins) {
    List<JoinClause> out = new ArrayList<>(joins.size());
    for (JoinClause j : joins) {
      JoinClause resolved = resolve(sourceCollection, j);
      if (!resolved.joins().isEmpty()) {
        resolved = resolved.withJoins(enhanceJoins(resolved.target(), resolved.joins()));
      }
      out.add(resolved);
    }
    return out;
  }

  private JoinClause resolve(String sourceCollection, JoinClause join) {
    if (!join.isStub()) return join;
    String name = join.relationship().name();
    Optional<Relationship> found = registry.get(sourceCollection, name);
    if (found.isEmpty()) {
      if (strict) throw RelationshipException.notFound(sourceCollection, name);
      log.debug("restquery.enhance unresolved source={} relationship={}", sourceCollection, name);
      return join;
    }

    Relationship rel = found.get();
    JoinClause out = join
        .withOn(List.of(rel.joinCondition().toCondition()))
        .withTarget(rel.targetTable())
        .withType(rel.cardinality().joinType());
    if (rel.cardinality() == Cardinality.MANY_TO_MANY) {
      out = out.withRelationship(join.relationship().withJunction(rel.junction()));
    }
    return out;
  }
}
