package io.intellixity.restquery.mongo;

import io.intellixity.restquery.query.*;
import io.intellixity.restquery.relation.EmbedRequest;
import io.intellixity.restquery.relation.Relationship;
import io.intellixity.restquery.relation.RelationshipRegistry;
import io.intellixity.restquery.spi.dialect.NativeDialect;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lowers IR to MongoDB statements.
 * <p>
 * Reads become one aggregation pipeline: join lookups, {@code $match}, {@code $group}, {@code $sort},
 * {@code $skip} (offset &gt; 0), {@code $limit} (limit &gt; 0) and a trailing {@code $project}. Joins whose relationship
 * is registered for the enclosing collection lower through {@link Relationship#lookupStages}; other joins use a plain
 * lookup on their {@code on} condition. Mutations bypass the pipeline.
 */
public final class MongoDialect implements NativeDialect<MongoStatement> {
  private static final Logger log = LoggerFactory.getLogger(MongoDialect.class);

  private final RelationshipRegistry relationships;

  public MongoDialect() {
    this(null);
  }

  /** {@code relationships} may be null; joins then always use the {@code on}-based fallback. */
  public MongoDialect(RelationshipRegistry relationships) {
    this.relationships = relationships;
  }

  @Override
  public String id() {
    return "mongo";
  }

  @Override
  public MongoStatement render(IntermediateQuery q) {
    Objects.requireNonNull(q, "query");
    return switch (q.type()) {
      case READ -> MongoStatement.aggregate(q.collection(), pipeline(q));
      case INSERT -> new MongoStatement(MongoStatement.Kind.INSERT_ONE, q.collection(), null, null, payload(q));
      case UPDATE -> q.partial()
          ? new MongoStatement(MongoStatement.Kind.UPDATE_ONE, q.collection(), null,
              MongoFilterRenderer.toBson(q.filters()), new Document("$set", payload(q)))
          : new MongoStatement(MongoStatement.Kind.REPLACE_ONE, q.collection(), null,
              MongoFilterRenderer.toBson(q.filters()), payload(q));
      case DELETE -> new MongoStatement(MongoStatement.Kind.DELETE_ONE, q.collection(), null,
          MongoFilterRenderer.toBson(q.filters()), null);
    };
  }

  private static Document payload(IntermediateQuery q) {
    return q.data() == null ? new Document() : new Document(q.data());
  }

  List<Document> pipeline(IntermediateQuery q) {
    List<Document> out = new ArrayList<>();
    for (JoinClause j : q.joins()) out.addAll(joinStages(q.collection(), j));

    Document match = q.filter() != null ? MongoFilterRenderer.toBson(q.filter()) : MongoFilterRenderer.toBson(q.filters());
    if (!match.isEmpty()) out.add(new Document("$match", match));

    if (!q.aggregations().isEmpty()) out.add(group(q.aggregations(), q.groupBy()));

    if (!q.sort().isEmpty()) out.add(new Document("$sort", sort(q.sort())));
    if (q.offset() > 0) out.add(new Document("$skip", q.offset()));
    Integer limit = q.limit();
    if (limit != null && limit > 0) out.add(new Document("$limit", limit));

    if (q.aggregations().isEmpty()) {
      Document project = projection(q.select());
      if (!project.isEmpty()) out.add(new Document("$project", project));
    }
    return out;
  }

  private List<Document> joinStages(String sourceCollection, JoinClause join) {
    String as = join.outputName();
    List<Map<String, Object>> nested = new ArrayList<>();
    for (JoinClause n : join.joins()) nested.addAll(joinStages(join.target(), n));
    Document filter = MongoFilterRenderer.toBson(join.filter());
    List<String> fields = join.select() == null ? List.of() : join.select().fields();

    Optional<Relationship> rel = (relationships == null || join.relationship() == null)
        ? Optional.empty()
        : relationships.get(sourceCollection, join.relationship().name());
    if (rel.isPresent()) {
      EmbedRequest req = new EmbedRequest(as, fields, filter, nested, null, null, null,
          join.relationship().preserveNullOrDefault());
      List<Document> out = new ArrayList<>();
      for (Map<String, Object> stage : rel.get().lookupStages(req)) out.add(new Document(stage));
      return out;
    }

    List<Object> tail = new ArrayList<>();
    if (!filter.isEmpty()) tail.add(new Document("$match", filter));
    tail.addAll(nested);
    Document project = fieldProjection(fields);
    if (!project.isEmpty()) tail.add(new Document("$project", project));

    if (join.on().isEmpty()) {
      log.debug("restquery.mongo unresolved join source={} target={} as={}", sourceCollection, join.target(), as);
      return List.of(new Document("$lookup", new Document("from", join.target()).append("pipeline", tail).append("as", as)));
    }
    JoinCondition on = join.on().get(0);
    if (tail.isEmpty()) {
      return List.of(new Document("$lookup", new Document("from", join.target())
          .append("localField", on.local())
          .append("foreignField", on.foreign())
          .append("as", as)));
    }
    List<Object> pipeline = new ArrayList<>();
    pipeline.add(new Document("$match", new Document("$expr",
        new Document("$eq", List.of("$" + on.foreign(), "$$local_value")))));
    pipeline.addAll(tail);
    return List.of(new Document("$lookup", new Document("from", join.target())
        .append("let", new Document("local_value", "$" + on.local()))
        .append("pipeline", pipeline)
        .append("as", as)));
  }

  private static Document sort(List<SortClause> sort) {
    Document d = new Document();
    for (SortClause s : sort) d.append(s.field(), s.direction() == SortClause.Direction.DESC ? -1 : 1);
    return d;
  }

  private static Document group(List<AggregationClause> aggregations, List<String> groupBy) {
    Object id;
    if (groupBy.isEmpty()) {
      id = null;
    } else if (groupBy.size() == 1) {
      id = "$" + groupBy.get(0);
    } else {
      Document key = new Document();
      for (String g : groupBy) key.append(g.replace('.', '_'), "$" + g);
      id = key;
    }
    Document group = new Document("_id", id);
    for (AggregationClause a : aggregations) {
      Object acc = switch (a.type()) {
        case COUNT -> new Document("$sum", 1);
        case SUM -> new Document("$sum", "$" + a.field());
        case AVG -> new Document("$avg", "$" + a.field());
        case MIN -> new Document("$min", "$" + a.field());
        case MAX -> new Document("$max", "$" + a.field());
      };
      group.append(a.alias(), acc);
    }
    return new Document("$group", group);
  }

  /**
   * Inclusion projection from the select: {@code alias.*} keeps the embedded field, aliases become
   * {@code alias: "$source"}. Excludes apply only when nothing is explicitly selected.
   */
  static Document projection(SelectClause select) {
    if (select == null) return new Document();
    Document d = new Document();
    if (select.fields().isEmpty() || select.fields().contains(SelectClause.WILDCARD)) {
      for (String e : select.exclude()) d.append(e, 0);
      return d;
    }
    d.putAll(fieldProjection(select.fields()));
    select.aliases().forEach((alias, source) -> d.append(alias, "$" + source));
    return d;
  }

  private static Document fieldProjection(List<String> fields) {
    Document d = new Document();
    if (fields.contains(SelectClause.WILDCARD)) return d;
    for (String f : fields) {
      String path = f.endsWith("." + SelectClause.WILDCARD) ? f.substring(0, f.length() - 2) : f;
      d.append(path, 1);
    }
    return d;
  }
}
