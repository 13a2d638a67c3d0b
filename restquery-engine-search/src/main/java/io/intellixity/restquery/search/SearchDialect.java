package io.intellixity.restquery.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.spi.dialect.NativeDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Lowers read IR to search-engine query DSL.
 * <p>
 * Body defaults are {@code match_all}, {@code _source: true}, {@code from: 0}, {@code size: 10}. Filters become a
 * {@code bool} query (and: must, or: should with {@code minimum_should_match: 1}, not: must_not). Joins have no
 * relational meaning here: each becomes a {@code terms} bucket aggregation keyed by the join's local field, and
 * documents are not correlated.
 */
public final class SearchDialect implements NativeDialect<SearchRequest> {
  private static final Logger log = LoggerFactory.getLogger(SearchDialect.class);

  public static final int DEFAULT_SIZE = 10;

  private final ObjectMapper mapper;

  public SearchDialect() {
    this(new ObjectMapper());
  }

  public SearchDialect(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String id() {
    return "search";
  }

  @Override
  public SearchRequest render(IntermediateQuery q) {
    Objects.requireNonNull(q, "query");
    if (q.type() != QueryType.READ) {
      throw new IllegalArgumentException("Search backend only supports read queries, got: " + q.type().token());
    }

    ObjectNode body = mapper.createObjectNode();
    JsonNode query = q.filter() != null
        ? filter(q.filter())
        : filter(new FilterCondition(LogicalOperator.AND, q.filters(), null));
    body.set("query", query);
    body.set("_source", source(q.select()));

    ArrayNode sort = body.putArray("sort");
    for (SortClause s : q.sort()) {
      ObjectNode item = sort.addObject();
      item.putObject(s.field()).put("order", s.direction() == SortClause.Direction.DESC ? "desc" : "asc");
    }

    body.put("from", q.offset() > 0 ? q.offset() : 0);
    Integer limit = q.limit();
    body.put("size", (limit != null && limit > 0) ? limit : DEFAULT_SIZE);

    ObjectNode aggs = mapper.createObjectNode();
    if (!q.joins().isEmpty()) {
      log.warn("restquery.search op=convert index={} joins={} lowering=terms_buckets correlation=none",
          q.collection(), q.joins().size());
      for (int i = 0; i < q.joins().size(); i++) {
        JoinClause j = q.joins().get(i);
        String field = j.on().isEmpty() ? "id" : j.on().get(0).local();
        aggs.putObject("join_" + i).putObject("terms").put("field", field);
      }
    }
    if (!q.aggregations().isEmpty()) aggregations(aggs, q.aggregations(), q.groupBy());
    if (!aggs.isEmpty()) body.set("aggs", aggs);

    return new SearchRequest(q.collection(), body);
  }

  private JsonNode source(SelectClause select) {
    if (select == null || select.selectsAll()) return mapper.getNodeFactory().booleanNode(true);
    ArrayNode out = mapper.createArrayNode();
    for (String f : select.fields()) out.add(f);
    return out;
  }

  /** Metrics under one alias each; group keys nest as {@code terms} buckets in order. */
  private void aggregations(ObjectNode aggs, List<AggregationClause> metrics, List<String> groupBy) {
    ObjectNode target = aggs;
    for (String g : groupBy) {
      ObjectNode bucket = target.putObject("group_by_" + g.replace('.', '_'));
      bucket.putObject("terms").put("field", g);
      target = bucket.putObject("aggs");
    }
    for (AggregationClause a : metrics) {
      ObjectNode m = target.putObject(a.alias());
      switch (a.type()) {
        case COUNT -> m.putObject("value_count").put("field", a.field() == null ? "_id" : a.field());
        case SUM -> m.putObject("sum").put("field", a.field());
        case AVG -> m.putObject("avg").put("field", a.field());
        case MIN -> m.putObject("min").put("field", a.field());
        case MAX -> m.putObject("max").put("field", a.field());
      }
    }
  }

  JsonNode filter(FilterCondition f) {
    List<JsonNode> children = new ArrayList<>();
    for (FieldCondition c : f.conditions()) children.add(condition(c));
    for (FilterCondition n : f.nested()) children.add(filter(n));

    if (f.operator() == null) {
      if (children.isEmpty()) return matchAll();
      if (children.size() == 1) return children.get(0);
    }
    if (children.isEmpty() && f.operator() != LogicalOperator.NOT) return matchAll();

    ObjectNode bool = mapper.createObjectNode();
    ObjectNode inner = bool.putObject("bool");
    switch (f.effectiveOperator()) {
      case AND -> inner.putArray("must").addAll(children);
      case OR -> {
        inner.putArray("should").addAll(children);
        inner.put("minimum_should_match", 1);
      }
      case NOT -> inner.putArray("must_not").addAll(children);
    }
    return bool;
  }

  JsonNode condition(FieldCondition c) {
    String field = c.field();
    Object value = c.value();
    return switch (c.operator()) {
      case EQ -> value == null ? mustNot(exists(field)) : leaf("term", field, value);
      case NEQ -> value == null ? exists(field) : mustNot(leaf("term", field, value));
      case GT -> range(field, "gt", value);
      case GTE -> range(field, "gte", value);
      case LT -> range(field, "lt", value);
      case LTE -> range(field, "lte", value);
      case IN -> terms(field, value);
      case NIN -> mustNot(terms(field, value));
      case EXISTS -> Boolean.TRUE.equals(value) ? exists(field) : mustNot(exists(field));
      case NULL -> mustNot(exists(field));
      case NOTNULL -> exists(field);
      case LIKE, ILIKE -> caseInsensitive("wildcard", field, likeToWildcard(String.valueOf(value)));
      case CONTAINS -> caseInsensitive("wildcard", field, "*" + escapeWildcard(String.valueOf(value)) + "*");
      case STARTSWITH -> caseInsensitive("prefix", field, String.valueOf(value));
      case ENDSWITH -> caseInsensitive("wildcard", field, "*" + escapeWildcard(String.valueOf(value)));
      case REGEX -> caseInsensitive("regexp", field, String.valueOf(value));
    };
  }

  private ObjectNode matchAll() {
    ObjectNode n = mapper.createObjectNode();
    n.putObject("match_all");
    return n;
  }

  private ObjectNode leaf(String kind, String field, Object value) {
    ObjectNode n = mapper.createObjectNode();
    n.putObject(kind).set(field, mapper.valueToTree(value));
    return n;
  }

  private ObjectNode range(String field, String op, Object value) {
    ObjectNode n = mapper.createObjectNode();
    n.putObject("range").putObject(field).set(op, mapper.valueToTree(value));
    return n;
  }

  private ObjectNode terms(String field, Object value) {
    ArrayNode values = mapper.createArrayNode();
    if (value instanceof Collection<?> c) {
      for (Object v : c) values.add(mapper.<JsonNode>valueToTree(v));
    } else {
      values.add(mapper.<JsonNode>valueToTree(value));
    }
    ObjectNode n = mapper.createObjectNode();
    n.putObject("terms").set(field, values);
    return n;
  }

  private ObjectNode exists(String field) {
    ObjectNode n = mapper.createObjectNode();
    n.putObject("exists").put("field", field);
    return n;
  }

  private ObjectNode mustNot(JsonNode clause) {
    ObjectNode n = mapper.createObjectNode();
    n.putObject("bool").set("must_not", clause);
    return n;
  }

  private ObjectNode caseInsensitive(String kind, String field, String value) {
    ObjectNode n = mapper.createObjectNode();
    n.putObject(kind).putObject(field).put("value", value).put("case_insensitive", true);
    return n;
  }

  /** SQL-style {@code %}/{@code _} become {@code *}/{@code ?}; literal wildcard characters are escaped. */
  static String likeToWildcard(String like) {
    StringBuilder sb = new StringBuilder(like.length());
    for (char ch : like.toCharArray()) {
      switch (ch) {
        case '%' -> sb.append('*');
        case '_' -> sb.append('?');
        case '*', '?', '\\' -> sb.append('\\').append(ch);
        default -> sb.append(ch);
      }
    }
    return sb.toString();
  }

  static String escapeWildcard(String s) {
    return s.replace("\\", "\\\\").replace("*", "\\*").replace("?", "\\?");
  }
}
