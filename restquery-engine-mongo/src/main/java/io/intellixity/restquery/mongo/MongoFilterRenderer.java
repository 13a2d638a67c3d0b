package io.intellixity.restquery.mongo;

import io.intellixity.restquery.query.FieldCondition;
import io.intellixity.restquery.query.FilterCondition;
import io.intellixity.restquery.query.LogicalOperator;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders IR filters to MongoDB query documents.
 * <p>
 * {@code and} becomes {@code $and}, {@code or} becomes {@code $or} and {@code not} becomes {@code $nor} over the
 * conjunction of its direct children. A group with a single child collapses to that child. String values compared
 * against {@code _id} are converted to {@link ObjectId} when they are valid hex ids.
 */
final class MongoFilterRenderer {
  static final String ID_FIELD = "_id";

  private MongoFilterRenderer() {}

  static Document toBson(FilterCondition filter) {
    if (filter == null) return new Document();
    return render(filter);
  }

  /** Flat mutation filters, combined with AND. */
  static Document toBson(List<FieldCondition> filters) {
    if (filters == null || filters.isEmpty()) return new Document();
    List<Document> parts = new ArrayList<>(filters.size());
    for (FieldCondition c : filters) parts.add(condition(c));
    return combine(LogicalOperator.AND, parts);
  }

  private static Document render(FilterCondition f) {
    List<Document> parts = new ArrayList<>();
    for (FieldCondition c : f.conditions()) parts.add(condition(c));
    for (FilterCondition n : f.nested()) {
      Document d = render(n);
      if (!d.isEmpty()) parts.add(d);
    }
    if (f.effectiveOperator() == LogicalOperator.NOT) {
      Document positive = combine(LogicalOperator.AND, parts);
      return positive.isEmpty() ? positive : new Document("$nor", List.of(positive));
    }
    return combine(f.effectiveOperator(), parts);
  }

  private static Document combine(LogicalOperator op, List<Document> parts) {
    if (parts.isEmpty()) return new Document();
    if (parts.size() == 1) return parts.get(0);
    return new Document(op == LogicalOperator.OR ? "$or" : "$and", parts);
  }

  static Document condition(FieldCondition c) {
    String f = c.field();
    Object v = value(f, c.value());
    return switch (c.operator()) {
      case EQ -> new Document(f, v);
      case NEQ -> new Document(f, new Document("$ne", v));
      case GT -> new Document(f, new Document("$gt", v));
      case GTE -> new Document(f, new Document("$gte", v));
      case LT -> new Document(f, new Document("$lt", v));
      case LTE -> new Document(f, new Document("$lte", v));
      case IN -> new Document(f, new Document("$in", toList(f, c.value())));
      case NIN -> new Document(f, new Document("$nin", toList(f, c.value())));
      case LIKE, ILIKE -> regex(f, likeToRegex(String.valueOf(c.value())));
      case CONTAINS -> regex(f, Pattern.quote(String.valueOf(c.value())));
      case STARTSWITH -> regex(f, "^" + Pattern.quote(String.valueOf(c.value())));
      case ENDSWITH -> regex(f, Pattern.quote(String.valueOf(c.value())) + "$");
      case REGEX -> regex(f, String.valueOf(c.value()));
      case EXISTS -> new Document(f, new Document("$exists", Boolean.TRUE.equals(c.value())));
      case NULL -> new Document(f, null);
      case NOTNULL -> new Document(f, new Document("$ne", null));
    };
  }

  private static Document regex(String field, String pattern) {
    return new Document(field, new Document("$regex", pattern).append("$options", "i"));
  }

  /** SQL LIKE to an anchored regex: {@code %} becomes {@code .*}, {@code _} becomes {@code .}, the rest is literal. */
  static String likeToRegex(String like) {
    StringBuilder re = new StringBuilder("^");
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < like.length(); i++) {
      char ch = like.charAt(i);
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          re.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        re.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) re.append(Pattern.quote(literal.toString()));
    return re.append('$').toString();
  }

  private static List<Object> toList(String field, Object v) {
    if (v == null) return List.of();
    List<Object> out = new ArrayList<>();
    if (v instanceof Collection<?> c) {
      for (Object o : c) out.add(value(field, o));
    } else {
      out.add(value(field, v));
    }
    return out;
  }

  static Object value(String field, Object v) {
    if (ID_FIELD.equals(field) && v instanceof String s && ObjectId.isValid(s)) return new ObjectId(s);
    return v;
  }
}
