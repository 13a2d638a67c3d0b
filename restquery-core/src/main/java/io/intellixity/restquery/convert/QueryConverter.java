package io.intellixity.restquery.convert;

import io.intellixity.restquery.error.MalformedInputException;
import io.intellixity.restquery.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Converts REST parameters into an {@link IntermediateQuery}.
 * <p>
 * Keys are either special ({@code select, order, limit, skip, offset, count}), logical
 * ({@code and, or, not, not.<field>}) or field filters ({@code field=op.value}). Embedded relationship
 * expressions in {@code select} become join stubs resolved later by the join enhancer.
 * <p>
 * Stateless and safe to share; per-call state lives in a {@link Context}.
 */
public final class QueryConverter {
  private static final Logger log = LoggerFactory.getLogger(QueryConverter.class);

  public static final Set<String> SPECIAL_KEYS = Set.of("select", "order", "limit", "skip", "offset", "count");
  public static final String LOOKUP_PREFIX = "look_";

  private static final Pattern EMBED_HEAD = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*\\(");

  public IntermediateQuery convert(QueryParams params, String collection, List<String> roles) {
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(collection, "collection");

    Context ctx = new Context(new IntermediateQuery(collection).withType(QueryType.READ));
    for (String key : params.keys()) {
      String value = params.first(key);
      if (value == null) continue;
      if (SPECIAL_KEYS.contains(key)) {
        applySpecial(ctx, key, value);
      } else if (isLogicalKey(key)) {
        applyLogical(ctx, key, value);
      } else {
        applyFieldFilter(ctx, key, value);
      }
    }

    IntermediateQuery q = ctx.query;
    q.withMetadata(new QueryMetadata(params.asFlatMap(), roles, QueryMetadata.REST_SOURCE, System.currentTimeMillis()));
    if (log.isDebugEnabled()) {
      log.debug("restquery.convert collection={} params={} filter={} joins={} sort={}",
          collection, params.keys().size(), q.filter() != null, q.joins().size(), q.sort().size());
    }
    return q;
  }

  public IntermediateQuery convert(Map<String, String> params, String collection, List<String> roles) {
    return convert(QueryParams.of(params), collection, roles);
  }

  static boolean isLogicalKey(String key) {
    return LogicalOperator.fromToken(key) != null || key.startsWith("not.");
  }

  // ---- special keys ----

  private static void applySpecial(Context ctx, String key, String value) {
    IntermediateQuery q = ctx.query;
    switch (key) {
      case "select" -> parseSelect(ctx, value);
      case "order" -> q.withSort(parseOrder(value));
      case "limit" -> {
        Integer n = parseInt(key, value);
        if (n != null) q.withPagination(pagination(q).withLimit(n));
      }
      case "skip", "offset" -> {
        Integer n = parseInt(key, value);
        if (n != null) q.withPagination(pagination(q).withOffset(n));
      }
      case "count" -> q.withPagination(pagination(q).withCount("true".equals(value) || "exact".equals(value)));
      default -> throw new IllegalStateException("Unhandled special key: " + key);
    }
  }

  private static PaginationClause pagination(IntermediateQuery q) {
    return q.pagination() == null ? PaginationClause.empty() : q.pagination();
  }

  private static Integer parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.debug("restquery.convert dropped key={} reason=not-an-integer", key);
      return null;
    }
  }

  /** {@code "name,-age"} becomes name ascending then age descending. */
  public static List<SortClause> parseOrder(String value) {
    List<SortClause> out = new ArrayList<>();
    for (String part : value.split(",")) {
      String f = part.trim();
      if (f.isEmpty()) continue;
      if (f.startsWith("-")) {
        String name = f.substring(1).trim();
        if (!name.isEmpty()) out.add(SortClause.desc(name));
      } else {
        out.add(SortClause.asc(f));
      }
    }
    return out;
  }

  // ---- select & embeds ----

  private static void parseSelect(Context ctx, String value) {
    String v = value.trim();
    IntermediateQuery q = ctx.query;
    if (v.isEmpty() || SelectClause.WILDCARD.equals(v)) {
      q.withSelect(SelectClause.all());
      return;
    }
    Projection p = new Projection(false);
    parseProjection(ctx, v, p);
    q.withSelect(new SelectClause(p.fields, null, p.aliases, null));
    List<JoinClause> joins = new ArrayList<>(q.joins());
    joins.addAll(p.joins);
    q.withJoins(joins);
  }

  private static void parseProjection(Context ctx, String expr, Projection out) {
    for (String token : ExpressionTokenizer.splitTopLevel(expr)) {
      if (out.embedded && isLogicalToken(token)) {
        FilterCondition f = parseLogicalToken(token);
        if (f != null) out.filters.add(f);
        continue;
      }
      if (isEmbedToken(token)) {
        JoinClause j = parseEmbed(ctx, token);
        if (j == null) {
          log.debug("restquery.convert dropped embed token reason=unbalanced");
          continue;
        }
        out.joins.add(j);
        out.fields.add(j.outputName() + "." + SelectClause.WILDCARD);
        continue;
      }
      if (out.embedded && token.indexOf('=') > 0) {
        FieldCondition c = parseFieldCondition(token);
        if (c != null) out.filters.add(FilterCondition.of(c));
        continue;
      }
      addPlainField(token, out);
    }
  }

  static boolean isEmbedToken(String token) {
    return !ExpressionTokenizer.isQuoted(token)
        && EMBED_HEAD.matcher(token).find()
        && token.endsWith(")");
  }

  private static JoinClause parseEmbed(Context ctx, String token) {
    if (ctx == null || ctx.query == null) {
      throw new MalformedInputException("No query under construction while parsing embedded relationship", token);
    }
    int open = token.indexOf('(');
    int close = ExpressionTokenizer.matchingClose(token, open);
    if (close != token.length() - 1) return null;

    String name = token.substring(0, open);
    String relationName = name.startsWith(LOOKUP_PREFIX) ? name.substring(LOOKUP_PREFIX.length()) : name;

    Projection inner = new Projection(true);
    parseProjection(ctx, token.substring(open + 1, close), inner);

    FilterCondition filter = switch (inner.filters.size()) {
      case 0 -> null;
      case 1 -> inner.filters.get(0);
      default -> new FilterCondition(LogicalOperator.AND, null, inner.filters);
    };
    SelectClause select = inner.fields.isEmpty() ? null : new SelectClause(inner.fields, null, inner.aliases, null);

    return JoinClause.stub(relationName, relationName, name)
        .withSelect(select)
        .withFilter(filter)
        .withJoins(inner.joins);
  }

  private static void addPlainField(String token, Projection out) {
    String f = token;
    int cast = f.indexOf("::");
    if (cast >= 0) f = f.substring(0, cast);
    int arrow = f.indexOf("->");
    if (arrow >= 0) f = f.substring(0, arrow);
    int colon = f.indexOf(':');
    if (colon > 0) {
      String alias = f.substring(0, colon).trim();
      String source = f.substring(colon + 1).trim();
      if (source.isEmpty()) return;
      out.aliases.put(alias, source);
      out.fields.add(source);
      return;
    }
    f = f.trim();
    if (!f.isEmpty()) out.fields.add(f);
  }

  // ---- logical operators ----

  private static void applyLogical(Context ctx, String key, String value) {
    FilterCondition node;
    if (key.startsWith("not.")) {
      node = parseNegatedKey(key.substring(4), value);
    } else {
      node = parseLogicalGroup(LogicalOperator.fromToken(key), value);
    }
    if (node == null || node.isEmpty()) {
      log.debug("restquery.convert dropped logical key={} reason=unparseable", key);
      return;
    }
    FilterCondition prev = ctx.query.filter();
    ctx.query.withFilter(prev == null ? node : new FilterCondition(LogicalOperator.AND, null, List.of(prev, node)));
  }

  /** {@code not.age=gt.25} or {@code not.or=(a.eq.1,b.eq.2)}. */
  private static FilterCondition parseNegatedKey(String rest, String value) {
    LogicalOperator inner = LogicalOperator.fromToken(rest);
    if (inner != null) {
      FilterCondition group = parseLogicalGroup(inner, value);
      return group == null ? null : new FilterCondition(LogicalOperator.NOT, null, List.of(group));
    }
    FieldCondition c = parseOperatorValue(rest, value);
    return c == null ? null : new FilterCondition(LogicalOperator.NOT, List.of(c), null);
  }

  /** Parses {@code (item,item,...)} where items are field conditions or nested {@code and(...)}-style groups. */
  static FilterCondition parseLogicalGroup(LogicalOperator op, String value) {
    if (op == null || value == null) return null;
    List<FieldCondition> conditions = new ArrayList<>();
    List<FilterCondition> nested = new ArrayList<>();
    for (String item : ExpressionTokenizer.splitTopLevel(ExpressionTokenizer.stripOuterParens(value))) {
      FilterCondition group = parseNestedGroup(item);
      if (group != null) {
        nested.add(group);
        continue;
      }
      FieldCondition c = parseFieldCondition(item);
      if (c != null) conditions.add(c);
      else log.debug("restquery.convert dropped logical item reason=unparseable");
    }
    return new FilterCondition(op, conditions, nested);
  }

  /** {@code and(...)}, {@code or(...)}, {@code not(...)}, {@code not.and(...)}; null for anything else. */
  private static FilterCondition parseNestedGroup(String item) {
    boolean negate = false;
    String s = item;
    if (s.startsWith("not.")) {
      negate = true;
      s = s.substring(4);
    }
    int open = s.indexOf('(');
    if (open <= 0 || !s.endsWith(")")) return null;
    LogicalOperator op = LogicalOperator.fromToken(s.substring(0, open));
    if (op == null || ExpressionTokenizer.matchingClose(s, open) != s.length() - 1) return null;
    FilterCondition group = parseLogicalGroup(op, s.substring(open));
    return negate ? new FilterCondition(LogicalOperator.NOT, null, List.of(group)) : group;
  }

  private static boolean isLogicalToken(String token) {
    int eq = token.indexOf('=');
    if (eq > 0 && isLogicalKey(token.substring(0, eq))) return true;
    int open = token.indexOf('(');
    return open > 0 && LogicalOperator.fromToken(token.substring(0, open)) != null && token.endsWith(")");
  }

  /** {@code or=(...)} or {@code or(...)} inside an embed. */
  private static FilterCondition parseLogicalToken(String token) {
    int eq = token.indexOf('=');
    int open = token.indexOf('(');
    if (eq > 0 && (open < 0 || eq < open)) {
      String key = token.substring(0, eq);
      String value = token.substring(eq + 1);
      if (key.startsWith("not.")) return parseNegatedKey(key.substring(4), value);
      return parseLogicalGroup(LogicalOperator.fromToken(key), value);
    }
    return parseNestedGroup(token);
  }

  // ---- field filters ----

  private static void applyFieldFilter(Context ctx, String key, String value) {
    FieldCondition c = parseOperatorValue(key, value);
    if (c == null && value.isEmpty()) c = parseFieldCondition(key);
    if (c == null) {
      log.debug("restquery.convert dropped filter key={} reason=unparseable", key);
      return;
    }
    FilterCondition prev = ctx.query.filter();
    FilterCondition next;
    if (prev == null) {
      next = FilterCondition.of(c);
    } else if (prev.isPlainConjunction()) {
      next = prev.withCondition(c);
    } else {
      next = new FilterCondition(LogicalOperator.AND, List.of(c), List.of(prev));
    }
    ctx.query.withFilter(next);
  }

  /**
   * Parses {@code field=op.value} or {@code field.op.value}; the operator is the first dot segment after the
   * field that names a known operator, so dotted field paths survive. Returns null when unparseable.
   */
  public static FieldCondition parseFieldCondition(String expr) {
    if (expr == null) return null;
    String s = expr.trim();
    int eq = s.indexOf('=');
    if (eq > 0 && eq < firstGroupingChar(s)) {
      return parseOperatorValue(s.substring(0, eq).trim(), s.substring(eq + 1));
    }

    String[] parts = s.split("\\.", -1);
    for (int i = 1; i < parts.length - 1; i++) {
      ComparisonOperator op = ComparisonOperator.fromToken(parts[i]);
      if (op == null) continue;
      String field = String.join(".", Arrays.copyOfRange(parts, 0, i));
      String value = String.join(".", Arrays.copyOfRange(parts, i + 1, parts.length));
      return condition(field, op, value);
    }
    return null;
  }

  /** Position of the first parenthesis or quote, or the string length when there is none. */
  private static int firstGroupingChar(String s) {
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '(' || ch == '"' || ch == '\'') return i;
    }
    return s.length();
  }

  /** {@code ("age", "gt.25")} becomes {@code age gt 25}. */
  static FieldCondition parseOperatorValue(String field, String opValue) {
    if (field == null || field.isBlank() || opValue == null) return null;
    int dot = opValue.indexOf('.');
    if (dot <= 0) return null;
    ComparisonOperator op = ComparisonOperator.fromToken(opValue.substring(0, dot));
    if (op == null) return null;
    return condition(field.trim(), op, opValue.substring(dot + 1));
  }

  private static FieldCondition condition(String field, ComparisonOperator op, String rawValue) {
    if (field.isEmpty()) return null;
    Object value = ValueCoercion.parse(rawValue);
    if (op.isSetOperator() && !(value instanceof List<?>)) {
      value = value == null ? List.of() : List.of(value);
    }
    return new FieldCondition(field, op, value);
  }

  /** Per-call conversion state. */
  private static final class Context {
    private final IntermediateQuery query;

    private Context(IntermediateQuery query) {
      this.query = query;
    }
  }

  private static final class Projection {
    private final boolean embedded;
    private final List<String> fields = new ArrayList<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final List<JoinClause> joins = new ArrayList<>();
    private final List<FilterCondition> filters = new ArrayList<>();

    private Projection(boolean embedded) {
      this.embedded = embedded;
    }
  }
}
