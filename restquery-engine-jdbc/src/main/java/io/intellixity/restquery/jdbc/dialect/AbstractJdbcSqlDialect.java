package io.intellixity.restquery.jdbc.dialect;

import io.intellixity.restquery.jdbc.SqlStatement;
import io.intellixity.restquery.jdbc.SqlStatement.ExecKind;
import io.intellixity.restquery.query.*;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * - reads: SELECT list, FROM + one JOIN per join (two for many-to-many), WHERE, GROUP BY, ORDER BY, LIMIT/OFFSET
 * - mutations: INSERT/UPDATE/DELETE from the IR payload and flat filters
 *
 * Values are never interpolated; every literal becomes a positional {@code ?} bind. DB-specific dialects override
 * hooks for quoting, paging, case-insensitive matching and regular expressions.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  /** Prefix of the alias given to a many-to-many junction table. */
  public static final String JUNCTION_ALIAS_PREFIX = "_junction_";

  /**
   * Label suffix of the marker column rendered ahead of a joined table's {@code alias.*} columns. Columns after a
   * {@code alias.*} label belong to that join and are read back as {@code alias.column}.
   */
  public static final String STAR_GROUP_SUFFIX = ".*";

  protected static final class RenderCtx {
    private final List<Object> binds = new ArrayList<>();
    private final List<Map.Entry<FilterCondition, String>> whereFilters = new ArrayList<>();

    public String add(Object value) {
      binds.add(value);
      return "?";
    }

    public List<Object> binds() {
      return binds;
    }

    /** Join filter with no ON clause to attach to; rendered into WHERE qualified by {@code alias}. */
    void deferToWhere(FilterCondition filter, String alias) {
      whereFilters.add(Map.entry(filter, alias));
    }
  }

  @Override
  public Set<ComparisonOperator> filterOperators() {
    return EnumSet.complementOf(EnumSet.of(ComparisonOperator.REGEX));
  }

  @Override
  public final SqlStatement render(IntermediateQuery q) {
    Objects.requireNonNull(q, "query");
    return switch (q.type()) {
      case READ -> renderSelect(q);
      case INSERT -> renderInsert(q);
      case UPDATE -> renderUpdate(q);
      case DELETE -> renderDelete(q);
    };
  }

  protected SqlStatement renderSelect(IntermediateQuery q) {
    RenderCtx ctx = new RenderCtx();
    String root = q.collection();
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", selectItems(q)))
        .append(" FROM ")
        .append(quotePath(root));
    for (JoinClause j : q.joins()) appendJoin(sql, root, j, ctx);

    // bare root columns are qualified once joins make them ambiguous
    String qualifier = q.joins().isEmpty() ? null : root;
    String where = q.filter() != null
        ? renderPredicate(q.filter(), qualifier, ctx)
        : renderConjunction(q.filters(), qualifier, ctx);
    if (!ctx.whereFilters.isEmpty()) {
      List<String> conjuncts = new ArrayList<>();
      if (!where.isBlank()) conjuncts.add("(" + where + ")");
      for (var e : ctx.whereFilters) {
        String f = renderPredicate(e.getKey(), e.getValue(), ctx);
        if (!f.isBlank()) conjuncts.add("(" + f + ")");
      }
      where = String.join(" AND ", conjuncts);
    }
    if (!where.isBlank()) sql.append(" WHERE ").append(where);

    if (!q.aggregations().isEmpty() && !q.groupBy().isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", q.groupBy().stream().map(this::quotePath).toList()));
    }

    if (!q.sort().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (SortClause s : q.sort()) parts.add(sortItem(s, qualifier));
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    // offset without a limit is not honoured
    Integer limit = q.limit();
    String out = sql.toString();
    if (limit != null && limit > 0) out = applyLimitOffset(out, limit, q.offset());
    return new SqlStatement(out, ctx.binds(), ExecKind.QUERY);
  }

  /**
   * SELECT items: aggregates with their group keys, or the projection plus the fields requested on joins.
   * Dotted paths are emitted only when their first segment is the root table or a join alias in this query; a
   * joined table's {@code alias.*} columns come last, each group behind a {@code NULL AS "alias.*"} marker.
   */
  protected List<String> selectItems(IntermediateQuery q) {
    String root = q.collection();
    List<String> items = new ArrayList<>();
    if (!q.aggregations().isEmpty()) {
      for (String g : q.groupBy()) items.add(quotePath(g));
      for (AggregationClause a : q.aggregations()) items.add(aggregate(a) + " AS " + quoteIdent(a.alias()));
      return items;
    }

    Set<String> aliases = new HashSet<>();
    Set<String> projectedJoins = new HashSet<>();
    for (JoinClause j : q.joins()) collectJoinAliases(j, aliases, projectedJoins);
    aliases.add(root);

    List<String> starGroups = new ArrayList<>();
    SelectClause select = q.select();
    if (select == null || select.fields().isEmpty()) {
      items.add(quoteIdent(root) + ".*");
    } else {
      for (String f : select.fields()) {
        if (SelectClause.WILDCARD.equals(f)) {
          items.add(quoteIdent(root) + ".*");
        } else if (SelectClause.isWildcard(f)) {
          // embed marker; a join with its own field list is projected from that list instead
          String alias = f.substring(0, f.length() - STAR_GROUP_SUFFIX.length());
          if (alias.equals(root)) items.add(quoteIdent(root) + ".*");
          else if (aliases.contains(alias) && !projectedJoins.contains(alias)) addStarGroup(starGroups, alias);
        } else if (f.contains(".")) {
          if (selectable(f, aliases)) items.add(quotePath(f) + " AS " + quoteIdent(f));
        } else {
          items.add(quotePath(root + "." + f));
        }
      }
    }
    if (select != null) {
      select.aliases().forEach((alias, source) -> {
        if (!source.contains(".")) items.add(quotePath(root + "." + source) + " AS " + quoteIdent(alias));
        else if (selectable(source, aliases)) items.add(quotePath(source) + " AS " + quoteIdent(alias));
      });
    }
    for (JoinClause j : q.joins()) joinSelectItems(j, projectedJoins, items, starGroups);
    if (items.isEmpty() && starGroups.isEmpty()) items.add(quoteIdent(root) + ".*");
    items.addAll(starGroups);
    return items;
  }

  private static boolean selectable(String path, Set<String> aliases) {
    return aliases.contains(path.substring(0, path.indexOf('.')));
  }

  private void addStarGroup(List<String> starGroups, String alias) {
    starGroups.add("NULL AS " + quoteIdent(alias + STAR_GROUP_SUFFIX));
    starGroups.add(quoteIdent(alias) + ".*");
  }

  private static void collectJoinAliases(JoinClause j, Set<String> aliases, Set<String> projected) {
    aliases.add(j.outputName());
    if (j.select() != null && !j.select().fields().isEmpty()) projected.add(j.outputName());
    for (JoinClause n : j.joins()) collectJoinAliases(n, aliases, projected);
  }

  private void joinSelectItems(JoinClause j, Set<String> projectedJoins, List<String> items, List<String> starGroups) {
    String alias = j.outputName();
    if (j.select() != null) {
      for (String f : j.select().fields()) {
        if (SelectClause.WILDCARD.equals(f)) {
          addStarGroup(starGroups, alias);
        } else if (SelectClause.isWildcard(f)) {
          String nested = f.substring(0, f.length() - STAR_GROUP_SUFFIX.length());
          for (JoinClause n : j.joins()) {
            if (n.outputName().equals(nested) && !projectedJoins.contains(nested)) addStarGroup(starGroups, nested);
          }
        } else {
          String path = alias + "." + f;
          items.add(quotePath(path) + " AS " + quoteIdent(path));
        }
      }
    }
    for (JoinClause n : j.joins()) joinSelectItems(n, projectedJoins, items, starGroups);
  }

  private String aggregate(AggregationClause a) {
    String arg = a.field() == null ? "*" : quotePath(a.field());
    return switch (a.type()) {
      case COUNT -> "COUNT(" + arg + ")";
      case SUM -> "SUM(" + arg + ")";
      case AVG -> "AVG(" + arg + ")";
      case MIN -> "MIN(" + arg + ")";
      case MAX -> "MAX(" + arg + ")";
    };
  }

  /**
   * Appends the JOIN for {@code j} parented at {@code parent}, then its nested joins parented at the join's alias.
   * Many-to-many joins go through the junction table under {@code _junction_<alias>}; junction columns are never
   * selected.
   */
  protected void appendJoin(StringBuilder sql, String parent, JoinClause j, RenderCtx ctx) {
    String alias = j.outputName();
    String keyword = joinKeyword(j.type());
    JunctionConfig junction = j.relationship() == null ? null : j.relationship().junction();

    if (j.type() == JoinType.MANY_TO_MANY && junction != null && !j.on().isEmpty()) {
      JoinCondition on = j.on().get(0);
      String jAlias = JUNCTION_ALIAS_PREFIX + alias;
      sql.append(' ').append(keyword).append(' ').append(quotePath(junction.table()))
          .append(" AS ").append(quoteIdent(jAlias))
          .append(" ON ").append(qualified(parent, on.local()))
          .append(" = ").append(quotePath(jAlias + "." + junction.localKey()));
      sql.append(' ').append(keyword).append(' ').append(quotePath(j.target()))
          .append(" AS ").append(quoteIdent(alias))
          .append(" ON ").append(quotePath(jAlias + "." + junction.foreignKey()))
          .append(" = ").append(qualified(alias, on.foreign()));
    } else {
      sql.append(' ').append(keyword).append(' ').append(quotePath(j.target()));
      if (!alias.equals(j.target())) sql.append(" AS ").append(quoteIdent(alias));
      if (!j.on().isEmpty()) {
        List<String> conds = new ArrayList<>();
        for (JoinCondition c : j.on()) conds.add(qualified(parent, c.local()) + " = " + qualified(alias, c.foreign()));
        sql.append(" ON ").append(String.join(" AND ", conds));
      } else if (j.type() != JoinType.CROSS) {
        throw new IllegalArgumentException("Join '" + alias + "' on '" + j.target() + "' has no join condition");
      }
    }

    if (j.filter() != null) {
      if (j.on().isEmpty()) {
        ctx.deferToWhere(j.filter(), alias);
      } else {
        String f = renderPredicate(j.filter(), alias, ctx);
        if (!f.isBlank()) sql.append(" AND (").append(f).append(')');
      }
    }
    for (JoinClause n : j.joins()) appendJoin(sql, alias, n, ctx);
  }

  private String qualified(String table, String field) {
    return field.contains(".") ? quotePath(field) : quotePath(table + "." + field);
  }

  /** Fixed join-type to keyword map; anything unmapped joins LEFT. */
  protected String joinKeyword(JoinType type) {
    if (type == null) return "LEFT JOIN";
    return switch (type) {
      case INNER, ONE_TO_ONE, MANY_TO_ONE -> "INNER JOIN";
      case LEFT, ONE_TO_MANY -> "LEFT JOIN";
      case RIGHT -> "RIGHT JOIN";
      case CROSS -> "CROSS JOIN";
      default -> "LEFT JOIN";
    };
  }

  protected String sortItem(SortClause s, String qualifier) {
    String sql = column(qualifier, s.field()) + (s.direction() == SortClause.Direction.DESC ? " DESC" : " ASC");
    if (s.nulls() != null) sql += s.nulls() == SortClause.Nulls.FIRST ? " NULLS FIRST" : " NULLS LAST";
    return sql;
  }

  /** Default is {@code LIMIT n [OFFSET m]}; only called when a positive limit is present. */
  protected String applyLimitOffset(String sql, int limit, int offset) {
    String out = sql + " LIMIT " + limit;
    return offset > 0 ? out + " OFFSET " + offset : out;
  }

  protected SqlStatement renderInsert(IntermediateQuery q) {
    Map<String, Object> data = q.data();
    if (data == null || data.isEmpty()) throw new IllegalArgumentException("Insert has no columns");
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    RenderCtx ctx = new RenderCtx();
    for (var e : data.entrySet()) {
      cols.add(quoteIdent(e.getKey()));
      ph.add(ctx.add(e.getValue()));
    }
    String sql = "INSERT INTO " + quotePath(q.collection()) +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE_GENERATED_KEYS);
  }

  /** SQL has no whole-row replace without a schema, so partial and full updates both SET the given columns. */
  protected SqlStatement renderUpdate(IntermediateQuery q) {
    Map<String, Object> data = q.data();
    if (data == null || data.isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (var e : data.entrySet()) sets.add(quoteIdent(e.getKey()) + " = " + ctx.add(e.getValue()));
    String sql = "UPDATE " + quotePath(q.collection()) + " SET " + String.join(", ", sets);
    String where = renderConjunction(q.filters(), null, ctx);
    if (!where.isBlank()) sql += " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderDelete(IntermediateQuery q) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + quotePath(q.collection());
    String where = renderConjunction(q.filters(), null, ctx);
    if (!where.isBlank()) sql += " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  /** Renders a filter tree without outer parentheses; blank when the tree is empty. */
  protected String renderPredicate(FilterCondition f, String qualifier, RenderCtx ctx) {
    return renderFilter(f, qualifier, ctx, false, false);
  }

  private String renderConjunction(List<FieldCondition> conditions, String qualifier, RenderCtx ctx) {
    if (conditions == null || conditions.isEmpty()) return "";
    return renderPredicate(new FilterCondition(LogicalOperator.AND, conditions, null), qualifier, ctx);
  }

  /** Negation is pushed down to the leaves (De Morgan); {@code not} negates the conjunction of its children. */
  private String renderFilter(FilterCondition f, String qualifier, RenderCtx ctx, boolean negate, boolean wrap) {
    if (f == null || f.isEmpty()) return "";
    LogicalOperator op = f.effectiveOperator();
    boolean childNegate = negate;
    if (op == LogicalOperator.NOT) {
      childNegate = !negate;
      op = LogicalOperator.AND;
    }
    boolean or = (op == LogicalOperator.OR) != childNegate;

    List<String> parts = new ArrayList<>();
    for (FieldCondition c : f.conditions()) {
      String s = renderCondition(c, column(qualifier, c.field()), ctx, childNegate);
      if (!s.isBlank()) parts.add(s);
    }
    for (FilterCondition n : f.nested()) {
      String s = renderFilter(n, qualifier, ctx, childNegate, true);
      if (!s.isBlank()) parts.add(s);
    }
    if (parts.isEmpty()) return "";
    if (parts.size() == 1) return parts.get(0);
    String joined = String.join(or ? " OR " : " AND ", parts);
    return wrap ? "(" + joined + ")" : joined;
  }

  private String column(String qualifier, String field) {
    return (qualifier == null || field.contains(".")) ? quotePath(field) : quotePath(qualifier + "." + field);
  }

  protected String renderCondition(FieldCondition c, String expr, RenderCtx ctx, boolean not) {
    Object value = c.value();
    return switch (c.operator()) {
      case EQ -> (value == null) ? nullCheckSql(expr, true, not) : binarySql(expr, "=", value, not, ctx);
      case NEQ -> (value == null) ? nullCheckSql(expr, false, not) : binarySql(expr, "<>", value, not, ctx);
      case GT -> binaryNonNull(expr, ">", value, not, ctx);
      case GTE -> binaryNonNull(expr, ">=", value, not, ctx);
      case LT -> binaryNonNull(expr, "<", value, not, ctx);
      case LTE -> binaryNonNull(expr, "<=", value, not, ctx);
      case IN -> listSql(expr, "IN", toList(value), not, ctx);
      case NIN -> listSql(expr, "NOT IN", toList(value), not, ctx);
      case LIKE -> binaryNonNull(expr, "LIKE", value, not, ctx);
      case ILIKE -> renderIlike(expr, requireValue(c), not, ctx);
      case CONTAINS -> renderIlike(expr, "%" + escapeLike(requireValue(c)) + "%", not, ctx);
      case STARTSWITH -> renderIlike(expr, escapeLike(requireValue(c)) + "%", not, ctx);
      case ENDSWITH -> renderIlike(expr, "%" + escapeLike(requireValue(c)), not, ctx);
      case REGEX -> renderRegex(expr, requireValue(c), not, ctx);
      case EXISTS -> nullCheckSql(expr, !Boolean.TRUE.equals(value), not);
      case NULL -> nullCheckSql(expr, true, not);
      case NOTNULL -> nullCheckSql(expr, false, not);
    };
  }

  /** Case-insensitive LIKE. Default folds both sides to lower case. */
  protected String renderIlike(String expr, String pattern, boolean not, RenderCtx ctx) {
    String sql = "LOWER(" + expr + ") LIKE LOWER(" + ctx.add(pattern) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  /** Regular-expression match. Default throws; dialects with regex support override. */
  protected String renderRegex(String expr, String pattern, boolean not, RenderCtx ctx) {
    throw new IllegalArgumentException("REGEX is not supported by dialect: " + id());
  }

  protected static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String binarySql(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(value);
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String binaryNonNull(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return binarySql(expr, op, value, not, ctx);
  }

  private static String listSql(String expr, String op, List<Object> vals, boolean not, RenderCtx ctx) {
    // "IN ()" matches nothing and "NOT IN ()" everything
    if (vals.isEmpty()) return ("IN".equals(op) != not) ? "1 = 0" : "1 = 1";
    List<String> ph = new ArrayList<>();
    for (Object v : vals) ph.add(ctx.add(v));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String requireValue(FieldCondition c) {
    if (c.value() == null) throw new IllegalArgumentException(c.operator().token() + " requires non-null value");
    return String.valueOf(c.value());
  }

  /** Escapes LIKE wildcards so the value matches literally (backslash escape). */
  protected static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<Object>(c);
    return Collections.singletonList(v);
  }

  /** Quotes each dot-separated segment; {@code *} stays bare. */
  protected String quotePath(String path) {
    String[] parts = path.split("\\.");
    List<String> out = new ArrayList<>(parts.length);
    for (String p : parts) out.add(SelectClause.WILDCARD.equals(p) ? p : quoteIdent(p));
    return String.join(".", out);
  }

  protected abstract String quoteIdent(String ident);
}
