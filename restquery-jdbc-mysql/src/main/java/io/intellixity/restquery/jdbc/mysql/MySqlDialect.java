package io.intellixity.restquery.jdbc.mysql;

import io.intellixity.restquery.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.restquery.jdbc.dialect.JdbcDialect;
import io.intellixity.restquery.query.ComparisonOperator;
import io.intellixity.restquery.query.SortClause;

import java.util.EnumSet;
import java.util.Set;

/**
 * MySQL dialect implementation for JDBC.
 *
 * Keeps only MySQL-specific overrides: backtick quoting, {@code REGEXP}, and no {@code NULLS FIRST/LAST}.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class MySqlDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "mysql"; }

  @Override
  public Set<ComparisonOperator> filterOperators() {
    return EnumSet.allOf(ComparisonOperator.class);
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected String renderRegex(String expr, String pattern, boolean not, RenderCtx ctx) {
    String sql = expr + " REGEXP " + ctx.add(pattern);
    return not ? "NOT (" + sql + ")" : sql;
  }

  /** MySQL sorts nulls first ascending and has no explicit null-ordering clause. */
  @Override
  protected String sortItem(SortClause s, String qualifier) {
    return super.sortItem(new SortClause(s.field(), s.direction(), null), qualifier);
  }
}
