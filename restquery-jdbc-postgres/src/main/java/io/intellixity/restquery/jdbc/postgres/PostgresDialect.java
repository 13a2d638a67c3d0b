package io.intellixity.restquery.jdbc.postgres;

import io.intellixity.restquery.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.restquery.jdbc.dialect.JdbcDialect;
import io.intellixity.restquery.query.ComparisonOperator;

import java.util.EnumSet;
import java.util.Set;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides: {@code ILIKE} and the case-insensitive {@code ~*} regex match.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public Set<ComparisonOperator> filterOperators() {
    return EnumSet.allOf(ComparisonOperator.class);
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String renderIlike(String expr, String pattern, boolean not, RenderCtx ctx) {
    String sql = expr + " ILIKE " + ctx.add(pattern);
    return not ? "NOT (" + sql + ")" : sql;
  }

  @Override
  protected String renderRegex(String expr, String pattern, boolean not, RenderCtx ctx) {
    String sql = expr + " ~* " + ctx.add(pattern);
    return not ? "NOT (" + sql + ")" : sql;
  }

  @Override
  protected String applyLimitOffset(String sql, int limit, int offset) {
    return sql + " LIMIT " + limit + " OFFSET " + offset;
  }
}
