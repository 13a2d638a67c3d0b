package io.intellixity.restquery.jdbc.dialect;

import io.intellixity.restquery.jdbc.SqlStatement;
import io.intellixity.restquery.query.ComparisonOperator;
import io.intellixity.restquery.spi.dialect.NativeDialect;

import java.util.Set;

/** Dialect for JDBC engines (statement rendering only). */
public interface JdbcDialect extends NativeDialect<SqlStatement> {
  /** Operators this dialect can render; feeds the adapter's declared capabilities. */
  Set<ComparisonOperator> filterOperators();
}
