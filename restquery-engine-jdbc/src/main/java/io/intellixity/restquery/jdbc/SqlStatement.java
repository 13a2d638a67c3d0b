package io.intellixity.restquery.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Parameterized SQL with positional {@code ?} binds in text order. */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (SELECT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (UPDATE/DELETE). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate() + getGeneratedKeys() (INSERT). */
    UPDATE_GENERATED_KEYS
  }

  public SqlStatement {
    // binds may legitimately contain null values
    binds = binds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
