package io.intellixity.restquery.jdbc;

import io.intellixity.restquery.convert.ValueCoercion;
import io.intellixity.restquery.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.restquery.jdbc.dialect.JdbcDialect;
import io.intellixity.restquery.query.AggregationType;
import io.intellixity.restquery.query.IntermediateQuery;
import io.intellixity.restquery.query.JoinType;
import io.intellixity.restquery.query.QueryType;
import io.intellixity.restquery.spi.exec.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * Relational backend adapter over a {@link javax.sql.DataSource}.
 * <p>
 * One adapter class serves every JDBC database; the {@link JdbcDialect} decides the SQL and the {@link BackendType}
 * names the backend. Each call borrows a connection from the pool and returns it. Statement timeouts come from
 * {@link ExecutionOptions}.
 */
public final class JdbcBackendAdapter extends AbstractBackendAdapter<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackendAdapter.class);

  public static final String VERSION = "1.0.0";

  private final BackendType type;
  private final BackendCapabilities capabilities;

  public JdbcBackendAdapter(BackendType type, JdbcHandle handle, JdbcDialect dialect, QueryValidationStrategy validation) {
    super(Objects.requireNonNull(type, "type").token(), VERSION, dialect, handle, validation);
    this.type = type;
    this.capabilities = new BackendCapabilities(
        dialect.filterOperators(),
        EnumSet.of(JoinType.INNER, JoinType.LEFT, JoinType.RIGHT, JoinType.CROSS,
            JoinType.ONE_TO_ONE, JoinType.ONE_TO_MANY, JoinType.MANY_TO_ONE, JoinType.MANY_TO_MANY),
        EnumSet.allOf(AggregationType.class),
        EnumSet.allOf(QueryType.class),
        true, true, true, 50, 100_000);
  }

  public JdbcBackendAdapter(BackendType type, JdbcHandle handle, JdbcDialect dialect) {
    this(type, handle, dialect, null);
  }

  @Override
  public BackendType type() {
    return type;
  }

  @Override
  public BackendCapabilities getCapabilities() {
    return capabilities;
  }

  @Override
  public String idField() {
    return "id";
  }

  /** Path ids arrive as text; numeric keys are bound as numbers so typed drivers compare them. */
  @Override
  public Object idValue(Object id) {
    return id instanceof String s ? ValueCoercion.coerce(s) : id;
  }

  @Override
  protected BackendResult doExecute(SqlStatement ss, IntermediateQuery query, ExecutionOptions options)
      throws SQLException {
    JdbcHandle h = handle();
    try (Connection c = h.client().getConnection()) {
      if (h.schema() != null) c.setSchema(h.schema());
      long start = System.nanoTime();
      String op = opName(ss, query);
      debugSql(op, ss);
      int timeoutSeconds = (int) Math.max(1, options.timeoutOrDefault().toSeconds());
      return switch (ss.execKind()) {
        case QUERY -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
            ps.setQueryTimeout(timeoutSeconds);
            bindAll(ps, ss);
            try (ResultSet rs = ps.executeQuery()) {
              List<Map<String, Object>> rows = readRows(rs);
              debugDone(op, ss, rows.size(), System.nanoTime() - start);
              yield BackendResult.rows(rows);
            }
          }
        }
        case UPDATE -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
            ps.setQueryTimeout(timeoutSeconds);
            bindAll(ps, ss);
            long n = ps.executeUpdate();
            debugDone(op, ss, n, System.nanoTime() - start);
            yield (query != null && query.type() == QueryType.DELETE)
                ? BackendResult.deleted(n)
                : BackendResult.updated(n, n);
          }
        }
        case UPDATE_GENERATED_KEYS -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql(), Statement.RETURN_GENERATED_KEYS)) {
            ps.setQueryTimeout(timeoutSeconds);
            bindAll(ps, ss);
            long n = ps.executeUpdate();
            Map<String, Object> row = new LinkedHashMap<>();
            if (query != null && query.data() != null) row.putAll(query.data());
            try (ResultSet keys = ps.getGeneratedKeys()) {
              if (keys != null && keys.next()) {
                ResultSetMetaData md = keys.getMetaData();
                for (int i = 1; i <= md.getColumnCount(); i++) row.put(md.getColumnLabel(i), keys.getObject(i));
              }
            }
            debugDone(op, ss, n, System.nanoTime() - start);
            yield BackendResult.inserted(List.of(row), n);
          }
        }
      };
    }
  }

  /**
   * Reads rows keyed by column label. A {@code alias.*} marker column is skipped and the columns after it are keyed
   * {@code alias.column}, so joined columns never overwrite root columns of the same name.
   */
  private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    String[] keys = new String[cols + 1];
    String prefix = null;
    for (int i = 1; i <= cols; i++) {
      String label = md.getColumnLabel(i);
      if (label.endsWith(AbstractJdbcSqlDialect.STAR_GROUP_SUFFIX)) {
        prefix = label.substring(0, label.length() - 1);
        continue;
      }
      keys[i] = prefix == null ? label : prefix + label;
    }

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= cols; i++) {
        if (keys[i] != null) row.put(keys[i], rs.getObject(i));
      }
      out.add(row);
    }
    return out;
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      Object v = ss.binds().get(i);
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private static String opName(SqlStatement ss, IntermediateQuery query) {
    if (query != null) return query.type().name();
    return ss.execKind() == SqlStatement.ExecKind.QUERY ? "SELECT" : "UPDATE";
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("restquery.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), h.id(), h.schema() == null ? "null" : h.schema(), ss.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("restquery.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private static void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("restquery.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
