package io.intellixity.restquery.jdbc.postgres;

import io.intellixity.restquery.convert.QueryConverter;
import io.intellixity.restquery.jdbc.JdbcBackendAdapter;
import io.intellixity.restquery.jdbc.JdbcHandle;
import io.intellixity.restquery.jdbc.SqlStatement;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.spi.exec.BackendType;
import io.intellixity.restquery.spi.exec.ExecutionOptions;
import io.intellixity.restquery.spi.exec.QueryResult;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect dialect = new PostgresDialect();

  private static IntermediateQuery convert(String... kv) {
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) params.put(kv[i], kv[i + 1]);
    return new QueryConverter().convert(params, "users", List.of("user"));
  }

  @Test
  void mergesWhereOnDerivedBaseSql() {
    SqlStatement stmt = dialect.render(convert("tenant_id", "eq.tenant-1"));
    assertTrue(stmt.sql().contains("FROM \"users\""));
    assertTrue(stmt.sql().contains("WHERE \"tenant_id\" = ?"));
    assertEquals(List.of("tenant-1"), stmt.binds());
  }

  @Test
  void ilikeAndCaseInsensitiveRegex() {
    assertTrue(dialect.render(convert("name", "ilike.j%")).sql().endsWith("WHERE \"name\" ILIKE ?"));
    assertTrue(dialect.render(convert("name", "regex.^j")).sql().endsWith("WHERE \"name\" ~* ?"));
    assertTrue(dialect.render(convert("name", "endswith.son")).sql().endsWith("WHERE \"name\" ILIKE ?"));
  }

  @Test
  void negatedIlikeIsWrapped() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(FilterCondition.not(new FieldCondition("name", ComparisonOperator.ILIKE, "a%")));
    assertTrue(dialect.render(q).sql().endsWith("WHERE NOT (\"name\" ILIKE ?)"));
  }

  @Test
  void pagesWithLimitAndOffset() {
    assertTrue(dialect.render(convert("limit", "5")).sql().endsWith(" LIMIT 5 OFFSET 0"));
    assertTrue(dialect.render(convert("limit", "5", "offset", "10")).sql().endsWith(" LIMIT 5 OFFSET 10"));
  }

  @Test
  void executesInPostgresCompatibilityMode() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:pg_" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
      s.execute("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64), active BOOLEAN)");
      s.execute("INSERT INTO users VALUES (1, 'Jane', TRUE), (2, 'john', FALSE), (3, 'Mia', TRUE)");
    }
    JdbcBackendAdapter adapter = new JdbcBackendAdapter(BackendType.POSTGRESQL, new JdbcHandle("pg", ds, null), dialect);
    IntermediateQuery q = convert("name", "ilike.j%", "active", "eq.true", "select", "id,name");
    QueryResult r = adapter.executeQuery(adapter.convertQuery(q), q, ExecutionOptions.defaults());
    assertEquals(List.of(Map.of("id", 1, "name", "Jane")), r.data());
  }
}
