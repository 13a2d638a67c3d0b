package io.intellixity.restquery.jdbc.mysql;

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

final class MySqlDialectTest {
  private final MySqlDialect dialect = new MySqlDialect();

  private static IntermediateQuery convert(String... kv) {
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) params.put(kv[i], kv[i + 1]);
    return new QueryConverter().convert(params, "users", List.of("user"));
  }

  @Test
  void quotesWithBackticks() {
    SqlStatement st = dialect.render(convert("name", "eq.John", "select", "name", "order", "-profile.age", "limit", "10"));
    assertEquals("SELECT `users`.`name` FROM `users` WHERE `name` = ? ORDER BY `profile`.`age` DESC LIMIT 10", st.sql());
    assertEquals(List.of("John"), st.binds());
  }

  @Test
  void regexAndCaseFoldedIlike() {
    assertEquals("SELECT `users`.* FROM `users` WHERE `name` REGEXP ?",
        dialect.render(convert("name", "regex.^J")).sql());
    assertEquals("SELECT `users`.* FROM `users` WHERE LOWER(`name`) LIKE LOWER(?)",
        dialect.render(convert("name", "ilike.j%")).sql());
    assertTrue(dialect.filterOperators().contains(ComparisonOperator.REGEX));
  }

  @Test
  void nullOrderingIsDropped() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withSort(List.of(new SortClause("age", SortClause.Direction.ASC, SortClause.Nulls.LAST)));
    assertEquals("SELECT `users`.* FROM `users` ORDER BY `age` ASC", dialect.render(q).sql());
  }

  @Test
  void backtickInIdentifierIsDoubled() {
    IntermediateQuery q = IntermediateQuery.read("users").withFilter(FilterCondition.of(FieldCondition.eq("a`b", 1)));
    assertTrue(dialect.render(q).sql().endsWith("WHERE `a``b` = ?"));
  }

  @Test
  void executesAgainstMySqlCompatibleDatabase() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:mysql_" + UUID.randomUUID() + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
      s.execute("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64))");
      s.execute("INSERT INTO users VALUES (1, 'Jane'), (2, 'john'), (3, 'Mia')");
    }
    JdbcBackendAdapter adapter = new JdbcBackendAdapter(BackendType.MYSQL, new JdbcHandle("mysql", ds, null), dialect);
    IntermediateQuery q = convert("name", "ilike.J%", "select", "name", "order", "name");
    QueryResult r = adapter.executeQuery(adapter.convertQuery(q), q, ExecutionOptions.defaults());
    assertEquals(List.of(Map.of("name", "Jane"), Map.of("name", "john")), r.data());
    assertEquals("mysql", adapter.name());
  }
}
