package io.intellixity.restquery.jdbc;

import io.intellixity.restquery.compile.JoinEnhancer;
import io.intellixity.restquery.convert.QueryConverter;
import io.intellixity.restquery.error.AdapterException;
import io.intellixity.restquery.error.ErrorCode;
import io.intellixity.restquery.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.relation.Cardinality;
import io.intellixity.restquery.relation.RelationshipDefinition;
import io.intellixity.restquery.relation.RelationshipRegistry;
import io.intellixity.restquery.spi.exec.*;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcBackendAdapterTest {
  private static final class StandardDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "standard"; }

    @Override
    protected String quoteIdent(String ident) {
      return "\"" + ident.replace("\"", "\"\"") + "\"";
    }
  }

  private static final RelationshipRegistry REGISTRY = new RelationshipRegistry(Map.of(
      "users", List.of(RelationshipDefinition.of("posts", "posts", "id", "user_id", Cardinality.ONE_TO_MANY)),
      "posts", List.of(new RelationshipDefinition("tags", "tags", "id", "id", Cardinality.MANY_TO_MANY,
          new JunctionConfig("post_tags", "post_id", "tag_id")))));

  private JdbcBackendAdapter adapter;

  @BeforeEach
  void setUp() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:restquery_" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
      s.execute("CREATE TABLE users (id INT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, name VARCHAR(64), age INT)");
      s.execute("CREATE TABLE posts (id INT PRIMARY KEY, user_id INT, title VARCHAR(128))");
      s.execute("CREATE TABLE tags (id INT PRIMARY KEY, name VARCHAR(32))");
      s.execute("CREATE TABLE post_tags (post_id INT, tag_id INT)");
      s.execute("INSERT INTO users (id, name, age) VALUES (1, 'Ann', 31), (2, 'Bob', 22), (3, 'Cid', 45)");
      s.execute("ALTER TABLE users ALTER COLUMN id RESTART WITH 100");
      s.execute("INSERT INTO posts (id, user_id, title) VALUES (10, 1, 'Hello'), (11, 1, 'Again'), (12, 3, 'Notes')");
      s.execute("INSERT INTO tags (id, name) VALUES (1, 'java'), (2, 'sql')");
      s.execute("INSERT INTO post_tags (post_id, tag_id) VALUES (10, 1), (10, 2), (12, 2)");
    }
    adapter = new JdbcBackendAdapter(BackendType.POSTGRESQL, new JdbcHandle("h2", ds, null), new StandardDialect());
  }

  private static IntermediateQuery convert(String collection, String... kv) {
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) params.put(kv[i], kv[i + 1]);
    return new JoinEnhancer(REGISTRY).enhance(new QueryConverter().convert(params, collection, List.of("user")));
  }

  private QueryResult run(IntermediateQuery q) {
    return adapter.executeQuery(adapter.convertQuery(q), q, ExecutionOptions.defaults());
  }

  @Test
  void readsFilteredSortedPage() {
    QueryResult r = run(convert("users", "age", "gt.25", "select", "name,age", "order", "-age", "limit", "1"));
    assertEquals(List.of(Map.of("name", "Cid", "age", 45)), r.data());
    assertEquals("postgresql", r.metadata().adapter());
    assertNotNull(r.metadata().executionTime());
    assertEquals(new PaginationInfo(0, 1, null, true), r.pagination());
  }

  @Test
  void oneToManyJoinReturnsPrefixedColumns() {
    QueryResult r = run(convert("users", "name", "eq.Ann", "select", "name,posts(title)", "order", "posts.title"));
    assertEquals(2, r.data().size());
    assertEquals("Again", r.data().get(0).get("posts.title"));
    assertEquals("Hello", r.data().get(1).get("posts.title"));
    assertEquals("Ann", r.data().get(1).get("name"));
  }

  @Test
  void manyToManyJoinNeverLeaksJunctionColumns() {
    QueryResult r = run(convert("posts", "id", "eq.10", "select", "title,tags(name)", "order", "tags.name"));
    assertEquals(2, r.data().size());
    for (Map<String, Object> row : r.data()) {
      assertEquals(Set.of("title", "tags.name"), row.keySet());
    }
    assertEquals(List.of("java", "sql"), r.data().stream().map(row -> row.get("tags.name")).toList());
  }

  @Test
  void allowedRelationPathsWithoutAnEmbedAreIgnored() {
    IntermediateQuery q = convert("users", "name", "eq.Ann")
        .withSelect(SelectClause.of(List.of("name", "posts.title", "posts.*")));
    QueryResult r = run(q);
    assertEquals(List.of(Map.of("name", "Ann")), r.data());
  }

  @Test
  void embedWithoutFieldListKeepsRootColumns() {
    QueryResult r = run(convert("users", "name", "eq.Ann", "select", "id,name,posts()", "order", "posts.title"));
    assertEquals(2, r.data().size());
    for (Map<String, Object> row : r.data()) {
      assertEquals(1, row.get("id"));
      assertEquals("Ann", row.get("name"));
      assertEquals(1, row.get("posts.user_id"));
      assertFalse(row.containsKey("user_id"), row.toString());
      assertFalse(row.containsKey("posts.*"), row.toString());
    }
    assertEquals(List.of(11, 10), r.data().stream().map(row -> row.get("posts.id")).toList());
    assertEquals(List.of("Again", "Hello"), r.data().stream().map(row -> row.get("posts.title")).toList());
  }

  @Test
  void pathIdsAreBoundAsNumbers() {
    assertEquals(1, adapter.idValue("1"));
    assertEquals(5_000_000_000L, adapter.idValue("5000000000"));
    assertEquals("abc", adapter.idValue("abc"));
    assertEquals(7, adapter.idValue(7));

    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(FilterCondition.of(FieldCondition.eq(adapter.idField(), adapter.idValue("3"))))
        .withSelect(SelectClause.of(List.of("name")));
    SqlStatement st = adapter.convertQuery(q);
    assertEquals(List.of(3), st.binds());
    assertEquals(List.of(Map.of("name", "Cid")), run(q).data());
  }

  @Test
  void insertReturnsPayloadWithGeneratedKey() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", "Dan");
    data.put("age", 28);
    QueryResult r = run(new IntermediateQuery("users").withType(QueryType.INSERT).withData(data));
    assertEquals(1L, r.metadata().insertedCount());
    assertEquals("Dan", r.data().get(0).get("name"));
    assertEquals(1, run(convert("users", "name", "eq.Dan")).data().size());
  }

  @Test
  void updateAndDeleteReportCounts() {
    QueryResult upd = run(new IntermediateQuery("users").withType(QueryType.UPDATE)
        .withData(Map.of("name", "Bo")).withFilters(List.of(FieldCondition.eq("id", 2))));
    assertEquals(1L, upd.metadata().modifiedCount());
    assertEquals(1L, upd.metadata().matchedCount());

    QueryResult del = run(new IntermediateQuery("users").withType(QueryType.DELETE)
        .withFilters(List.of(FieldCondition.eq("id", 2))));
    assertEquals(1L, del.metadata().deletedCount());
    assertTrue(run(convert("users", "id", "eq.2")).data().isEmpty());
  }

  @Test
  void driverFailureIsWrappedWithBackendName() {
    IntermediateQuery q = IntermediateQuery.read("missing_table");
    AdapterException ex = assertThrows(AdapterException.class, () -> run(q));
    assertEquals(ErrorCode.ADP_EXECUTION_FAILED, ex.code());
    assertTrue(ex.getMessage().startsWith("PostgreSQL query execution failed: "), ex.getMessage());
    assertInstanceOf(SQLException.class, ex.getCause());
  }

  @Test
  void capabilitiesFollowTheDialect() {
    assertEquals("id", adapter.idField());
    assertEquals("postgresql@1.0.0", adapter.key());
    assertFalse(adapter.getCapabilities().filterOperators().contains(ComparisonOperator.REGEX));
    assertTrue(adapter.getCapabilities().joinTypes().contains(JoinType.MANY_TO_MANY));
    assertFalse(adapter.getCapabilities().joinTypes().contains(JoinType.LOOKUP));

    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(FilterCondition.of(new FieldCondition("name", ComparisonOperator.REGEX, "^A")));
    ValidationResult v = adapter.validateQuery(q);
    assertFalse(v.valid());
    assertEquals(ValidationError.UNSUPPORTED_OPERATOR, v.errors().get(0).code());
  }
}
