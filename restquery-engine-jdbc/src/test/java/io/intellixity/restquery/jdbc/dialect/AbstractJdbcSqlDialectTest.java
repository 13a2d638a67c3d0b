package io.intellixity.restquery.jdbc.dialect;

import io.intellixity.restquery.compile.JoinEnhancer;
import io.intellixity.restquery.convert.QueryConverter;
import io.intellixity.restquery.jdbc.SqlStatement;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.relation.Cardinality;
import io.intellixity.restquery.relation.RelationshipDefinition;
import io.intellixity.restquery.relation.RelationshipRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  static final class StandardDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "standard"; }

    @Override
    protected String quoteIdent(String ident) {
      return "\"" + ident.replace("\"", "\"\"") + "\"";
    }
  }

  private static final RelationshipRegistry REGISTRY = new RelationshipRegistry(Map.of(
      "users", List.of(RelationshipDefinition.of("posts", "posts", "_id", "user_id", Cardinality.ONE_TO_MANY)),
      "posts", List.of(
          RelationshipDefinition.of("author", "users", "user_id", "_id", Cardinality.MANY_TO_ONE),
          RelationshipDefinition.of("comments", "comments", "_id", "post_id", Cardinality.ONE_TO_MANY),
          new RelationshipDefinition("tags", "tags", "_id", "_id", Cardinality.MANY_TO_MANY,
              new JunctionConfig("post_tags", "post_id", "tag_id")))));

  private final StandardDialect dialect = new StandardDialect();

  private static IntermediateQuery convert(String collection, String... kv) {
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) params.put(kv[i], kv[i + 1]);
    return new JoinEnhancer(REGISTRY).enhance(new QueryConverter().convert(params, collection, List.of("user")));
  }

  @Test
  void selectFromRestParameters() {
    SqlStatement st = dialect.render(convert("users",
        "name", "eq.John", "age", "gt.25", "select", "name,email", "order", "-created_at", "limit", "10", "offset", "5"));
    assertEquals("SELECT \"users\".\"name\", \"users\".\"email\" FROM \"users\" WHERE \"name\" = ? AND \"age\" > ?"
        + " ORDER BY \"created_at\" DESC LIMIT 10 OFFSET 5", st.sql());
    assertEquals(List.of("John", 25), st.binds());
    assertEquals(SqlStatement.ExecKind.QUERY, st.execKind());
  }

  @Test
  void nullFilterRendersUnconstrainedSelect() {
    SqlStatement st = dialect.render(IntermediateQuery.read("users"));
    assertEquals("SELECT \"users\".* FROM \"users\"", st.sql());
    assertTrue(st.binds().isEmpty());
  }

  @Test
  void offsetWithoutLimitIsNotHonoured() {
    SqlStatement st = dialect.render(IntermediateQuery.read("users").withPagination(new PaginationClause(20, null, null)));
    assertFalse(st.sql().contains("OFFSET"));
    assertFalse(st.sql().contains("LIMIT"));
  }

  @Test
  void notNegatesTheConjunctionOfItsChildren() {
    IntermediateQuery q = IntermediateQuery.read("users").withFilter(FilterCondition.not(
        FieldCondition.eq("a", 1), FieldCondition.eq("b", 2)));
    assertEquals("SELECT \"users\".* FROM \"users\" WHERE NOT (\"a\" = ?) OR NOT (\"b\" = ?)", dialect.render(q).sql());
  }

  @Test
  void nestedGroupsAreParenthesized() {
    FilterCondition f = new FilterCondition(LogicalOperator.AND,
        List.of(FieldCondition.eq("status", "active")),
        List.of(FilterCondition.or(FieldCondition.eq("role", "admin"), FieldCondition.eq("role", "owner"))));
    SqlStatement st = dialect.render(IntermediateQuery.read("users").withFilter(f));
    assertTrue(st.sql().endsWith("WHERE \"status\" = ? AND (\"role\" = ? OR \"role\" = ?)"), st.sql());
    assertEquals(List.of("active", "admin", "owner"), st.binds());
  }

  @Test
  void operatorTable() {
    RenderCheck c = new RenderCheck();
    assertEquals("\"s\" IN (?, ?)", c.where(new FieldCondition("s", ComparisonOperator.IN, List.of("a", "b"))));
    assertEquals("\"s\" NOT IN (?)", c.where(new FieldCondition("s", ComparisonOperator.NIN, List.of("a"))));
    assertEquals("1 = 0", c.where(new FieldCondition("s", ComparisonOperator.IN, List.of())));
    assertEquals("\"s\" IS NULL", c.where(new FieldCondition("s", ComparisonOperator.NULL, null)));
    assertEquals("\"s\" IS NOT NULL", c.where(new FieldCondition("s", ComparisonOperator.NOTNULL, null)));
    assertEquals("\"s\" IS NOT NULL", c.where(new FieldCondition("s", ComparisonOperator.EXISTS, true)));
    assertEquals("\"s\" IS NULL", c.where(new FieldCondition("s", ComparisonOperator.EXISTS, false)));
    assertEquals("\"s\" IS NULL", c.where(FieldCondition.eq("s", null)));
    assertEquals("\"s\" <> ?", c.where(new FieldCondition("s", ComparisonOperator.NEQ, "x")));
    assertEquals("\"s\" LIKE ?", c.where(new FieldCondition("s", ComparisonOperator.LIKE, "J%")));
    assertEquals("LOWER(\"s\") LIKE LOWER(?)", c.where(new FieldCondition("s", ComparisonOperator.ILIKE, "j%")));
  }

  @Test
  void containsEscapesLikeWildcards() {
    SqlStatement st = dialect.render(IntermediateQuery.read("users").withFilter(
        FilterCondition.of(new FieldCondition("code", ComparisonOperator.CONTAINS, "50%_"))));
    assertTrue(st.sql().endsWith("LOWER(\"code\") LIKE LOWER(?)"));
    assertEquals(List.of("%50\\%\\_%"), st.binds());

    SqlStatement starts = dialect.render(IntermediateQuery.read("users").withFilter(
        FilterCondition.of(new FieldCondition("code", ComparisonOperator.STARTSWITH, "ab"))));
    assertEquals(List.of("ab%"), starts.binds());
  }

  @Test
  void regexIsRejectedByTheGenericDialect() {
    IntermediateQuery q = IntermediateQuery.read("users").withFilter(
        FilterCondition.of(new FieldCondition("name", ComparisonOperator.REGEX, "^J")));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> dialect.render(q));
    assertTrue(ex.getMessage().contains("standard"));
    assertFalse(dialect.filterOperators().contains(ComparisonOperator.REGEX));
  }

  @Test
  void identifiersAreQuotedPerSegment() {
    SqlStatement st = dialect.render(IntermediateQuery.read("users")
        .withSort(List.of(SortClause.asc("posts.created_at")))
        .withFilter(FilterCondition.of(FieldCondition.eq("we\"ird", 1))));
    assertTrue(st.sql().contains("WHERE \"we\"\"ird\" = ?"), st.sql());
    assertTrue(st.sql().endsWith("ORDER BY \"posts\".\"created_at\" ASC"), st.sql());
  }

  @Test
  void oneToManyEmbedBecomesLeftJoin() {
    SqlStatement st = dialect.render(convert("users", "select", "name,posts(title)"));
    assertEquals("SELECT \"users\".\"name\", \"posts\".\"title\" AS \"posts.title\" FROM \"users\""
        + " LEFT JOIN \"posts\" ON \"users\".\"_id\" = \"posts\".\"user_id\"", st.sql());
  }

  @Test
  void manyToOneEmbedBecomesInnerJoinUnderItsAlias() {
    SqlStatement st = dialect.render(convert("posts", "select", "title,author(name)"));
    assertEquals("SELECT \"posts\".\"title\", \"author\".\"name\" AS \"author.name\" FROM \"posts\""
        + " INNER JOIN \"users\" AS \"author\" ON \"posts\".\"user_id\" = \"author\".\"_id\"", st.sql());
  }

  @Test
  void manyToManyJoinsThroughJunctionWithoutSelectingIt() {
    SqlStatement st = dialect.render(convert("posts", "select", "title,tags(name)"));
    String sql = st.sql();
    assertTrue(sql.contains(" LEFT JOIN \"post_tags\" AS \"_junction_tags\" ON \"posts\".\"_id\" = \"_junction_tags\".\"post_id\""), sql);
    assertTrue(sql.contains(" LEFT JOIN \"tags\" AS \"tags\" ON \"_junction_tags\".\"tag_id\" = \"tags\".\"_id\""), sql);
    String selectList = sql.substring(0, sql.indexOf(" FROM "));
    assertFalse(selectList.contains("_junction_"), selectList);
    assertFalse(selectList.contains("post_tags"), selectList);
  }

  @Test
  void nestedJoinIsParentedAtItsEnclosingTarget() {
    SqlStatement st = dialect.render(convert("users", "select", "name,posts(title,comments(text))"));
    assertTrue(st.sql().contains("LEFT JOIN \"comments\" ON \"posts\".\"_id\" = \"comments\".\"post_id\""), st.sql());
    assertTrue(st.sql().contains("\"comments\".\"text\" AS \"comments.text\""), st.sql());
  }

  @Test
  void embedFilterGoesIntoJoinConditionAndBindsInTextOrder() {
    SqlStatement st = dialect.render(convert("users", "age", "gt.25", "select", "name,posts(title,status=eq.published)"));
    assertTrue(st.sql().contains("ON \"users\".\"_id\" = \"posts\".\"user_id\" AND (\"posts\".\"status\" = ?)"), st.sql());
    assertEquals(List.of("published", 25), st.binds());
  }

  @Test
  void relationPathsWithoutAMatchingJoinAreNotSelected() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withSelect(SelectClause.of(List.of("email", "name", "posts.title", "posts.*")));
    assertEquals("SELECT \"users\".\"email\", \"users\".\"name\" FROM \"users\"", dialect.render(q).sql());

    IntermediateQuery onlyRelations = IntermediateQuery.read("users")
        .withSelect(SelectClause.of(List.of("posts.title")));
    assertEquals("SELECT \"users\".* FROM \"users\"", dialect.render(onlyRelations).sql());
  }

  @Test
  void embedWithoutFieldListIsSelectedLastBehindItsMarker() {
    String sql = dialect.render(convert("users", "select", "posts(),name")).sql();
    assertTrue(sql.startsWith("SELECT \"users\".\"name\", NULL AS \"posts.*\", \"posts\".* FROM \"users\""), sql);
  }

  @Test
  void crossJoinFilterIsRenderedIntoWhere() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilters(List.of(FieldCondition.eq("name", "Ann")))
        .withJoins(List.of(new JoinClause(JoinType.CROSS, "regions", null, List.of(),
            SelectClause.of(List.of("code")), FilterCondition.of(FieldCondition.eq("active", true)), null, null)));
    SqlStatement st = dialect.render(q);
    assertEquals("SELECT \"users\".*, \"regions\".\"code\" AS \"regions.code\" FROM \"users\" CROSS JOIN \"regions\""
        + " WHERE (\"users\".\"name\" = ?) AND (\"regions\".\"active\" = ?)", st.sql());
    assertEquals(List.of("Ann", true), st.binds());
  }

  @Test
  void unresolvedStubCannotBeRendered() {
    IntermediateQuery q = new QueryConverter().convert(Map.of("select", "name,ghosts(x)"), "users", List.of("user"));
    assertThrows(IllegalArgumentException.class, () -> dialect.render(q));
  }

  @Test
  void aggregationsRenderFunctionsAndGroupBy() {
    IntermediateQuery q = IntermediateQuery.read("orders")
        .withAggregations(List.of(
            new AggregationClause(AggregationType.COUNT, null, null),
            new AggregationClause(AggregationType.SUM, "amount", null)))
        .withGroupBy(List.of("status"));
    assertEquals("SELECT \"status\", COUNT(*) AS \"count\", SUM(\"amount\") AS \"sum_amount\" FROM \"orders\""
        + " GROUP BY \"status\"", dialect.render(q).sql());
  }

  @Test
  void mutations() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", "Jane");
    data.put("age", null);

    SqlStatement ins = dialect.render(new IntermediateQuery("users").withType(QueryType.INSERT).withData(data));
    assertEquals("INSERT INTO \"users\" (\"name\", \"age\") VALUES (?, ?)", ins.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE_GENERATED_KEYS, ins.execKind());
    assertEquals(2, ins.binds().size());
    assertNull(ins.binds().get(1));

    SqlStatement upd = dialect.render(new IntermediateQuery("users").withType(QueryType.UPDATE)
        .withData(Map.of("name", "Jane")).withFilters(List.of(FieldCondition.eq("id", 7))));
    assertEquals("UPDATE \"users\" SET \"name\" = ? WHERE \"id\" = ?", upd.sql());
    assertEquals(List.of("Jane", 7), upd.binds());

    SqlStatement del = dialect.render(new IntermediateQuery("users").withType(QueryType.DELETE)
        .withFilters(List.of(FieldCondition.eq("id", 7))));
    assertEquals("DELETE FROM \"users\" WHERE \"id\" = ?", del.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE, del.execKind());

    assertThrows(IllegalArgumentException.class,
        () -> dialect.render(new IntermediateQuery("users").withType(QueryType.INSERT)));
  }

  private final class RenderCheck {
    String where(FieldCondition c) {
      String sql = dialect.render(IntermediateQuery.read("t").withFilter(FilterCondition.of(c))).sql();
      String prefix = "SELECT \"t\".* FROM \"t\" WHERE ";
      assertTrue(sql.startsWith(prefix), sql);
      return sql.substring(prefix.length());
    }
  }
}
