package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.query.*;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultQueryValidationStrategyTest {
  private static final BackendCapabilities CAPS = new BackendCapabilities(
      EnumSet.of(ComparisonOperator.EQ, ComparisonOperator.GT),
      EnumSet.of(JoinType.LEFT, JoinType.ONE_TO_MANY),
      EnumSet.of(AggregationType.COUNT),
      EnumSet.of(QueryType.READ),
      false, false, true, null, null);

  private final DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();

  private static List<String> paths(ValidationResult r) {
    return r.errors().stream().map(ValidationError::path).toList();
  }

  @Test
  void supportedQueryIsValid() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(FilterCondition.of(FieldCondition.eq("name", "x"), new FieldCondition("age", ComparisonOperator.GT, 1)));
    assertTrue(v.validate(q, CAPS).valid());
  }

  @Test
  void reportsOperatorPathsThroughNestedGroups() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(new FilterCondition(LogicalOperator.AND,
            List.of(new FieldCondition("name", ComparisonOperator.LIKE, "a%")),
            List.of(FilterCondition.or(FieldCondition.eq("a", 1), new FieldCondition("b", ComparisonOperator.REGEX, "x")))));
    ValidationResult r = v.validate(q, CAPS);
    assertFalse(r.valid());
    assertEquals(List.of("filter.conditions[0].operator", "filter.nested[0].conditions[1].operator"), paths(r));
    assertEquals(ValidationError.UNSUPPORTED_OPERATOR, r.errors().get(0).code());
  }

  @Test
  void unresolvedStubIsAnUnsupportedJoinType() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withJoins(List.of(JoinClause.stub("posts", "posts", "posts")
            .withType(JoinType.ONE_TO_MANY)
            .withJoins(List.of(JoinClause.stub("comments", "comments", "comments")))));
    ValidationResult r = v.validate(q, CAPS);
    assertEquals(List.of("joins[0].joins[0].type"), paths(r));
    assertEquals(ValidationError.UNSUPPORTED_JOIN_TYPE, r.errors().get(0).code());
  }

  @Test
  void checksCollectionTypeAndAggregations() {
    IntermediateQuery q = new IntermediateQuery("")
        .withType(QueryType.DELETE)
        .withAggregations(List.of(new AggregationClause(AggregationType.SUM, "total", null)));
    ValidationResult r = v.validate(q, CAPS);
    assertEquals(List.of(ValidationError.MISSING_COLLECTION, ValidationError.UNSUPPORTED_QUERY_TYPE,
            ValidationError.UNSUPPORTED_AGGREGATION),
        r.errors().stream().map(ValidationError::code).toList());
    assertEquals("aggregations[0].type", r.errors().get(2).path());
  }

  @Test
  void mutationFiltersAreChecked() {
    IntermediateQuery q = new IntermediateQuery("users")
        .withFilters(List.of(new FieldCondition("_id", ComparisonOperator.IN, List.of(1))));
    ValidationResult r = v.validate(q, CAPS.withQueryTypes(Set.of(QueryType.READ, QueryType.DELETE)));
    assertEquals(List.of("filters[0].operator"), paths(r));
  }

  @Test
  void complexityAndResultSizeLimits() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(FilterCondition.of(FieldCondition.eq("a", 1), FieldCondition.eq("b", 2)))
        .withJoins(List.of(JoinClause.stub("posts", "posts", "posts").withType(JoinType.LEFT)))
        .withPagination(new PaginationClause(null, 500, null));
    assertEquals(3, DefaultQueryValidationStrategy.complexity(q));

    ValidationResult r = v.validate(q, CAPS.withMaxComplexity(2).withMaxResultSize(100));
    assertEquals(List.of(ValidationError.QUERY_TOO_COMPLEX, ValidationError.RESULT_SIZE_EXCEEDED),
        r.errors().stream().map(ValidationError::code).toList());
    assertEquals("pagination.limit", r.errorMaps().get(1).get("path"));
    assertFalse(r.errorMaps().get(0).containsKey("path"));
  }
}
