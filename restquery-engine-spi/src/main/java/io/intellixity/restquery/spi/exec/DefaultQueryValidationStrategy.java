package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.query.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default, backend-agnostic capability validation.
 * <p>
 * Checks the collection name, query type, every filter operator (tree and flat mutation filters), every join type
 * (nested joins included), every aggregation, the overall complexity and the requested result size.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public ValidationResult validate(IntermediateQuery query, BackendCapabilities caps) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(caps, "capabilities");
    List<ValidationError> errors = new ArrayList<>();

    if (query.collection() == null || query.collection().isBlank()) {
      errors.add(new ValidationError(ValidationError.MISSING_COLLECTION,
          "Collection/table name is required", "collection"));
    }
    if (!caps.queryTypes().contains(query.type())) {
      errors.add(new ValidationError(ValidationError.UNSUPPORTED_QUERY_TYPE,
          "Query type '" + query.type().token() + "' is not supported", "type"));
    }

    if (query.filter() != null) validateFilter(query.filter(), "filter", caps, errors);
    for (int i = 0; i < query.filters().size(); i++) {
      validateOperator(query.filters().get(i), "filters[" + i + "].operator", caps, errors);
    }
    validateJoins(query.joins(), "joins", caps, errors);

    for (int i = 0; i < query.aggregations().size(); i++) {
      AggregationType t = query.aggregations().get(i).type();
      if (!caps.aggregations().contains(t)) {
        errors.add(new ValidationError(ValidationError.UNSUPPORTED_AGGREGATION,
            "Aggregation '" + t.token() + "' is not supported", "aggregations[" + i + "].type"));
      }
    }

    if (caps.maxComplexity() != null) {
      int complexity = complexity(query);
      if (complexity > caps.maxComplexity()) {
        errors.add(new ValidationError(ValidationError.QUERY_TOO_COMPLEX,
            "Query complexity " + complexity + " exceeds " + caps.maxComplexity(), null));
      }
    }
    Integer limit = query.limit();
    if (caps.maxResultSize() != null && limit != null && limit > caps.maxResultSize()) {
      errors.add(new ValidationError(ValidationError.RESULT_SIZE_EXCEEDED,
          "Limit " + limit + " exceeds maximum result size " + caps.maxResultSize(), "pagination.limit"));
    }
    return new ValidationResult(errors);
  }

  private static void validateFilter(FilterCondition f, String path, BackendCapabilities caps, List<ValidationError> errors) {
    for (int i = 0; i < f.conditions().size(); i++) {
      validateOperator(f.conditions().get(i), path + ".conditions[" + i + "].operator", caps, errors);
    }
    for (int j = 0; j < f.nested().size(); j++) {
      validateFilter(f.nested().get(j), path + ".nested[" + j + "]", caps, errors);
    }
  }

  private static void validateOperator(FieldCondition c, String path, BackendCapabilities caps, List<ValidationError> errors) {
    if (!caps.filterOperators().contains(c.operator())) {
      errors.add(new ValidationError(ValidationError.UNSUPPORTED_OPERATOR,
          "Filter operator '" + c.operator().token() + "' is not supported", path));
    }
  }

  private static void validateJoins(List<JoinClause> joins, String path, BackendCapabilities caps, List<ValidationError> errors) {
    for (int i = 0; i < joins.size(); i++) {
      JoinClause j = joins.get(i);
      String p = path + "[" + i + "]";
      if (!caps.joinTypes().contains(j.type())) {
        errors.add(new ValidationError(ValidationError.UNSUPPORTED_JOIN_TYPE,
            "Join type '" + j.type().token() + "' is not supported", p + ".type"));
      }
      if (j.filter() != null) validateFilter(j.filter(), p + ".filter", caps, errors);
      validateJoins(j.joins(), p + ".joins", caps, errors);
    }
  }

  static int complexity(IntermediateQuery q) {
    return leaves(q.filter()) + q.filters().size() + joinCount(q.joins()) + q.aggregations().size();
  }

  private static int leaves(FilterCondition f) {
    if (f == null) return 0;
    int n = f.conditions().size();
    for (FilterCondition c : f.nested()) n += leaves(c);
    return n;
  }

  private static int joinCount(List<JoinClause> joins) {
    int n = 0;
    for (JoinClause j : joins) n += 1 + leaves(j.filter()) + joinCount(j.joins());
    return n;
  }
}
