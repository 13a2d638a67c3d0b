package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.query.AggregationType;
import io.intellixity.restquery.query.ComparisonOperator;
import io.intellixity.restquery.query.JoinType;
import io.intellixity.restquery.query.QueryType;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a backend declares it can execute. Validation compares an IR against this before lowering.
 *
 * @param maxComplexity upper bound on filter leaves plus joins plus aggregations; null means unbounded
 * @param maxResultSize upper bound on the requested limit; null means unbounded
 */
public record BackendCapabilities(Set<ComparisonOperator> filterOperators,
                                  Set<JoinType> joinTypes,
                                  Set<AggregationType> aggregations,
                                  Set<QueryType> queryTypes,
                                  boolean fullTextSearch,
                                  boolean transactions,
                                  boolean nestedQueries,
                                  Integer maxComplexity,
                                  Integer maxResultSize) {
  public BackendCapabilities {
    filterOperators = filterOperators == null ? Set.of() : Set.copyOf(filterOperators);
    joinTypes = joinTypes == null ? Set.of() : Set.copyOf(joinTypes);
    aggregations = aggregations == null ? Set.of() : Set.copyOf(aggregations);
    queryTypes = queryTypes == null ? Set.of() : Set.copyOf(queryTypes);
  }

  /** Every operator, aggregation and query type; the given join types; no limits. */
  public static BackendCapabilities allOperators(Set<JoinType> joinTypes) {
    return new BackendCapabilities(EnumSet.allOf(ComparisonOperator.class), joinTypes,
        EnumSet.allOf(AggregationType.class), EnumSet.allOf(QueryType.class), false, false, true, null, null);
  }

  public BackendCapabilities withFullTextSearch(boolean v) {
    return new BackendCapabilities(filterOperators, joinTypes, aggregations, queryTypes, v, transactions, nestedQueries, maxComplexity, maxResultSize);
  }

  public BackendCapabilities withTransactions(boolean v) {
    return new BackendCapabilities(filterOperators, joinTypes, aggregations, queryTypes, fullTextSearch, v, nestedQueries, maxComplexity, maxResultSize);
  }

  public BackendCapabilities withMaxComplexity(Integer v) {
    return new BackendCapabilities(filterOperators, joinTypes, aggregations, queryTypes, fullTextSearch, transactions, nestedQueries, v, maxResultSize);
  }

  public BackendCapabilities withMaxResultSize(Integer v) {
    return new BackendCapabilities(filterOperators, joinTypes, aggregations, queryTypes, fullTextSearch, transactions, nestedQueries, maxComplexity, v);
  }

  public BackendCapabilities withQueryTypes(Set<QueryType> v) {
    return new BackendCapabilities(filterOperators, joinTypes, aggregations, v, fullTextSearch, transactions, nestedQueries, maxComplexity, maxResultSize);
  }
}
