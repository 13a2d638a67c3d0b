package io.intellixity.restquery.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Backend-agnostic query over exactly one root collection.
 * <p>
 * Reads use {@code filter}/{@code select}/{@code sort}/{@code pagination}/{@code joins}; mutations use the flat
 * {@code filters} list and the {@code data} payload.
 */
@JsonSerialize(using = IntermediateQueryJsonSerializer.class)
@JsonDeserialize(using = IntermediateQueryJsonDeserializer.class)
public final class IntermediateQuery {
  public static final String OPTION_PARTIAL = "partial";

  private String collection;
  private QueryType type = QueryType.READ;
  private FilterCondition filter;
  private List<FieldCondition> filters = new ArrayList<>();
  private Map<String, Object> data;
  private SelectClause select;
  private List<SortClause> sort = new ArrayList<>();
  private PaginationClause pagination;
  private List<JoinClause> joins = new ArrayList<>();
  private List<AggregationClause> aggregations = new ArrayList<>();
  private List<String> groupBy = new ArrayList<>();
  private Map<String, Object> options = new LinkedHashMap<>();
  private QueryMetadata metadata;

  public IntermediateQuery() {}

  public IntermediateQuery(String collection) {
    this.collection = collection;
  }

  public String collection() { return collection; }
  public QueryType type() { return type; }
  public FilterCondition filter() { return filter; }
  public List<FieldCondition> filters() { return filters; }
  public Map<String, Object> data() { return data; }
  public SelectClause select() { return select; }
  public List<SortClause> sort() { return sort; }
  public PaginationClause pagination() { return pagination; }
  public List<JoinClause> joins() { return joins; }
  public List<AggregationClause> aggregations() { return aggregations; }
  public List<String> groupBy() { return groupBy; }
  public Map<String, Object> options() { return options; }
  public QueryMetadata metadata() { return metadata; }

  public IntermediateQuery withCollection(String collection) { this.collection = collection; return this; }
  public IntermediateQuery withType(QueryType type) { this.type = type == null ? QueryType.READ : type; return this; }
  public IntermediateQuery withFilter(FilterCondition filter) { this.filter = filter; return this; }
  public IntermediateQuery withFilters(List<FieldCondition> filters) { this.filters = new ArrayList<>(filters == null ? List.of() : filters); return this; }
  public IntermediateQuery withData(Map<String, Object> data) { this.data = data == null ? null : new LinkedHashMap<>(data); return this; }
  public IntermediateQuery withSelect(SelectClause select) { this.select = select; return this; }
  public IntermediateQuery withSort(List<SortClause> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public IntermediateQuery withPagination(PaginationClause pagination) { this.pagination = pagination; return this; }
  public IntermediateQuery withJoins(List<JoinClause> joins) { this.joins = new ArrayList<>(joins == null ? List.of() : joins); return this; }
  public IntermediateQuery withAggregations(List<AggregationClause> aggregations) { this.aggregations = new ArrayList<>(aggregations == null ? List.of() : aggregations); return this; }
  public IntermediateQuery withGroupBy(List<String> groupBy) { this.groupBy = new ArrayList<>(groupBy == null ? List.of() : groupBy); return this; }
  public IntermediateQuery withOptions(Map<String, Object> options) { this.options = new LinkedHashMap<>(options == null ? Map.of() : options); return this; }
  public IntermediateQuery withOption(String name, Object value) { this.options.put(name, value); return this; }
  public IntermediateQuery withMetadata(QueryMetadata metadata) { this.metadata = metadata; return this; }

  /** Update mode: merge-patch when true, whole-document replace otherwise. */
  public boolean partial() {
    return Boolean.TRUE.equals(options.get(OPTION_PARTIAL));
  }

  public Integer limit() { return pagination == null ? null : pagination.limit(); }

  public int offset() { return pagination == null ? 0 : pagination.offsetOrZero(); }

  public static IntermediateQuery read(String collection) {
    return new IntermediateQuery(collection);
  }
}
