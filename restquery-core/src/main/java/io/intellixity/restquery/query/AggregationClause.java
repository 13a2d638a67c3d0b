package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/** Aggregate function over {@code field} ({@code count} may omit it), exposed under {@code alias}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationClause(AggregationType type, String field, String alias) {
  public AggregationClause {
    Objects.requireNonNull(type, "type");
    if (field == null && type != AggregationType.COUNT) {
      throw new IllegalArgumentException(type.token() + " aggregation requires a field");
    }
    if (alias == null || alias.isBlank()) {
      alias = field == null ? type.token() : type.token() + "_" + field.replace('.', '_');
    }
  }
}
