package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaginationClause(Integer offset, Integer limit, Boolean count) {
  public static PaginationClause empty() { return new PaginationClause(null, null, null); }

  public PaginationClause withOffset(Integer offset) { return new PaginationClause(offset, limit, count); }
  public PaginationClause withLimit(Integer limit) { return new PaginationClause(offset, limit, count); }
  public PaginationClause withCount(Boolean count) { return new PaginationClause(offset, limit, count); }

  public int offsetOrZero() { return offset == null ? 0 : offset; }
}
