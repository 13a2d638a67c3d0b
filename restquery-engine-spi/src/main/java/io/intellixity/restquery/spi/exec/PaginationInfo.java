package io.intellixity.restquery.spi.exec;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaginationInfo(int offset, int limit, Long total, Boolean hasMore) {
}
