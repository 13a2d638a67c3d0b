package io.intellixity.restquery.relation;

import io.intellixity.restquery.query.SortClause;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to lower one embedded relationship into document-store lookup stages.
 *
 * @param alias        output field receiving the joined rows
 * @param fields       projection inside the joined collection (empty means all)
 * @param filter       already-rendered match document applied to the joined rows (may be empty)
 * @param nestedStages already-lowered stages of joins nested under this one
 * @param preserveNull keep parents without a match when the result is unwound
 */
public record EmbedRequest(String alias,
                           List<String> fields,
                           Map<String, Object> filter,
                           List<Map<String, Object>> nestedStages,
                           List<SortClause> orderBy,
                           Integer offset,
                           Integer limit,
                           boolean preserveNull) {
  public EmbedRequest {
    Objects.requireNonNull(alias, "alias");
    fields = fields == null ? List.of() : List.copyOf(fields);
    filter = filter == null ? Map.of() : filter;
    nestedStages = nestedStages == null ? List.of() : List.copyOf(nestedStages);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public static EmbedRequest of(String alias) {
    return new EmbedRequest(alias, null, null, null, null, null, null, true);
  }
}
