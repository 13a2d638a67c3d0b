package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projection. {@code fields} is an allow-list (empty means everything), {@code exclude} is only honoured
 * when {@code fields} is empty, {@code aliases} maps output name to source field.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SelectClause(List<String> fields,
                           List<String> exclude,
                           Map<String, String> aliases,
                           List<ComputedField> computed) {
  public static final String WILDCARD = "*";

  public SelectClause {
    fields = fields == null ? List.of() : List.copyOf(fields);
    exclude = exclude == null ? List.of() : List.copyOf(exclude);
    aliases = aliases == null ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    computed = computed == null ? List.of() : List.copyOf(computed);
  }

  public static SelectClause all() {
    return new SelectClause(null, null, null, null);
  }

  public static SelectClause of(List<String> fields) {
    return new SelectClause(fields, null, null, null);
  }

  @JsonIgnore
  public boolean selectsAll() {
    return fields.isEmpty() || fields.contains(WILDCARD);
  }

  public SelectClause withFields(List<String> fields) {
    return new SelectClause(fields, exclude, aliases, computed);
  }

  /** True for {@code *} and {@code alias.*} markers. */
  public static boolean isWildcard(String field) {
    return field != null && (field.equals(WILDCARD) || field.endsWith("." + WILDCARD));
  }
}
