package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SortClause(String field, Direction direction, Nulls nulls) {
  public enum Direction {
    ASC, DESC;

    @JsonValue
    public String token() { return name().toLowerCase(Locale.ROOT); }
  }

  public enum Nulls {
    FIRST, LAST;

    @JsonValue
    public String token() { return name().toLowerCase(Locale.ROOT); }
  }

  public SortClause {
    Objects.requireNonNull(field, "field");
    direction = direction == null ? Direction.ASC : direction;
  }

  public static SortClause asc(String field) { return new SortClause(field, Direction.ASC, null); }
  public static SortClause desc(String field) { return new SortClause(field, Direction.DESC, null); }
}
