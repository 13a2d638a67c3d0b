package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryType {
  READ, INSERT, UPDATE, DELETE;

  @JsonValue
  public String token() { return name().toLowerCase(Locale.ROOT); }
}
