package io.intellixity.restquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AggregationType {
  COUNT, SUM, AVG, MIN, MAX;

  @JsonValue
  public String token() { return name().toLowerCase(Locale.ROOT); }
}
