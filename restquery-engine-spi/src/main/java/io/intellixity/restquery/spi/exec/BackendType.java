package io.intellixity.restquery.spi.exec;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BackendType {
  MONGODB("MongoDB"),
  MYSQL("MySQL"),
  POSTGRESQL("PostgreSQL"),
  ELASTICSEARCH("Elasticsearch");

  private final String label;

  BackendType(String label) { this.label = label; }

  /** Display name used in wrapped execution errors. */
  public String label() { return label; }

  @JsonValue
  public String token() { return name().toLowerCase(Locale.ROOT); }

  public static BackendType fromToken(String token) {
    if (token == null) return null;
    for (BackendType t : values()) {
      if (t.token().equalsIgnoreCase(token.trim())) return t;
    }
    return null;
  }
}
