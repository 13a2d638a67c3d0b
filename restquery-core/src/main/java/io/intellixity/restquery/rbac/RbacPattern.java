package io.intellixity.restquery.rbac;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One permission entry: a plain field, or a relation whose permitted fields come from
 * {@code relateCollection}. JSON shape: {@code {"name":{"type":"field"}}} or
 * {@code {"author":{"type":"relation","relate_collection":"users"}}}.
 */
public record RbacPattern(String fieldName, Kind kind, String relateCollection) {
  public enum Kind { FIELD, RELATION }

  public RbacPattern {
    Objects.requireNonNull(fieldName, "fieldName");
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.RELATION && (relateCollection == null || relateCollection.isBlank())) {
      throw new IllegalArgumentException("Relation pattern '" + fieldName + "' requires relate_collection");
    }
  }

  public static RbacPattern field(String name) {
    return new RbacPattern(name, Kind.FIELD, null);
  }

  public static RbacPattern relation(String name, String relateCollection) {
    return new RbacPattern(name, Kind.RELATION, relateCollection);
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static RbacPattern fromJson(Map<String, Map<String, String>> json) {
    if (json == null || json.size() != 1) {
      throw new IllegalArgumentException("RBAC pattern must have exactly one field entry: " + json);
    }
    var e = json.entrySet().iterator().next();
    Map<String, String> body = e.getValue() == null ? Map.of() : e.getValue();
    String type = body.getOrDefault("type", "field");
    return switch (type) {
      case "field" -> field(e.getKey());
      case "relation" -> relation(e.getKey(), body.get("relate_collection"));
      default -> throw new IllegalArgumentException("Unknown RBAC pattern type: " + type);
    };
  }

  @JsonValue
  public Map<String, Map<String, String>> toJson() {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("type", kind == Kind.FIELD ? "field" : "relation");
    if (kind == Kind.RELATION) body.put("relate_collection", relateCollection);
    return Map.of(fieldName, body);
  }
}
