package io.intellixity.restquery.relation;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.restquery.query.JunctionConfig;

import java.util.Objects;

/** Declared relationship from a source collection (the registry key) to {@code targetTable}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipDefinition(String name,
                                     String targetTable,
                                     String localField,
                                     String foreignField,
                                     Cardinality type,
                                     JunctionConfig junction) {
  public RelationshipDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(targetTable, "targetTable");
    Objects.requireNonNull(localField, "localField");
    Objects.requireNonNull(foreignField, "foreignField");
    Objects.requireNonNull(type, "type");
    if (type == Cardinality.MANY_TO_MANY && junction == null) {
      throw new IllegalArgumentException("Many-to-many relationship '" + name + "' requires a junction");
    }
    if (type != Cardinality.MANY_TO_MANY && junction != null) {
      throw new IllegalArgumentException("Relationship '" + name + "' of type " + type.token() + " cannot declare a junction");
    }
  }

  public static RelationshipDefinition of(String name, String targetTable, String localField,
                                          String foreignField, Cardinality type) {
    return new RelationshipDefinition(name, targetTable, localField, foreignField, type, null);
  }
}
