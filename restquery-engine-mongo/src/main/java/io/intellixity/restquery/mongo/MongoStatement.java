package io.intellixity.restquery.mongo;

import org.bson.Document;

import java.util.List;
import java.util.Objects;

/**
 * Backend-native statement for MongoDB: an aggregation pipeline for reads, a single-document operation for writes.
 *
 * @param document insert payload, {@code $set} update or replacement document
 */
public record MongoStatement(Kind kind,
                             String collection,
                             List<Document> pipeline,
                             Document filter,
                             Document document) {
  public enum Kind {
    AGGREGATE,
    INSERT_ONE,
    UPDATE_ONE,
    REPLACE_ONE,
    DELETE_ONE
  }

  public MongoStatement {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(collection, "collection");
    pipeline = pipeline == null ? List.of() : List.copyOf(pipeline);
  }

  public static MongoStatement aggregate(String collection, List<Document> pipeline) {
    return new MongoStatement(Kind.AGGREGATE, collection, pipeline, null, null);
  }
}
