package io.intellixity.restquery.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Canonical JSON deserializer for {@link IntermediateQuery}. */
public final class IntermediateQueryJsonDeserializer extends JsonDeserializer<IntermediateQuery> {
  @Override
  public IntermediateQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("IntermediateQuery JSON must be an object");

    JsonNode collection = root.get("collection");
    if (collection == null || !collection.isTextual()) {
      throw new IllegalArgumentException("IntermediateQuery JSON requires a 'collection' string");
    }
    IntermediateQuery q = new IntermediateQuery(collection.asText());

    JsonNode type = root.get("type");
    if (type != null && type.isTextual()) q.withType(codec.treeToValue(type, QueryType.class));

    q.withFilter(read(codec, root.get("filter"), FilterCondition.class));
    q.withFilters(read(codec, root.get("filters"), new TypeReference<List<FieldCondition>>() {}));
    q.withData(read(codec, root.get("data"), new TypeReference<Map<String, Object>>() {}));
    q.withSelect(read(codec, root.get("select"), SelectClause.class));
    q.withSort(read(codec, root.get("sort"), new TypeReference<List<SortClause>>() {}));
    q.withPagination(read(codec, root.get("pagination"), PaginationClause.class));
    q.withJoins(read(codec, root.get("joins"), new TypeReference<List<JoinClause>>() {}));
    q.withAggregations(read(codec, root.get("aggregations"), new TypeReference<List<AggregationClause>>() {}));
    q.withGroupBy(read(codec, root.get("groupBy"), new TypeReference<List<String>>() {}));
    q.withOptions(read(codec, root.get("options"), new TypeReference<Map<String, Object>>() {}));
    q.withMetadata(read(codec, root.get("metadata"), QueryMetadata.class));
    return q;
  }

  private static <T> T read(ObjectCodec codec, JsonNode node, Class<T> type) throws IOException {
    if (node == null || node.isNull()) return null;
    return codec.treeToValue(node, type);
  }

  private static <T> T read(ObjectCodec codec, JsonNode node, TypeReference<T> type) throws IOException {
    if (node == null || node.isNull()) return null;
    try (JsonParser p = codec.treeAsTokens(node)) {
      return codec.readValue(p, type);
    }
  }
}
