package io.intellixity.restquery.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/** Canonical JSON serializer for {@link IntermediateQuery}; empty parts are omitted. */
public final class IntermediateQueryJsonSerializer extends JsonSerializer<IntermediateQuery> {
  @Override
  public void serialize(IntermediateQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("collection", q.collection());
    if (q.type() != null) g.writeStringField("type", q.type().token());
    if (q.filter() != null) g.writeObjectField("filter", q.filter());
    writeIfPresent(g, "filters", q.filters());
    writeIfPresent(g, "data", q.data());
    if (q.select() != null) g.writeObjectField("select", q.select());
    writeIfPresent(g, "sort", q.sort());
    if (q.pagination() != null) g.writeObjectField("pagination", q.pagination());
    writeIfPresent(g, "joins", q.joins());
    writeIfPresent(g, "aggregations", q.aggregations());
    writeIfPresent(g, "groupBy", q.groupBy());
    writeIfPresent(g, "options", q.options());
    if (q.metadata() != null) g.writeObjectField("metadata", q.metadata());
    g.writeEndObject();
  }

  private static void writeIfPresent(JsonGenerator g, String name, Collection<?> values) throws IOException {
    if (values != null && !values.isEmpty()) g.writeObjectField(name, values);
  }

  private static void writeIfPresent(JsonGenerator g, String name, Map<?, ?> values) throws IOException {
    if (values != null && !values.isEmpty()) g.writeObjectField(name, values);
  }
}
