package io.intellixity.restquery.relation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads relationship declarations of the form
 * <pre>
 * { "users": [ {"name":"posts","targetTable":"posts","localField":"_id","foreignField":"user_id","type":"one-to-many"} ] }
 * </pre>
 */
public final class RelationshipDefinitionsLoader {
  private static final TypeReference<LinkedHashMap<String, List<RelationshipDefinition>>> TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public RelationshipDefinitionsLoader() {
    this(new ObjectMapper());
  }

  public RelationshipDefinitionsLoader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public Map<String, List<RelationshipDefinition>> load(InputStream in) {
    Objects.requireNonNull(in, "in");
    try {
      return mapper.readValue(in, TYPE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read relationship definitions", e);
    }
  }

  public Map<String, List<RelationshipDefinition>> load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read relationship definitions from " + file, e);
    }
  }

  public RelationshipRegistry loadRegistry(InputStream in) {
    return new RelationshipRegistry(load(in));
  }
}
