package io.intellixity.restquery.relation;

import io.intellixity.restquery.error.RelationshipException;

import java.util.*;

/**
 * Relationships keyed by (source collection, name).
 * <p>
 * Readers see an immutable snapshot; writers publish a fresh copy, so a reload never exposes a half-updated
 * table to in-flight compilations. Construct one per composition root and pass it explicitly.
 */
public final class RelationshipRegistry {
  private volatile Map<String, Map<String, Relationship>> snapshot = Map.of();

  public RelationshipRegistry() {}

  public RelationshipRegistry(Map<String, ? extends List<RelationshipDefinition>> definitions) {
    registerBulk(definitions);
  }

  public synchronized void register(String sourceCollection, Relationship relationship) {
    Objects.requireNonNull(sourceCollection, "sourceCollection");
    Objects.requireNonNull(relationship, "relationship");
    Map<String, Map<String, Relationship>> next = mutableCopy();
    next.computeIfAbsent(sourceCollection, k -> new LinkedHashMap<>()).put(relationship.name(), relationship);
    publish(next);
  }

  public Relationship registerFromDefinition(String sourceCollection, RelationshipDefinition definition) {
    Relationship r = Relationship.of(Objects.requireNonNull(definition, "definition"));
    register(sourceCollection, r);
    return r;
  }

  /** Registers all definitions as one atomic update. */
  public synchronized void registerBulk(Map<String, ? extends List<RelationshipDefinition>> definitions) {
    if (definitions == null || definitions.isEmpty()) return;
    publish(merge(mutableCopy(), definitions));
  }

  /** Replaces every registration with {@code definitions} in one step. */
  public synchronized void replaceAll(Map<String, ? extends List<RelationshipDefinition>> definitions) {
    Map<String, Map<String, Relationship>> next = new LinkedHashMap<>();
    if (definitions != null) merge(next, definitions);
    publish(next);
  }

  private static Map<String, Map<String, Relationship>> merge(Map<String, Map<String, Relationship>> next,
                                                              Map<String, ? extends List<RelationshipDefinition>> definitions) {
    definitions.forEach((source, defs) -> {
      Map<String, Relationship> bySource = next.computeIfAbsent(source, k -> new LinkedHashMap<>());
      for (RelationshipDefinition d : defs) bySource.put(d.name(), Relationship.of(d));
    });
    return next;
  }

  public Optional<Relationship> get(String sourceCollection, String name) {
    Map<String, Relationship> bySource = snapshot.get(sourceCollection);
    return bySource == null ? Optional.empty() : Optional.ofNullable(bySource.get(name));
  }

  public Relationship require(String sourceCollection, String name) {
    return get(sourceCollection, name).orElseThrow(() -> RelationshipException.notFound(sourceCollection, name));
  }

  public List<Relationship> getForTable(String sourceCollection) {
    Map<String, Relationship> bySource = snapshot.get(sourceCollection);
    return bySource == null ? List.of() : List.copyOf(bySource.values());
  }

  public boolean has(String sourceCollection, String name) {
    return get(sourceCollection, name).isPresent();
  }

  public synchronized boolean remove(String sourceCollection, String name) {
    if (!has(sourceCollection, name)) return false;
    Map<String, Map<String, Relationship>> next = mutableCopy();
    Map<String, Relationship> bySource = next.get(sourceCollection);
    bySource.remove(name);
    if (bySource.isEmpty()) next.remove(sourceCollection);
    publish(next);
    return true;
  }

  public synchronized void clear() {
    snapshot = Map.of();
  }

  public Map<String, List<Relationship>> getAll() {
    Map<String, List<Relationship>> out = new LinkedHashMap<>();
    snapshot.forEach((source, rels) -> out.put(source, List.copyOf(rels.values())));
    return Collections.unmodifiableMap(out);
  }

  private Map<String, Map<String, Relationship>> mutableCopy() {
    Map<String, Map<String, Relationship>> copy = new LinkedHashMap<>();
    snapshot.forEach((k, v) -> copy.put(k, new LinkedHashMap<>(v)));
    return copy;
  }

  private void publish(Map<String, Map<String, Relationship>> next) {
    Map<String, Map<String, Relationship>> frozen = new LinkedHashMap<>();
    next.forEach((k, v) -> frozen.put(k, Collections.unmodifiableMap(v)));
    snapshot = Collections.unmodifiableMap(frozen);
  }
}
