package io.intellixity.restquery.convert;

import java.util.*;

/** Ordered, possibly multi-valued REST parameter map. Only the first value of a key is interpreted. */
public final class QueryParams {
  private final LinkedHashMap<String, List<String>> values;

  private QueryParams(LinkedHashMap<String, List<String>> values) {
    this.values = values;
  }

  public static QueryParams of(Map<String, String> single) {
    Builder b = builder();
    if (single != null) single.forEach(b::add);
    return b.build();
  }

  public static QueryParams ofMulti(Map<String, ? extends List<String>> multi) {
    Builder b = builder();
    if (multi != null) {
      multi.forEach((k, vs) -> {
        if (vs != null) vs.forEach(v -> b.add(k, v));
      });
    }
    return b.build();
  }

  public static Builder builder() { return new Builder(); }

  public Set<String> keys() { return Collections.unmodifiableSet(values.keySet()); }

  public String first(String key) {
    List<String> vs = values.get(key);
    return (vs == null || vs.isEmpty()) ? null : vs.get(0);
  }

  public List<String> all(String key) {
    return values.getOrDefault(key, List.of());
  }

  public boolean isEmpty() { return values.isEmpty(); }

  /** First value per key, in insertion order. */
  public Map<String, String> asFlatMap() {
    Map<String, String> out = new LinkedHashMap<>();
    for (String k : values.keySet()) out.put(k, first(k));
    return out;
  }

  public static final class Builder {
    private final LinkedHashMap<String, List<String>> values = new LinkedHashMap<>();

    public Builder add(String key, String value) {
      Objects.requireNonNull(key, "key");
      values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
      return this;
    }

    public QueryParams build() {
      LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
      values.forEach((k, v) -> copy.put(k, List.copyOf(v.stream().filter(Objects::nonNull).toList())));
      return new QueryParams(copy);
    }
  }
}
