package io.intellixity.restquery.spi.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Adapters keyed by {@code name@version}.
 * <p>
 * Construct one per composition root. Lookups without an explicit version pick the highest version.
 */
public final class AdapterRegistry {
  private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

  private final Map<String, BackendAdapter<?>> adapters = new LinkedHashMap<>();

  public synchronized void register(BackendAdapter<?> adapter) {
    Objects.requireNonNull(adapter, "adapter");
    String key = adapter.key();
    if (adapters.containsKey(key)) {
      log.warn("restquery.adapters duplicate={} action=skip", key);
      return;
    }
    adapters.put(key, adapter);
    log.debug("restquery.adapters registered={} type={}", key, adapter.type().token());
  }

  /** Removes {@code name@version}, or the highest version of {@code name} when {@code version} is null. */
  public synchronized boolean unregister(String name, String version) {
    String key = version == null ? latestKey(k -> k.startsWith(name + "@")) : name + "@" + version;
    return key != null && adapters.remove(key) != null;
  }

  public synchronized Optional<BackendAdapter<?>> getAdapter(String name) {
    return getAdapter(name, null);
  }

  public synchronized Optional<BackendAdapter<?>> getAdapter(String name, String version) {
    String key = version == null ? latestKey(k -> k.startsWith(name + "@")) : name + "@" + version;
    return key == null ? Optional.empty() : Optional.ofNullable(adapters.get(key));
  }

  /** Highest-version adapter of {@code type}, preferring one named {@code preferredName} when given. */
  public synchronized Optional<BackendAdapter<?>> getAdapterByType(BackendType type, String preferredName) {
    if (preferredName != null) {
      for (BackendAdapter<?> a : adapters.values()) {
        if (a.type() == type && a.name().equals(preferredName)) return Optional.of(a);
      }
    }
    String key = latestKey(k -> adapters.get(k).type() == type);
    return key == null ? Optional.empty() : Optional.of(adapters.get(key));
  }

  public synchronized boolean hasAdapter(String name) {
    return getAdapter(name).isPresent();
  }

  public synchronized boolean supportsType(BackendType type) {
    for (BackendAdapter<?> a : adapters.values()) {
      if (a.type() == type) return true;
    }
    return false;
  }

  public synchronized List<BackendType> getSupportedTypes() {
    Set<BackendType> out = new LinkedHashSet<>();
    for (BackendAdapter<?> a : adapters.values()) out.add(a.type());
    return List.copyOf(out);
  }

  public synchronized List<BackendAdapter<?>> listAdapters() {
    return List.copyOf(adapters.values());
  }

  public synchronized void clear() {
    adapters.clear();
  }

  private String latestKey(java.util.function.Predicate<String> filter) {
    String best = null;
    for (String k : adapters.keySet()) {
      if (!filter.test(k)) continue;
      if (best == null || compareVersions(version(k), version(best)) > 0) best = k;
    }
    return best;
  }

  private static String version(String key) {
    return key.substring(key.indexOf('@') + 1);
  }

  /** Dotted numeric comparison; missing segments count as 0, non-numeric segments compare as text. */
  static int compareVersions(String a, String b) {
    String[] pa = a.split("\\.");
    String[] pb = b.split("\\.");
    for (int i = 0; i < Math.max(pa.length, pb.length); i++) {
      String sa = i < pa.length ? pa[i] : "0";
      String sb = i < pb.length ? pb[i] : "0";
      int c;
      try {
        c = Long.compare(Long.parseLong(sa), Long.parseLong(sb));
      } catch (NumberFormatException e) {
        c = sa.compareTo(sb);
      }
      if (c != 0) return c;
    }
    return 0;
  }
}
