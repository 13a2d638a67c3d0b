package io.intellixity.restquery.rbac;

import io.intellixity.restquery.error.RbacException;
import io.intellixity.restquery.query.IntermediateQuery;
import io.intellixity.restquery.query.SelectClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Field-level access resolver.
 * <p>
 * Resolution walks relation patterns into related collections, prefixing their fields with the relation name.
 * Depth starts at 1 and only grows when a hop re-enters a collection already on the current chain; past depth 2
 * a hop contributes nothing. The rule table is replaced atomically by {@link #replaceConfig(RbacConfig)}.
 */
public final class RbacFieldResolver {
  private static final Logger log = LoggerFactory.getLogger(RbacFieldResolver.class);

  public static final int MAX_DEPTH = 2;

  private volatile Map<String, Map<RbacAction, Map<String, List<RbacPattern>>>> table;

  public RbacFieldResolver(RbacConfig config) {
    replaceConfig(config);
  }

  public void replaceConfig(RbacConfig config) {
    this.table = Collections.unmodifiableMap(Objects.requireNonNull(config, "config").index());
  }

  public boolean hasAccess(String collection, RbacAction action, List<String> roles) {
    Map<RbacAction, Map<String, List<RbacPattern>>> byAction = table.get(collection);
    if (byAction == null || roles == null) return false;
    Map<String, List<RbacPattern>> byRole = byAction.get(action);
    for (String role : roles) {
      if (byRole.containsKey(role)) return true;
    }
    return false;
  }

  public List<String> getRbacFeatures(String collection, RbacAction action, List<String> roles) {
    return getRbacFeatures(collection, action, roles, false, 1, null);
  }

  /**
   * Allowed dot-paths for {@code roles}, sorted, with every entry that extends the previously kept entry
   * ({@code kept + "."} prefix) dropped in a single pass.
   */
  public List<String> getRbacFeatures(String collection, RbacAction action, List<String> roles,
                                      boolean isRelated, int depth, String pathPrefix) {
    Map<String, Map<RbacAction, Map<String, List<RbacPattern>>>> snapshot = table;
    Set<String> chain = new HashSet<>();
    List<String> out = resolve(snapshot, collection, action, roles == null ? List.of() : roles, depth, pathPrefix, chain);
    if (log.isDebugEnabled()) {
      log.debug("restquery.rbac collection={} action={} related={} depth={} features={}",
          collection, action.token(), isRelated, depth, out.size());
    }
    return out;
  }

  private static List<String> resolve(Map<String, Map<RbacAction, Map<String, List<RbacPattern>>>> snapshot,
                                      String collection, RbacAction action, List<String> roles,
                                      int depth, String pathPrefix, Set<String> chain) {
    if (depth > MAX_DEPTH) return List.of();
    Map<RbacAction, Map<String, List<RbacPattern>>> byAction = snapshot.get(collection);
    if (byAction == null) throw RbacException.collectionNotFound(collection);
    Map<String, List<RbacPattern>> byRole = byAction.get(action);

    Set<String> nextChain = new HashSet<>(chain);
    nextChain.add(collection);

    Set<String> features = new HashSet<>();
    for (String role : new LinkedHashSet<>(roles)) {
      List<RbacPattern> patterns = byRole.get(role);
      if (patterns == null) continue;
      for (RbacPattern p : patterns) {
        String path = pathPrefix == null || pathPrefix.isEmpty() ? p.fieldName() : pathPrefix + "." + p.fieldName();
        if (p.kind() == RbacPattern.Kind.FIELD) {
          features.add(path);
        } else {
          String related = p.relateCollection();
          int nextDepth = depth + (nextChain.contains(related) ? 1 : 0);
          features.addAll(resolve(snapshot, related, action, roles, nextDepth, path, nextChain));
        }
      }
    }
    return collapse(features);
  }

  static List<String> collapse(Collection<String> features) {
    List<String> sorted = new ArrayList<>(new TreeSet<>(features));
    List<String> out = new ArrayList<>(sorted.size());
    String kept = null;
    for (String f : sorted) {
      if (kept != null && f.startsWith(kept + ".")) continue;
      out.add(f);
      kept = f;
    }
    return out;
  }

  /**
   * Restricts the query's projection: with no explicit request the allowed list becomes the select, otherwise
   * requested fields outside the list are dropped while wildcard markers are kept. An empty list changes nothing.
   */
  public IntermediateQuery applyToSelect(IntermediateQuery query, List<String> allowed) {
    if (allowed == null || allowed.isEmpty()) return query;
    SelectClause select = query.select();
    if (select == null || select.fields().isEmpty()) {
      return query.withSelect(select == null ? SelectClause.of(allowed) : select.withFields(allowed));
    }
    Set<String> allowedSet = new HashSet<>(allowed);
    List<String> kept = new ArrayList<>();
    for (String f : select.fields()) {
      if (allowedSet.contains(f) || SelectClause.isWildcard(f)) kept.add(f);
    }
    return query.withSelect(select.withFields(kept));
  }

  /**
   * Drops payload entries outside the allowed paths. A nested map is kept partially when only some of its
   * dot-paths are allowed. Returns the body unchanged when nothing is resolved.
   */
  public Map<String, Object> filterBodyData(String collection, RbacAction action, List<String> roles,
                                            Map<String, Object> body) {
    if (body == null) return null;
    List<String> allowed = getRbacFeatures(collection, action, roles);
    if (allowed.isEmpty()) return body;
    return project(body, new HashSet<>(allowed), null);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> project(Map<String, Object> body, Set<String> allowed, String prefix) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : body.entrySet()) {
      String path = prefix == null ? e.getKey() : prefix + "." + e.getKey();
      if (allowed.contains(path)) {
        out.put(e.getKey(), e.getValue());
      } else if (e.getValue() instanceof Map<?, ?> nested && hasChild(allowed, path)) {
        Map<String, Object> sub = project((Map<String, Object>) nested, allowed, path);
        if (!sub.isEmpty()) out.put(e.getKey(), sub);
      }
    }
    return out;
  }

  private static boolean hasChild(Set<String> allowed, String path) {
    String p = path + ".";
    for (String a : allowed) {
      if (a.startsWith(p)) return true;
    }
    return false;
  }
}
