package io.intellixity.restquery.rbac;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/** Whole RBAC rule table; swapped as one unit. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RbacConfig(@JsonProperty("collections") List<RbacCollectionConfig> collections) {
  public RbacConfig {
    collections = collections == null ? List.of() : List.copyOf(collections);
  }

  public static RbacConfig empty() {
    return new RbacConfig(List.of());
  }

  /** Index collection → action → role → patterns; the last declaration of a collection wins. */
  Map<String, Map<RbacAction, Map<String, List<RbacPattern>>>> index() {
    Map<String, Map<RbacAction, Map<String, List<RbacPattern>>>> out = new HashMap<>();
    for (RbacCollectionConfig c : collections) {
      Map<RbacAction, Map<String, List<RbacPattern>>> byAction = new EnumMap<>(RbacAction.class);
      for (RbacAction a : RbacAction.values()) {
        Map<String, List<RbacPattern>> byRole = new LinkedHashMap<>();
        for (RbacRule r : c.rbacConfig().forAction(a)) {
          byRole.computeIfAbsent(r.userRole(), k -> new ArrayList<>()).addAll(r.patterns());
        }
        byAction.put(a, byRole);
      }
      out.put(c.collectionName(), byAction);
    }
    return out;
  }
}
