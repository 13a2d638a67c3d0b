package io.intellixity.restquery.rbac;

import io.intellixity.restquery.error.ErrorCode;
import io.intellixity.restquery.error.RbacException;
import io.intellixity.restquery.query.IntermediateQuery;
import io.intellixity.restquery.query.SelectClause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RbacFieldResolverTest {
  private RbacFieldResolver resolver;

  @BeforeEach
  void setUp() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/rbac.json")) {
      resolver = new RbacFieldResolver(new RbacConfigLoader().load(in));
    }
  }

  private static RbacConfig config(RbacCollectionConfig... collections) {
    return new RbacConfig(List.of(collections));
  }

  private static RbacCollectionConfig readable(String collection, String role, RbacPattern... patterns) {
    return new RbacCollectionConfig(collection,
        new RbacCollectionConfig.Rules(List.of(new RbacRule(role, List.of(patterns))), null, null));
  }

  @Test
  void mutualRelationsTerminateWithPrefixedPaths() {
    List<String> features = resolver.getRbacFeatures("users", RbacAction.READ, List.of("user"));
    assertEquals(List.of(
        "email",
        "friends.email",
        "friends.name",
        "friends.posts.title",
        "name",
        "posts.author.email",
        "posts.author.name",
        "posts.title"), features);
  }

  @Test
  void selfReferenceStopsAtDepthCap() {
    RbacFieldResolver r = new RbacFieldResolver(config(readable("nodes", "r",
        RbacPattern.field("id"), RbacPattern.relation("parent", "nodes"))));
    assertEquals(List.of("id", "parent.id"), r.getRbacFeatures("nodes", RbacAction.READ, List.of("r")));
  }

  @Test
  void rolesUnionAndUnknownRolesContributeNothing() {
    List<String> features = resolver.getRbacFeatures("users", RbacAction.READ, List.of("admin", "guest"));
    assertEquals(List.of("address", "email", "name", "ssn"), features);
    assertTrue(resolver.getRbacFeatures("users", RbacAction.READ, List.of("guest")).isEmpty());
  }

  @Test
  void unknownCollectionRaises() {
    RbacException ex = assertThrows(RbacException.class,
        () -> resolver.getRbacFeatures("invoices", RbacAction.READ, List.of("user")));
    assertEquals(ErrorCode.RBC_COLLECTION_NOT_FOUND, ex.code());
  }

  @Test
  void collapse_dropsEntriesExtendingTheLastKept() {
    assertEquals(List.of("a", "b"), RbacFieldResolver.collapse(List.of("a.x", "b", "a", "a.y.z")));
    // only the last kept entry is compared, so "a.c" survives after "a-b"
    assertEquals(List.of("a", "a-b", "a.c"), RbacFieldResolver.collapse(List.of("a-b", "a", "a.c")));
  }

  @Test
  void hasAccess_perAction() {
    assertTrue(resolver.hasAccess("users", RbacAction.READ, List.of("user")));
    assertTrue(resolver.hasAccess("users", RbacAction.WRITE, List.of("user")));
    assertFalse(resolver.hasAccess("users", RbacAction.DELETE, List.of("user")));
    assertTrue(resolver.hasAccess("users", RbacAction.DELETE, List.of("user", "admin")));
    assertFalse(resolver.hasAccess("invoices", RbacAction.READ, List.of("admin")));
  }

  @Test
  void applyToSelect_neverWidensExplicitRequests() {
    List<String> allowed = List.of("email", "name");
    IntermediateQuery q = IntermediateQuery.read("users")
        .withSelect(SelectClause.of(List.of("name", "ssn", "posts.*")));
    SelectClause out = resolver.applyToSelect(q, allowed).select();
    assertEquals(List.of("name", "posts.*"), out.fields());
    for (String f : out.fields()) {
      assertTrue(allowed.contains(f) || SelectClause.isWildcard(f));
    }
  }

  @Test
  void applyToSelect_keepsOnlyRealWildcardMarkers() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withSelect(SelectClause.of(List.of("secret*", "pass*word", "*", "posts.*", "name")));
    assertEquals(List.of("*", "posts.*", "name"), resolver.applyToSelect(q, List.of("name")).select().fields());
  }

  @Test
  void applyToSelect_defaultsToAllowedList() {
    IntermediateQuery q = resolver.applyToSelect(IntermediateQuery.read("users"), List.of("email", "name"));
    assertEquals(List.of("email", "name"), q.select().fields());

    IntermediateQuery untouched = IntermediateQuery.read("users").withSelect(SelectClause.of(List.of("ssn")));
    assertEquals(List.of("ssn"), resolver.applyToSelect(untouched, List.of()).select().fields());
  }

  @Test
  void filterBodyData_keepsAllowedNestedPaths() {
    Map<String, Object> address = new LinkedHashMap<>();
    address.put("city", "Oslo");
    address.put("zip", "0150");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "Ada");
    body.put("role", "owner");
    body.put("address", address);

    Map<String, Object> out = resolver.filterBodyData("users", RbacAction.WRITE, List.of("user"), body);
    assertEquals(Map.of("name", "Ada", "address", Map.of("city", "Oslo")), out);
  }

  @Test
  void replaceConfig_swapsRulesAtomically() {
    resolver.replaceConfig(config(readable("users", "user", RbacPattern.field("nickname"))));
    assertEquals(List.of("nickname"), resolver.getRbacFeatures("users", RbacAction.READ, List.of("user")));
    assertThrows(RbacException.class, () -> resolver.getRbacFeatures("posts", RbacAction.READ, List.of("user")));
  }
}
