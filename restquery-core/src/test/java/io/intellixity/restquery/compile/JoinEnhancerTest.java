package io.intellixity.restquery.compile;

import io.intellixity.restquery.convert.QueryConverter;
import io.intellixity.restquery.error.ErrorCode;
import io.intellixity.restquery.error.RelationshipException;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.relation.Cardinality;
import io.intellixity.restquery.relation.RelationshipDefinition;
import io.intellixity.restquery.relation.RelationshipRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JoinEnhancerTest {
  private static RelationshipRegistry registry() {
    return new RelationshipRegistry(Map.of(
        "users", List.of(RelationshipDefinition.of("posts", "blog_posts", "_id", "user_id", Cardinality.ONE_TO_MANY)),
        "blog_posts", List.of(
            RelationshipDefinition.of("comments", "comments", "_id", "post_id", Cardinality.ONE_TO_MANY),
            new RelationshipDefinition("tags", "tags", "_id", "_id", Cardinality.MANY_TO_MANY,
                new JunctionConfig("post_tags", "post_id", "tag_id")))));
  }

  private static IntermediateQuery query(String select) {
    return new QueryConverter().convert(Map.of("select", select), "users", List.of("user"));
  }

  @Test
  void enhance_fillsOnTargetAndCardinality() {
    IntermediateQuery q = new JoinEnhancer(registry()).enhance(query("name,look_posts(title)"));
    JoinClause j = q.joins().get(0);
    assertEquals("blog_posts", j.target());
    assertEquals("look_posts", j.alias());
    assertEquals(JoinType.ONE_TO_MANY, j.type());
    assertEquals(List.of(new JoinCondition("_id", "user_id")), j.on());
    assertFalse(j.isStub());
  }

  @Test
  void enhance_nestedJoinsResolveAgainstEnclosingTarget() {
    IntermediateQuery q = new JoinEnhancer(registry()).enhance(query("posts(title,comments(text),tags(name))"));
    JoinClause posts = q.joins().get(0);
    JoinClause comments = posts.joins().get(0);
    JoinClause tags = posts.joins().get(1);

    assertEquals(List.of(new JoinCondition("_id", "post_id")), comments.on());
    assertEquals(JoinType.MANY_TO_MANY, tags.type());
    assertEquals(new JunctionConfig("post_tags", "post_id", "tag_id"), tags.relationship().junction());
    assertEquals(List.of(new JoinCondition("_id", "post_id")), tags.on());
  }

  @Test
  void enhance_unknownStubLeftAsSupplied() {
    IntermediateQuery q = new JoinEnhancer(registry()).enhance(query("orders(total)"));
    JoinClause j = q.joins().get(0);
    assertTrue(j.isStub());
    assertEquals(JoinType.LOOKUP, j.type());
    assertEquals("orders", j.target());
  }

  @Test
  void enhance_strictRaisesForUnknownStub() {
    RelationshipException ex = assertThrows(RelationshipException.class,
        () -> new JoinEnhancer(registry(), true).enhance(query("orders(total)")));
    assertEquals(ErrorCode.COR_RELATIONSHIP_NOT_FOUND, ex.code());
  }

  @Test
  void enhance_missingRegistryIsFatalOnlyWhenJoinsExist() {
    JoinEnhancer e = new JoinEnhancer(null);
    IntermediateQuery plain = query("name");
    assertSame(plain, e.enhance(plain));
    RelationshipException ex = assertThrows(RelationshipException.class, () -> e.enhance(query("posts(title)")));
    assertEquals(ErrorCode.COR_RELATIONSHIP_NOT_INITIALIZED, ex.code());
  }
}
