package io.intellixity.restquery.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.spi.exec.BackendType;
import io.intellixity.restquery.spi.exec.ValidationError;
import io.intellixity.restquery.spi.exec.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoBackendAdapterTest {
  private MongoClient client;
  private MongoBackendAdapter adapter;

  @BeforeEach
  void setUp() {
    // the driver connects lazily; nothing here talks to a server
    client = MongoClients.create("mongodb://localhost:27017");
    adapter = new MongoBackendAdapter(new MongoHandle("mongo", client, "app"), new MongoDialect());
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void identity() {
    assertEquals("mongodb@1.0.0", adapter.key());
    assertEquals(BackendType.MONGODB, adapter.type());
    assertEquals(100, adapter.getCapabilities().maxComplexity());
  }

  @Test
  void acceptsEveryOperatorAndRelationshipJoins() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withFilter(FilterCondition.of(new FieldCondition("name", ComparisonOperator.ILIKE, "a%")))
        .withJoins(List.of(JoinClause.stub("posts", "posts", "posts")));
    assertTrue(adapter.validateQuery(q).valid());
  }

  @Test
  void rejectsSearchOnlyJoinTypes() {
    IntermediateQuery q = IntermediateQuery.read("users")
        .withJoins(List.of(JoinClause.stub("posts", "posts", "posts").withType(JoinType.NESTED)));
    ValidationResult r = adapter.validateQuery(q);
    assertEquals(List.of("joins[0].type"), r.errors().stream().map(ValidationError::path).toList());
  }

  @Test
  void convertProducesAggregate() {
    MongoStatement st = adapter.convertQuery(IntermediateQuery.read("users"));
    assertEquals(MongoStatement.Kind.AGGREGATE, st.kind());
    assertTrue(st.pipeline().isEmpty());
  }
}
