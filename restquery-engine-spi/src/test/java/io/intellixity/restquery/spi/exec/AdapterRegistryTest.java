package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.query.IntermediateQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AdapterRegistryTest {
  private record StubAdapter(String name, String version, BackendType type) implements BackendAdapter<String> {
    @Override public String convertQuery(IntermediateQuery query) { return query.collection(); }
    @Override public QueryResult executeQuery(String nativeQuery, IntermediateQuery query, ExecutionOptions options) {
      return new QueryResult(List.of(), null, null);
    }
    @Override public ValidationResult validateQuery(IntermediateQuery query) { return ValidationResult.ok(); }
    @Override public BackendCapabilities getCapabilities() { return BackendCapabilities.allOperators(null); }
  }

  @Test
  void duplicateKeyIsIgnored() {
    AdapterRegistry r = new AdapterRegistry();
    StubAdapter first = new StubAdapter("mongo", "1.0.0", BackendType.MONGODB);
    r.register(first);
    r.register(new StubAdapter("mongo", "1.0.0", BackendType.MONGODB));
    assertEquals(1, r.listAdapters().size());
    assertSame(first, r.getAdapter("mongo", "1.0.0").orElseThrow());
  }

  @Test
  void latestVersionWinsNumerically() {
    AdapterRegistry r = new AdapterRegistry();
    r.register(new StubAdapter("pg", "1.9.0", BackendType.POSTGRESQL));
    r.register(new StubAdapter("pg", "1.10.0", BackendType.POSTGRESQL));
    assertEquals("1.10.0", r.getAdapter("pg").orElseThrow().version());
    assertEquals("1.10.0", r.getAdapterByType(BackendType.POSTGRESQL, null).orElseThrow().version());
  }

  @Test
  void preferredNameWithinType() {
    AdapterRegistry r = new AdapterRegistry();
    r.register(new StubAdapter("pg-main", "2.0.0", BackendType.POSTGRESQL));
    r.register(new StubAdapter("pg-replica", "1.0.0", BackendType.POSTGRESQL));
    assertEquals("pg-replica", r.getAdapterByType(BackendType.POSTGRESQL, "pg-replica").orElseThrow().name());
    assertEquals("pg-main", r.getAdapterByType(BackendType.POSTGRESQL, "unknown").orElseThrow().name());
    assertTrue(r.getAdapterByType(BackendType.MYSQL, null).isEmpty());
  }

  @Test
  void unregisterAndSupportedTypes() {
    AdapterRegistry r = new AdapterRegistry();
    r.register(new StubAdapter("mongo", "1.0.0", BackendType.MONGODB));
    r.register(new StubAdapter("es", "1.0.0", BackendType.ELASTICSEARCH));
    assertEquals(List.of(BackendType.MONGODB, BackendType.ELASTICSEARCH), r.getSupportedTypes());

    assertTrue(r.unregister("mongo", null));
    assertFalse(r.unregister("mongo", null));
    assertFalse(r.supportsType(BackendType.MONGODB));
    assertFalse(r.hasAdapter("mongo"));
  }

  @Test
  void versionComparison() {
    assertTrue(AdapterRegistry.compareVersions("1.10", "1.9") > 0);
    assertEquals(0, AdapterRegistry.compareVersions("1.0", "1.0.0"));
    assertTrue(AdapterRegistry.compareVersions("1.0.0-rc", "1.0.0-beta") > 0);
  }
}
