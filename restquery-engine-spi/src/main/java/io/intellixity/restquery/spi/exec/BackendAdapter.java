package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.query.IntermediateQuery;

/**
 * Backend contract: lower an IR to a native query {@code N}, validate an IR against the declared capabilities
 * and execute a native query.
 * <p>
 * The IR that produced a native query is passed to {@link #executeQuery} explicitly; adapters keep no per-request
 * state and may be shared between threads.
 */
public interface BackendAdapter<N> {
  String name();

  String version();

  BackendType type();

  N convertQuery(IntermediateQuery query);

  /**
   * Executes {@code nativeQuery}. Driver failures surface as
   * {@link io.intellixity.restquery.error.AdapterException} with code {@code ADP_EXECUTION_FAILED}.
   *
   * @param query the IR {@code nativeQuery} was produced from; used for the result envelope (may be null)
   */
  QueryResult executeQuery(N nativeQuery, IntermediateQuery query, ExecutionOptions options);

  ValidationResult validateQuery(IntermediateQuery query);

  BackendCapabilities getCapabilities();

  /** Primary-key field used for lookups by id. */
  default String idField() {
    return "_id";
  }

  /** Converts an id taken from a request path to the value compared against {@link #idField()}. */
  default Object idValue(Object id) {
    return id;
  }

  /** Registry key {@code name@version}. */
  default String key() {
    return name() + "@" + version();
  }
}
