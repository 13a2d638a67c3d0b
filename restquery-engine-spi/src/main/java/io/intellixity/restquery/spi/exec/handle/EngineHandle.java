package io.intellixity.restquery.spi.exec.handle;

/**
 * Resolved runtime handle for one backend.
 * <p>
 * JDBC: {@code client()} is a {@code DataSource} and {@code namespace()} the schema. Mongo: {@code client()} is a
 * {@code MongoClient} and {@code namespace()} the database. Search: {@code client()} is an {@code HttpClient} and
 * {@code namespace()} an optional index prefix.
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by the adapter. */
  TClient client();

  /** Namespace (schema/database/index prefix); may be null. */
  String namespace();
}
