package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.error.AdapterException;
import io.intellixity.restquery.error.RestQueryException;
import io.intellixity.restquery.query.IntermediateQuery;
import io.intellixity.restquery.spi.dialect.NativeDialect;
import io.intellixity.restquery.spi.exec.handle.EngineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method base for adapters.
 * <p>
 * Lowering is delegated to a {@link NativeDialect}, validation to a {@link QueryValidationStrategy}; subclasses
 * only implement {@link #doExecute}. Execution is timed, failures are wrapped with a backend-qualified message and
 * the result envelope is built here.
 */
public abstract class AbstractBackendAdapter<N, H extends EngineHandle<?>> implements BackendAdapter<N> {
  private static final Logger log = LoggerFactory.getLogger(AbstractBackendAdapter.class);

  private final String name;
  private final String version;
  private final NativeDialect<N> dialect;
  private final H handle;
  private final QueryValidationStrategy queryValidation;

  protected AbstractBackendAdapter(String name, String version, NativeDialect<N> dialect, H handle,
                                   QueryValidationStrategy queryValidation) {
    this.name = Objects.requireNonNull(name, "name");
    this.version = Objects.requireNonNull(version, "version");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
  }

  protected AbstractBackendAdapter(String name, String version, NativeDialect<N> dialect, H handle) {
    this(name, version, dialect, handle, null);
  }

  @Override public final String name() { return name; }
  @Override public final String version() { return version; }

  protected final NativeDialect<N> dialect() { return dialect; }
  protected final H handle() { return handle; }
  protected QueryValidationStrategy queryValidation() { return queryValidation; }

  @Override
  public N convertQuery(IntermediateQuery query) {
    Objects.requireNonNull(query, "query");
    N out = dialect.render(query);
    if (log.isDebugEnabled()) {
      log.debug("restquery.adapter op=convert adapter={} dialect={} collection={} type={}",
          key(), dialect.id(), query.collection(), query.type().token());
    }
    return out;
  }

  @Override
  public ValidationResult validateQuery(IntermediateQuery query) {
    return queryValidation().validate(query, getCapabilities());
  }

  @Override
  public final QueryResult executeQuery(N nativeQuery, IntermediateQuery query, ExecutionOptions options) {
    Objects.requireNonNull(nativeQuery, "nativeQuery");
    ExecutionOptions opts = (options == null) ? ExecutionOptions.defaults() : options;
    long start = System.nanoTime();
    BackendResult raw;
    try {
      raw = doExecute(nativeQuery, query, opts);
    } catch (RestQueryException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw AdapterException.executionFailed(type().label(), e);
    } catch (Exception e) {
      log.debug("restquery.adapter op=execute adapter={} failed={}", key(), e.toString());
      throw AdapterException.executionFailed(type().label(), e);
    }
    long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
    if (log.isDebugEnabled()) {
      log.debug("restquery.adapter op=execute adapter={} rows={} elapsedMs={}", key(), raw.rows().size(), elapsedMs);
    }
    return createResult(raw, query, nativeQuery, elapsedMs);
  }

  /** Backend-specific execution of an already lowered query. */
  protected abstract BackendResult doExecute(N nativeQuery, IntermediateQuery query, ExecutionOptions options)
      throws Exception;

  /**
   * Builds the result envelope. Pagination is reported only when the IR carried one: offset defaults to 0, limit to
   * the row count, and {@code hasMore} is true when a limit was given and the page is full.
   */
  protected QueryResult createResult(BackendResult raw, IntermediateQuery query, Object nativeQuery, long executionTime) {
    List<Map<String, Object>> rows = raw.rows();
    ResultMetadata meta = new ResultMetadata(name, query, nativeQuery, executionTime,
        raw.insertedCount(), raw.modifiedCount(), raw.deletedCount(), raw.matchedCount());

    PaginationInfo page = null;
    if (query != null && query.pagination() != null) {
      Integer limit = query.pagination().limit();
      page = new PaginationInfo(
          query.pagination().offsetOrZero(),
          limit == null ? rows.size() : limit,
          raw.total(),
          limit != null && rows.size() >= limit);
    }
    return new QueryResult(rows, meta, page);
  }
}
