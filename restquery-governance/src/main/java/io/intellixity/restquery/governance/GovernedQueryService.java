package io.intellixity.restquery.governance;

import io.intellixity.restquery.compile.JoinEnhancer;
import io.intellixity.restquery.convert.QueryConverter;
import io.intellixity.restquery.convert.QueryParams;
import io.intellixity.restquery.error.AccessDeniedException;
import io.intellixity.restquery.error.AdapterException;
import io.intellixity.restquery.error.QueryValidationException;
import io.intellixity.restquery.error.ResourceNotFoundException;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.rbac.RbacAction;
import io.intellixity.restquery.rbac.RbacFieldResolver;
import io.intellixity.restquery.spi.exec.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Governance front door over the adapter registry.
 * <p>
 * Reads run: access check, convert, enhance joins, RBAC projection, capability validation, lowering, execution.
 * Access is checked before any IR is built. Mutations check {@code write}/{@code delete} access and strip payload
 * keys the caller may not write. Every collaborator is passed in; instances hold no per-request state.
 */
public final class GovernedQueryService {
  private static final Logger log = LoggerFactory.getLogger(GovernedQueryService.class);

  private final QueryConverter converter;
  private final JoinEnhancer enhancer;
  private final RbacFieldResolver rbac;
  private final AdapterRegistry adapters;
  private final ExecutionOptions options;

  public GovernedQueryService(QueryConverter converter,
                              JoinEnhancer enhancer,
                              RbacFieldResolver rbac,
                              AdapterRegistry adapters,
                              ExecutionOptions options) {
    this.converter = Objects.requireNonNull(converter, "converter");
    this.enhancer = Objects.requireNonNull(enhancer, "enhancer");
    this.rbac = Objects.requireNonNull(rbac, "rbac");
    this.adapters = Objects.requireNonNull(adapters, "adapters");
    this.options = (options == null) ? ExecutionOptions.defaults() : options;
  }

  public GovernedQueryService(JoinEnhancer enhancer, RbacFieldResolver rbac, AdapterRegistry adapters) {
    this(new QueryConverter(), enhancer, rbac, adapters, null);
  }

  /* ---------------- reads ---------------- */

  public QueryResult processQuery(QueryParams params, String collection, List<String> roles,
                                  BackendType type, String adapterName) {
    IntermediateQuery query = convertToIntermediate(params, collection, roles);
    BackendAdapter<?> adapter = adapter(type, adapterName);
    return validateAndRun(adapter, query);
  }

  public QueryResult processQuery(Map<String, String> params, String collection, List<String> roles, BackendType type) {
    return processQuery(QueryParams.of(params), collection, roles, type, null);
  }

  /** Runs {@link #processQuery} on {@code executor}; failures complete the future exceptionally. */
  public CompletableFuture<QueryResult> processQueryAsync(QueryParams params, String collection, List<String> roles,
                                                          BackendType type, String adapterName, Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> processQuery(params, collection, roles, type, adapterName), executor);
  }

  /** Access check, conversion, join enhancement and RBAC projection, without touching a backend. */
  public IntermediateQuery convertToIntermediate(QueryParams params, String collection, List<String> roles) {
    requireRead(collection, roles);
    IntermediateQuery query = converter.convert(params, collection, roles);
    query = enhancer.enhance(query);
    return rbac.applyToSelect(query, rbac.getRbacFeatures(collection, RbacAction.READ, roles));
  }

  /** Lowers an IR with the adapter for {@code type}; no validation, no execution. */
  public Object convertToNative(IntermediateQuery query, BackendType type, String adapterName) {
    return adapter(type, adapterName).convertQuery(query);
  }

  /** Single row whose id field equals {@code id}, projected by the caller's read permissions. */
  public Map<String, Object> findById(String collection, Object id, List<String> roles,
                                      BackendType type, String adapterName) {
    requireRead(collection, roles);
    BackendAdapter<?> adapter = adapter(type, adapterName);
    IntermediateQuery query = IntermediateQuery.read(collection)
        .withFilter(FilterCondition.of(FieldCondition.eq(adapter.idField(), adapter.idValue(id))))
        .withPagination(new PaginationClause(null, 1, null))
        .withMetadata(metadata(roles));
    query = rbac.applyToSelect(query, rbac.getRbacFeatures(collection, RbacAction.READ, roles));

    QueryResult result = validateAndRun(adapter, query);
    if (result.data().isEmpty()) throw new ResourceNotFoundException(collection, id);
    return result.data().get(0);
  }

  /* ---------------- mutations ---------------- */

  /** Inserts the permitted part of {@code data}; returns the stored row as reported by the backend. */
  public Map<String, Object> create(String collection, Map<String, Object> data, List<String> roles,
                                    BackendType type, String adapterName) {
    if (!rbac.hasAccess(collection, RbacAction.WRITE, roles)) throw AccessDeniedException.create(collection, roles);
    BackendAdapter<?> adapter = adapter(type, adapterName);
    IntermediateQuery query = new IntermediateQuery(collection)
        .withType(QueryType.INSERT)
        .withData(rbac.filterBodyData(collection, RbacAction.WRITE, roles, data))
        .withMetadata(metadata(roles));

    QueryResult result = validateAndRun(adapter, query);
    return result.data().isEmpty() ? query.data() : result.data().get(0);
  }

  /** Whole-document update of the row with {@code id}. */
  public QueryResult update(String collection, Object id, Map<String, Object> data, List<String> roles,
                            BackendType type, String adapterName) {
    return update(collection, id, data, roles, type, adapterName, false);
  }

  /** Merge-patch update of the row with {@code id}. */
  public QueryResult partialUpdate(String collection, Object id, Map<String, Object> data, List<String> roles,
                                   BackendType type, String adapterName) {
    return update(collection, id, data, roles, type, adapterName, true);
  }

  /** Deletes the row with {@code id}; true when the backend reported a deletion. */
  public boolean delete(String collection, Object id, List<String> roles, BackendType type, String adapterName) {
    if (!rbac.hasAccess(collection, RbacAction.DELETE, roles)) throw AccessDeniedException.delete(collection, roles);
    BackendAdapter<?> adapter = adapter(type, adapterName);
    IntermediateQuery query = new IntermediateQuery(collection)
        .withType(QueryType.DELETE)
        .withFilters(List.of(FieldCondition.eq(adapter.idField(), adapter.idValue(id))))
        .withMetadata(metadata(roles));

    Long deleted = validateAndRun(adapter, query).metadata().deletedCount();
    return deleted != null && deleted > 0;
  }

  public List<BackendType> getSupportedBackendTypes() {
    return adapters.getSupportedTypes();
  }

  private QueryResult update(String collection, Object id, Map<String, Object> data, List<String> roles,
                             BackendType type, String adapterName, boolean partial) {
    if (!rbac.hasAccess(collection, RbacAction.WRITE, roles)) throw AccessDeniedException.update(collection, roles);
    BackendAdapter<?> adapter = adapter(type, adapterName);
    IntermediateQuery query = new IntermediateQuery(collection)
        .withType(QueryType.UPDATE)
        .withData(rbac.filterBodyData(collection, RbacAction.WRITE, roles, data))
        .withFilters(List.of(FieldCondition.eq(adapter.idField(), adapter.idValue(id))))
        .withMetadata(metadata(roles));
    if (partial) query.withOption(IntermediateQuery.OPTION_PARTIAL, true);

    QueryResult result = validateAndRun(adapter, query);
    Long matched = result.metadata().matchedCount();
    if (matched != null && matched == 0L) throw new ResourceNotFoundException(collection, id);
    return result;
  }

  /* ---------------- pipeline ---------------- */

  private void requireRead(String collection, List<String> roles) {
    if (!rbac.hasAccess(collection, RbacAction.READ, roles)) {
      log.debug("restquery.governance op=deny collection={} action=read roles={}", collection, roles);
      throw AccessDeniedException.read(collection, roles);
    }
  }

  private BackendAdapter<?> adapter(BackendType type, String adapterName) {
    Objects.requireNonNull(type, "type");
    return adapters.getAdapterByType(type, adapterName)
        .orElseThrow(() -> AdapterException.notFound(type.token()));
  }

  private QueryResult validateAndRun(BackendAdapter<?> adapter, IntermediateQuery query) {
    ValidationResult v = adapter.validateQuery(query);
    if (!v.valid()) {
      List<Map<String, Object>> errors = v.errorMaps();
      log.debug("restquery.governance op=reject adapter={} collection={} errors={}",
          adapter.key(), query.collection(), errors.size());
      throw new QueryValidationException(adapter.key(), errors);
    }
    return run(adapter, query);
  }

  private <N> QueryResult run(BackendAdapter<N> adapter, IntermediateQuery query) {
    N nativeQuery = adapter.convertQuery(query);
    if (log.isDebugEnabled()) {
      log.debug("restquery.governance op={} adapter={} collection={} joins={}",
          query.type().token(), adapter.key(), query.collection(), query.joins().size());
    }
    return adapter.executeQuery(nativeQuery, query, options);
  }

  private static QueryMetadata metadata(List<String> roles) {
    return new QueryMetadata(null, roles, QueryMetadata.REST_SOURCE, System.currentTimeMillis());
  }
}
