package io.intellixity.restquery.examples.web;

import io.intellixity.restquery.convert.QueryParams;
import io.intellixity.restquery.error.ResourceNotFoundException;
import io.intellixity.restquery.examples.config.RestQueryProperties;
import io.intellixity.restquery.governance.GovernedQueryService;
import io.intellixity.restquery.spi.exec.BackendType;
import io.intellixity.restquery.spi.exec.QueryResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Generic REST surface over every configured collection. Query parameters follow the filter grammar
 * ({@code ?age=gt.25&select=name,posts(title)&order=-age&limit=10}); the backend is picked with
 * {@value #BACKEND_HEADER} or the configured default.
 */
@RestController
@RequestMapping("/api/{collection}")
public final class QueryController {
  public static final String BACKEND_HEADER = "X-Backend";

  private final GovernedQueryService service;
  private final RestQueryProperties props;

  public QueryController(GovernedQueryService service, RestQueryProperties props) {
    this.service = service;
    this.props = props;
  }

  @GetMapping
  public QueryResult list(@PathVariable("collection") String collection,
                          @RequestParam MultiValueMap<String, String> params,
                          @RequestHeader(value = BACKEND_HEADER, required = false) String backend,
                          @RequestAttribute(CallerRolesFilter.ROLES_ATTRIBUTE) List<String> roles) {
    return service.processQuery(QueryParams.ofMulti(params), collection, roles, backend(backend), null);
  }

  @GetMapping("/{id}")
  public Map<String, Object> get(@PathVariable("collection") String collection,
                                 @PathVariable("id") String id,
                                 @RequestHeader(value = BACKEND_HEADER, required = false) String backend,
                                 @RequestAttribute(CallerRolesFilter.ROLES_ATTRIBUTE) List<String> roles) {
    return service.findById(collection, id, roles, backend(backend), null);
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> create(@PathVariable("collection") String collection,
                                                    @RequestBody Map<String, Object> body,
                                                    @RequestHeader(value = BACKEND_HEADER, required = false) String backend,
                                                    @RequestAttribute(CallerRolesFilter.ROLES_ATTRIBUTE) List<String> roles) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(service.create(collection, body, roles, backend(backend), null));
  }

  @PutMapping("/{id}")
  public QueryResult replace(@PathVariable("collection") String collection,
                             @PathVariable("id") String id,
                             @RequestBody Map<String, Object> body,
                             @RequestHeader(value = BACKEND_HEADER, required = false) String backend,
                             @RequestAttribute(CallerRolesFilter.ROLES_ATTRIBUTE) List<String> roles) {
    return service.update(collection, id, body, roles, backend(backend), null);
  }

  @PatchMapping("/{id}")
  public QueryResult patch(@PathVariable("collection") String collection,
                           @PathVariable("id") String id,
                           @RequestBody Map<String, Object> body,
                           @RequestHeader(value = BACKEND_HEADER, required = false) String backend,
                           @RequestAttribute(CallerRolesFilter.ROLES_ATTRIBUTE) List<String> roles) {
    return service.partialUpdate(collection, id, body, roles, backend(backend), null);
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("collection") String collection,
                                     @PathVariable("id") String id,
                                     @RequestHeader(value = BACKEND_HEADER, required = false) String backend,
                                     @RequestAttribute(CallerRolesFilter.ROLES_ATTRIBUTE) List<String> roles) {
    if (!service.delete(collection, id, roles, backend(backend), null)) {
      throw new ResourceNotFoundException(collection, id);
    }
    return ResponseEntity.noContent().build();
  }

  private BackendType backend(String requested) {
    String token = (requested == null || requested.isBlank()) ? props.getDefaultBackend() : requested;
    BackendType type = BackendType.fromToken(token);
    if (type == null) throw new IllegalArgumentException("Unknown backend: " + token);
    return type;
  }
}
