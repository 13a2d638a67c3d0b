package io.intellixity.restquery.search;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.restquery.query.*;
import io.intellixity.restquery.spi.exec.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Search backend adapter speaking the {@code _search} REST API over {@link java.net.http.HttpClient}.
 * <p>
 * Hits become rows {@code {_id, _score, ..._source}}; {@code hits.total.value} (or a plain numeric total) is
 * reported as the pagination total. Only reads are supported.
 */
public final class SearchBackendAdapter extends AbstractBackendAdapter<SearchRequest, SearchHandle> {
  private static final Logger log = LoggerFactory.getLogger(SearchBackendAdapter.class);

  public static final String NAME = "elasticsearch";
  public static final String VERSION = "1.0.0";

  private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {};

  private static final BackendCapabilities CAPABILITIES = new BackendCapabilities(
      EnumSet.allOf(ComparisonOperator.class),
      EnumSet.of(JoinType.NESTED, JoinType.PARENT_CHILD),
      EnumSet.allOf(AggregationType.class),
      EnumSet.of(QueryType.READ),
      true, false, true, 200, 10_000);

  private final ObjectMapper mapper;

  public SearchBackendAdapter(SearchHandle handle, SearchDialect dialect, ObjectMapper mapper,
                              QueryValidationStrategy validation) {
    super(NAME, VERSION, dialect, handle, validation);
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public SearchBackendAdapter(SearchHandle handle, SearchDialect dialect) {
    this(handle, dialect, new ObjectMapper(), null);
  }

  @Override
  public BackendType type() {
    return BackendType.ELASTICSEARCH;
  }

  @Override
  public BackendCapabilities getCapabilities() {
    return CAPABILITIES;
  }

  @Override
  protected BackendResult doExecute(SearchRequest req, IntermediateQuery query, ExecutionOptions options)
      throws IOException, InterruptedException {
    SearchHandle h = handle();
    String index = URLEncoder.encode(h.indexFor(req.index()), StandardCharsets.UTF_8);
    URI uri = h.baseUri().resolve("/" + index + "/_search");
    String payload = mapper.writeValueAsString(req.body());
    if (log.isDebugEnabled()) {
      log.debug("restquery.search op=search handleId={} index={} body={}", h.id(), index, payload);
    }

    HttpRequest http = HttpRequest.newBuilder(uri)
        .timeout(options.timeoutOrDefault())
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
        .build();
    HttpResponse<String> resp = h.client().send(http, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (resp.statusCode() / 100 != 2) {
      throw new IOException("HTTP " + resp.statusCode() + " from " + uri.getPath() + ": " + abbreviate(resp.body()));
    }

    JsonNode root = mapper.readTree(resp.body());
    JsonNode hits = root.path("hits");
    List<Map<String, Object>> rows = new ArrayList<>();
    for (JsonNode hit : hits.path("hits")) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("_id", hit.path("_id").isMissingNode() ? null : hit.path("_id").asText());
      JsonNode score = hit.path("_score");
      row.put("_score", score.isNumber() ? score.doubleValue() : null);
      JsonNode source = hit.path("_source");
      if (source.isObject()) row.putAll(mapper.convertValue(source, ROW));
      rows.add(row);
    }

    JsonNode total = hits.path("total");
    Long count = null;
    if (total.isObject() && total.path("value").isNumber()) count = total.path("value").longValue();
    else if (total.isNumber()) count = total.longValue();

    if (log.isDebugEnabled()) {
      log.debug("restquery.search_done index={} hits={} total={}", index, rows.size(), count);
    }
    return BackendResult.rows(rows, count);
  }

  private static String abbreviate(String s) {
    if (s == null) return "";
    return s.length() <= 200 ? s : s.substring(0, 200) + "...";
  }
}
