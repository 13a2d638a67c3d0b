package io.intellixity.restquery.search;

import io.intellixity.restquery.spi.exec.handle.EngineHandle;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;

/** Search engine handle: an HTTP client, the cluster base URI and an optional index prefix. */
public final class SearchHandle implements EngineHandle<HttpClient> {
  private final String id;
  private final HttpClient client;
  private final URI baseUri;
  private final String indexPrefix;

  public SearchHandle(String id, HttpClient client, URI baseUri, String indexPrefix) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    this.indexPrefix = (indexPrefix == null || indexPrefix.isBlank()) ? null : indexPrefix;
  }

  public SearchHandle(String id, HttpClient client, URI baseUri) {
    this(id, client, baseUri, null);
  }

  @Override public String id() { return id; }
  @Override public HttpClient client() { return client; }
  @Override public String namespace() { return indexPrefix; }

  public URI baseUri() { return baseUri; }

  /** Physical index name for a collection. */
  public String indexFor(String collection) {
    return indexPrefix == null ? collection : indexPrefix + collection;
  }
}
