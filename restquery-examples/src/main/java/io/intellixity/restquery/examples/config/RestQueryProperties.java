package io.intellixity.restquery.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "restquery")
public class RestQueryProperties {
  /** Backend used when a request does not name one ({@code mongodb}, {@code postgresql}, ...). */
  private String defaultBackend = "mongodb";
  private String rbacFile = "classpath:rbac.json";
  private String relationshipsFile = "classpath:relationships.json";
  private Duration timeout = Duration.ofSeconds(30);
  /** Raise on embeds that name no registered relationship instead of passing them through. */
  private boolean strictRelationships = false;

  private final Jdbc postgres = new Jdbc();
  private final Jdbc mysql = new Jdbc();
  private final Mongo mongo = new Mongo();
  private final Search search = new Search();

  public String getDefaultBackend() { return defaultBackend; }
  public void setDefaultBackend(String defaultBackend) { this.defaultBackend = defaultBackend; }
  public String getRbacFile() { return rbacFile; }
  public void setRbacFile(String rbacFile) { this.rbacFile = rbacFile; }
  public String getRelationshipsFile() { return relationshipsFile; }
  public void setRelationshipsFile(String relationshipsFile) { this.relationshipsFile = relationshipsFile; }
  public Duration getTimeout() { return timeout; }
  public void setTimeout(Duration timeout) { this.timeout = timeout; }
  public boolean isStrictRelationships() { return strictRelationships; }
  public void setStrictRelationships(boolean strictRelationships) { this.strictRelationships = strictRelationships; }

  public Jdbc getPostgres() { return postgres; }
  public Jdbc getMysql() { return mysql; }
  public Mongo getMongo() { return mongo; }
  public Search getSearch() { return search; }

  public static class Jdbc {
    private boolean enabled;
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema;
    private int maximumPoolSize = 10;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Mongo {
    private boolean enabled;
    private String uri = "mongodb://localhost:27017";
    private String database;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Search {
    private boolean enabled;
    private String baseUri = "http://localhost:9200";
    /** Optional prefix prepended to every index name. */
    private String indexPrefix;
    private Duration connectTimeout = Duration.ofSeconds(5);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getBaseUri() { return baseUri; }
    public void setBaseUri(String baseUri) { this.baseUri = baseUri; }
    public String getIndexPrefix() { return indexPrefix; }
    public void setIndexPrefix(String indexPrefix) { this.indexPrefix = indexPrefix; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
  }
}
