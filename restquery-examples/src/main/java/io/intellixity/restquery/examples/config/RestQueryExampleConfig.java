package io.intellixity.restquery.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.restquery.compile.JoinEnhancer;
import io.intellixity.restquery.convert.QueryConverter;
import io.intellixity.restquery.governance.GovernedQueryService;
import io.intellixity.restquery.jdbc.JdbcBackendAdapter;
import io.intellixity.restquery.jdbc.JdbcHandle;
import io.intellixity.restquery.jdbc.mysql.MySqlDialect;
import io.intellixity.restquery.jdbc.postgres.PostgresDialect;
import io.intellixity.restquery.mongo.MongoBackendAdapter;
import io.intellixity.restquery.mongo.MongoDialect;
import io.intellixity.restquery.mongo.MongoHandle;
import io.intellixity.restquery.rbac.RbacConfigLoader;
import io.intellixity.restquery.rbac.RbacFieldResolver;
import io.intellixity.restquery.relation.RelationshipDefinitionsLoader;
import io.intellixity.restquery.relation.RelationshipRegistry;
import io.intellixity.restquery.search.SearchBackendAdapter;
import io.intellixity.restquery.search.SearchDialect;
import io.intellixity.restquery.search.SearchHandle;
import io.intellixity.restquery.spi.exec.AdapterRegistry;
import io.intellixity.restquery.spi.exec.BackendType;
import io.intellixity.restquery.spi.exec.ExecutionOptions;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(RestQueryProperties.class)
public class RestQueryExampleConfig {

  @Bean
  public RelationshipRegistry relationshipRegistry(RestQueryProperties props, ResourceLoader resources,
                                                   ObjectMapper mapper) throws IOException {
    try (InputStream in = resources.getResource(props.getRelationshipsFile()).getInputStream()) {
      return new RelationshipDefinitionsLoader(mapper).loadRegistry(in);
    }
  }

  @Bean
  public RbacFieldResolver rbacFieldResolver(RestQueryProperties props, ResourceLoader resources,
                                             ObjectMapper mapper) throws IOException {
    try (InputStream in = resources.getResource(props.getRbacFile()).getInputStream()) {
      return new RbacFieldResolver(new RbacConfigLoader(mapper).load(in));
    }
  }

  @Bean
  public BackendResources backendResources() {
    return new BackendResources();
  }

  @Bean
  public AdapterRegistry adapterRegistry(RestQueryProperties props, RelationshipRegistry relationships,
                                         BackendResources resources, ObjectMapper mapper) {
    AdapterRegistry registry = new AdapterRegistry();

    RestQueryProperties.Mongo mongo = props.getMongo();
    if (mongo.isEnabled()) {
      MongoClient client = resources.track(MongoClients.create(mongo.getUri()));
      registry.register(new MongoBackendAdapter(
          new MongoHandle("mongo:" + mongo.getDatabase(), client, mongo.getDatabase()), new MongoDialect(relationships)));
    }

    RestQueryProperties.Jdbc pg = props.getPostgres();
    if (pg.isEnabled()) {
      HikariDataSource ds = resources.track(pool("postgres", pg));
      registry.register(new JdbcBackendAdapter(BackendType.POSTGRESQL,
          new JdbcHandle("jdbc:postgres", ds, pg.getSchema()), new PostgresDialect()));
    }

    RestQueryProperties.Jdbc my = props.getMysql();
    if (my.isEnabled()) {
      HikariDataSource ds = resources.track(pool("mysql", my));
      registry.register(new JdbcBackendAdapter(BackendType.MYSQL,
          new JdbcHandle("jdbc:mysql", ds, my.getSchema()), new MySqlDialect()));
    }

    RestQueryProperties.Search search = props.getSearch();
    if (search.isEnabled()) {
      HttpClient http = HttpClient.newBuilder().connectTimeout(search.getConnectTimeout()).build();
      registry.register(new SearchBackendAdapter(
          new SearchHandle("search", http, URI.create(search.getBaseUri()), search.getIndexPrefix()),
          new SearchDialect(mapper), mapper, null));
    }
    return registry;
  }

  @Bean
  public GovernedQueryService governedQueryService(RestQueryProperties props,
                                                   RelationshipRegistry relationships,
                                                   RbacFieldResolver rbac,
                                                   AdapterRegistry adapters) {
    return new GovernedQueryService(
        new QueryConverter(),
        new JoinEnhancer(relationships, props.isStrictRelationships()),
        rbac,
        adapters,
        ExecutionOptions.withTimeout(props.getTimeout()));
  }

  private static HikariDataSource pool(String name, RestQueryProperties.Jdbc db) {
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing restquery." + name + ".jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("restquery-" + name);
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    return new HikariDataSource(hc);
  }
}
