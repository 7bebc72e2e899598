package io.bakky.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bakky.persistence.jdbc.ConnectionParameters;
import io.bakky.persistence.jdbc.JdbcDataEngine;
import io.bakky.persistence.jdbc.async.AsyncConnectionManager;
import io.bakky.persistence.jdbc.async.AsyncJdbcDataEngine;
import io.bakky.persistence.jdbc.pool.PooledEngine;
import io.bakky.persistence.jdbc.postgres.PostgresAdmin;
import io.bakky.persistence.jdbc.postgres.PostgresDataSources;
import io.bakky.persistence.jdbc.postgres.PostgresDialect;
import io.bakky.persistence.jdbc.postgres.PostgresSchemaIntrospector;
import io.bakky.persistence.mongo.MongoClientRegistry;
import io.bakky.persistence.mongo.MongoData;
import io.bakky.persistence.mongo.MongoEngine;
import io.bakky.persistence.redis.RedisCache;
import io.bakky.persistence.redis.RedisConnector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Composition root: every shared client, pool and registry is created here and closed by the container.\n
 * Mongo and Redis beans exist only when {@code bakky.mongo.enabled} / {@code bakky.redis.enabled} is set.
 */
@Configuration
@EnableConfigurationProperties(BakkyProperties.class)
public class BakkyConfig {

  @Bean
  public ConnectionParameters connectionParameters(BakkyProperties props) {
    return props.getDatabase().toConnectionParameters();
  }

  @Bean
  public PostgresDialect postgresDialect(ObjectMapper objectMapper) {
    return new PostgresDialect(objectMapper);
  }

  @Bean
  public PostgresSchemaIntrospector schemaIntrospector(PostgresDialect dialect) {
    return new PostgresSchemaIntrospector(dialect);
  }

  @Bean(destroyMethod = "close")
  public PooledEngine pooledEngine(BakkyProperties props, ConnectionParameters params, PostgresDialect dialect) {
    return PostgresDataSources.pooledEngine(params, props.getDatabase().toPoolSettings(), dialect);
  }

  @Bean
  public JdbcDataEngine jdbcDataEngine(PooledEngine pooled, PostgresDialect dialect,
                                       PostgresSchemaIntrospector introspector, ConnectionParameters params) {
    return new JdbcDataEngine(pooled.connections(), dialect, introspector, params.statementTimeout());
  }

  @Bean(destroyMethod = "close")
  public AsyncConnectionManager asyncConnectionManager(PooledEngine pooled, BakkyProperties props) {
    BakkyProperties.Database db = props.getDatabase();
    return AsyncConnectionManager.withWorkers(pooled.connections(), db.getAsyncWorkers(), db.getAsyncTimeout());
  }

  @Bean
  public AsyncJdbcDataEngine asyncJdbcDataEngine(JdbcDataEngine engine, AsyncConnectionManager async) {
    return new AsyncJdbcDataEngine(engine, async);
  }

  @Bean
  public PostgresAdmin postgresAdmin(PooledEngine pooled, PostgresDialect dialect) {
    return new PostgresAdmin(pooled.connections(), dialect);
  }

  @Bean(destroyMethod = "closeAll")
  @ConditionalOnProperty(prefix = "bakky.mongo", name = "enabled", havingValue = "true")
  public MongoClientRegistry mongoClientRegistry() {
    return new MongoClientRegistry();
  }

  @Bean
  @ConditionalOnProperty(prefix = "bakky.mongo", name = "enabled", havingValue = "true")
  public MongoEngine mongoEngine(MongoClientRegistry registry, BakkyProperties props) {
    return new MongoEngine(registry, props.getMongo().toMongoSettings());
  }

  @Bean
  @ConditionalOnProperty(prefix = "bakky.mongo", name = "enabled", havingValue = "true")
  public MongoData mongoData(MongoEngine engine) {
    return new MongoData(engine);
  }

  @Bean(destroyMethod = "closeAll")
  @ConditionalOnProperty(prefix = "bakky.redis", name = "enabled", havingValue = "true")
  public RedisConnector redisConnector() {
    return new RedisConnector();
  }

  /** Lazy: the first use connects, so a Redis outage does not block startup. */
  @Bean
  @Lazy
  @ConditionalOnProperty(prefix = "bakky.redis", name = "enabled", havingValue = "true")
  public RedisCache redisCache(RedisConnector connector, BakkyProperties props, ObjectMapper objectMapper) {
    var settings = props.getRedis().toRedisSettings();
    return new RedisCache(connector.client(settings), settings.defaultExpiry(), objectMapper);
  }
}
