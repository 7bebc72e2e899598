package io.bakky.app.init;

import io.bakky.persistence.jdbc.ConnectionParameters;
import io.bakky.persistence.jdbc.pool.PooledEngine;
import io.bakky.persistence.jdbc.postgres.PostgresAdmin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Startup check: the database must answer, and the configured schema is created when missing.
 * An unreachable database aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "bakky.database", name = "initialize", havingValue = "true", matchIfMissing = true)
public class DatabaseInitializer implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(DatabaseInitializer.class);

  private final PooledEngine pooled;
  private final PostgresAdmin admin;
  private final ConnectionParameters params;

  public DatabaseInitializer(PooledEngine pooled, PostgresAdmin admin, ConnectionParameters params) {
    this.pooled = Objects.requireNonNull(pooled, "pooled");
    this.admin = Objects.requireNonNull(admin, "admin");
    this.params = Objects.requireNonNull(params, "params");
  }

  @Override
  public void run(ApplicationArguments args) {
    initialize();
  }

  /** @throws IllegalStateException when the database cannot be reached */
  public void initialize() {
    log.info("bakky.init op=CHECK url={}", params.maskedUrl());
    if (!pooled.checkConnection()) {
      throw new IllegalStateException("Database " + params.maskedUrl() + " is not reachable");
    }
    if (!ConnectionParameters.DEFAULT_SCHEMA.equals(params.schema())) {
      admin.createSchemaIfAbsent(params.schema());
    }
    log.info("bakky.init op=READY url={} schema={} tables={}",
        params.maskedUrl(), params.schema(), admin.listTables(params.schema(), null).size());
  }
}
