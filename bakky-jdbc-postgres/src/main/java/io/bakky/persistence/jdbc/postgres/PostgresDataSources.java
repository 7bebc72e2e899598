package io.bakky.persistence.jdbc.postgres;

import com.zaxxer.hikari.HikariConfig;
import io.bakky.persistence.jdbc.ConnectionManager;
import io.bakky.persistence.jdbc.ConnectionParameters;
import io.bakky.persistence.jdbc.pool.PoolSettings;
import io.bakky.persistence.jdbc.pool.PooledEngine;
import org.postgresql.ds.PGSimpleDataSource;

import java.util.Objects;

/** Builds Postgres DataSources and pools from {@link ConnectionParameters}. */
public final class PostgresDataSources {
  public static final String APPLICATION_NAME = "bakky";

  private PostgresDataSources() {}

  public static String jdbcUrl(ConnectionParameters p) {
    StringBuilder url = new StringBuilder("jdbc:postgresql://")
        .append(p.host()).append(':').append(p.port()).append('/').append(p.database())
        .append("?ApplicationName=").append(APPLICATION_NAME)
        .append("&connectTimeout=").append(Math.max(1, p.connectTimeout().toSeconds()));
    if (p.sslMode() != null) url.append("&sslmode=").append(p.sslMode());
    return url.toString();
  }

  /** Unpooled DataSource: every acquisition opens a fresh connection. */
  public static PGSimpleDataSource simple(ConnectionParameters p) {
    Objects.requireNonNull(p, "p");
    PGSimpleDataSource ds = new PGSimpleDataSource();
    ds.setServerNames(new String[]{p.host()});
    ds.setPortNumbers(new int[]{p.port()});
    ds.setDatabaseName(p.database());
    ds.setUser(p.user());
    ds.setPassword(p.password());
    ds.setApplicationName(APPLICATION_NAME);
    ds.setConnectTimeout((int) Math.max(1, p.connectTimeout().toSeconds()));
    if (p.sslMode() != null) ds.setSslmode(p.sslMode());
    return ds;
  }

  public static ConnectionManager connectionManager(ConnectionParameters p) {
    return new ConnectionManager("pg:" + p.host() + ":" + p.port() + "/" + p.database(), simple(p), p.schema());
  }

  public static HikariConfig hikariConfig(ConnectionParameters p, PoolSettings pool, String poolName) {
    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName(poolName == null ? "bakky-pg" : poolName);
    cfg.setJdbcUrl(jdbcUrl(p));
    cfg.setUsername(p.user());
    cfg.setPassword(p.password());
    cfg.setMinimumIdle(pool.poolSize());
    cfg.setMaximumPoolSize(pool.maximumPoolSize());
    cfg.setMaxLifetime(pool.recycle().toMillis());
    cfg.setConnectionTimeout(pool.acquireTimeout().toMillis());
    cfg.setAutoCommit(true);
    return cfg;
  }

  public static PooledEngine pooledEngine(ConnectionParameters p, PoolSettings pool, PostgresDialect dialect) {
    return new PooledEngine(hikariConfig(p, pool, null), p.schema(), dialect.binder(), dialect.probeSql());
  }
}
