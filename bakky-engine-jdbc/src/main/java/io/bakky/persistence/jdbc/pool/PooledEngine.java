package io.bakky.persistence.jdbc.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.jdbc.ConnectionManager;
import io.bakky.persistence.jdbc.bind.ValueBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Long-lived pooled engine with short-lived sessions (HikariCP).\n
 *
 * Creating the engine does not touch the database; {@link #checkConnection()} is the reachability probe.
 */
public final class PooledEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PooledEngine.class);

  @FunctionalInterface
  public interface SessionWork<T> {
    T run(Session session) throws SQLException;
  }

  private final HikariDataSource ds;
  private final ConnectionManager connections;
  private final ValueBinder binder;
  private final String probeSql;

  public PooledEngine(HikariConfig config, String schema, ValueBinder binder, String probeSql) {
    Objects.requireNonNull(config, "config");
    // never fail construction because the database is down
    config.setInitializationFailTimeout(-1);
    try {
      this.ds = new HikariDataSource(config);
    } catch (RuntimeException e) {
      throw new ConnectionException("Invalid pool configuration for " + config.getPoolName() + ": " + e.getMessage(), e);
    }
    String id = config.getPoolName() == null ? "pooled" : config.getPoolName();
    this.connections = new ConnectionManager(id, ds, schema);
    this.binder = binder == null ? ValueBinder.DEFAULT : binder;
    this.probeSql = probeSql == null ? "SELECT 1" : probeSql;
    log.info("bakky.pool op=CREATE pool={} maxSize={} schema={}", id, config.getMaximumPoolSize(), connections.schema());
  }

  public ConnectionManager connections() { return connections; }

  public DataSource dataSource() { return ds; }

  public Session openSession() {
    ensureOpen();
    return new Session(connections.acquire(true), binder);
  }

  /** Commits when the work returns, rolls back when it throws. */
  public <T> T inSession(SessionWork<T> work) throws SQLException {
    try (Session s = openSession()) {
      T out = work.run(s);
      s.commit();
      return out;
    }
  }

  /**
   * Round-trips a trivial query.
   *
   * @return false when the database cannot be reached or answers with an error
   * @throws IllegalStateException when the engine has been disposed
   */
  public boolean checkConnection() {
    ensureOpen();
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute(probeSql);
      log.debug("bakky.pool op=CHECK pool={} ok=true", connections.id());
      return true;
    } catch (SQLException e) {
      log.warn("bakky.pool op=CHECK pool={} ok=false reason={}", connections.id(), e.getMessage());
      return false;
    }
  }

  public boolean isClosed() {
    return ds.isClosed();
  }

  /** Disposes the pool. */
  @Override
  public void close() {
    if (ds.isClosed()) return;
    ds.close();
    log.info("bakky.pool op=DISPOSE pool={}", connections.id());
  }

  private void ensureOpen() {
    if (ds.isClosed()) throw new IllegalStateException("Engine " + connections.id() + " has been disposed");
  }
}
