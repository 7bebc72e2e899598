package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.exec.handle.EngineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Produces scoped connections from a {@link DataSource} and guarantees their release.\n
 *
 * - {@link #withConnection}: autocommit, one statement or read\n
 * - {@link #inTransaction}: commit on success, rollback on any exception\n
 *
 * The manager does not pool by itself; hand it a pooled DataSource (see PooledEngine) for that.
 */
public final class ConnectionManager implements EngineHandle<DataSource> {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final String id;
  private final DataSource client;
  private final String schema;

  public ConnectionManager(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? ConnectionParameters.DEFAULT_SCHEMA : schema;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }

  /** Autocommit connection. */
  public ScopedConnection acquire() {
    return acquire(false);
  }

  /**
   * @throws ConnectionException when the handshake or authentication fails
   */
  public ScopedConnection acquire(boolean transactional) {
    Connection c;
    try {
      c = client.getConnection();
    } catch (SQLException e) {
      log.error("bakky.jdbc op=ACQUIRE handleId={} failed: {}", id, e.getMessage());
      throw new ConnectionException("Cannot connect using handle " + id + ": " + e.getMessage(), e);
    }
    try {
      return new ScopedConnection(c, transactional);
    } catch (SQLException e) {
      closeAfterFailure(c, e);
      throw new ConnectionException("Cannot prepare connection for handle " + id, e);
    }
  }

  public <T> T withConnection(SqlWork<T> work) throws SQLException {
    return withConnection(work, TransactionGuard.none());
  }

  /** Autocommit work; refused once the guard has expired. */
  public <T> T withConnection(SqlWork<T> work, TransactionGuard guard) throws SQLException {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(guard, "guard");
    guard.checkOpen("connection on handle " + id);
    try (ScopedConnection sc = acquire(false)) {
      return work.run(sc.connection());
    }
  }

  /**
   * Runs the work in one transaction. Any exception rolls back before it propagates;
   * a rollback failure is attached as suppressed.
   */
  public <T> T inTransaction(SqlWork<T> work) throws SQLException {
    return inTransaction(work, TransactionGuard.none());
  }

  /**
   * As {@link #inTransaction(SqlWork)}, but commits only if the guard's deadline has not expired;
   * otherwise rolls back and raises {@link QueryException}.
   */
  public <T> T inTransaction(SqlWork<T> work, TransactionGuard guard) throws SQLException {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(guard, "guard");
    guard.checkOpen("transaction on handle " + id);
    try (ScopedConnection sc = acquire(true)) {
      T out;
      try {
        out = work.run(sc.connection());
        if (!guard.beginCommit()) {
          throw new QueryException("Deadline expired before commit on handle " + id + "; transaction rolled back");
        }
      } catch (SQLException | RuntimeException e) {
        rollbackAfterFailure(sc, e);
        throw e;
      }
      sc.commit();
      log.debug("bakky.jdbc op=COMMIT handleId={}", id);
      return out;
    }
  }

  private void rollbackAfterFailure(ScopedConnection sc, Exception cause) {
    try {
      sc.rollback();
      log.debug("bakky.jdbc op=ROLLBACK handleId={} cause={}", id, cause.getClass().getSimpleName());
    } catch (SQLException re) {
      cause.addSuppressed(re);
    }
  }

  private static void closeAfterFailure(Connection c, SQLException cause) {
    try {
      c.close();
    } catch (SQLException ce) {
      cause.addSuppressed(ce);
    }
  }
}
