package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A connection bound to one unit of work.\n
 *
 * Always use with try-with-resources: {@link #close()} rolls back an unfinished transaction
 * and releases the connection on every exit path.
 */
public final class ScopedConnection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScopedConnection.class);

  private final Connection conn;
  private final boolean transactional;
  private boolean finished;
  private boolean closed;

  ScopedConnection(Connection conn, boolean transactional) throws SQLException {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.transactional = transactional;
    conn.setAutoCommit(!transactional);
  }

  public Connection connection() {
    if (closed) throw new IllegalStateException("connection already released");
    return conn;
  }

  public boolean transactional() { return transactional; }

  public void commit() throws SQLException {
    if (!transactional) return;
    conn.commit();
    finished = true;
  }

  public void rollback() throws SQLException {
    if (!transactional) return;
    finished = true;
    conn.rollback();
  }

  /**
   * Releases the connection.
   *
   * @throws ConnectionException only when an unfinished transaction could not be rolled back or released;
   *     a release failure after commit or rollback is logged, the outcome of the work stands
   */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    boolean failing = transactional && !finished;
    SQLException failure = null;
    if (failing) {
      try {
        conn.rollback();
        log.debug("bakky.jdbc op=ROLLBACK reason=unfinished-scope");
      } catch (SQLException e) {
        failure = e;
      }
    }
    try {
      conn.close();
    } catch (SQLException e) {
      if (!failing) {
        log.warn("bakky.jdbc op=RELEASE failed after finished work: {}", e.getMessage());
        return;
      }
      if (failure == null) failure = e;
      else failure.addSuppressed(e);
    }
    if (failure != null) throw new ConnectionException("Failed to release connection", failure);
  }
}
