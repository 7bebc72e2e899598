package io.bakky.persistence.jdbc;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * DataSource handing out recording connections.\n
 *
 * Statements are refused unless a {@link StatementScript} is set; with one, every executed statement
 * is recorded and answered by the script.
 */
public final class FakeDataSource implements DataSource {
  public final AtomicInteger acquired = new AtomicInteger();
  public final AtomicInteger closed = new AtomicInteger();
  public final AtomicInteger commits = new AtomicInteger();
  public final AtomicInteger rollbacks = new AtomicInteger();
  public final AtomicInteger cancelled = new AtomicInteger();
  public final CountDownLatch cancelRequested = new CountDownLatch(1);
  public final List<Boolean> autoCommitModes = new ArrayList<>();
  public final List<String> executed = Collections.synchronizedList(new ArrayList<>());
  public final List<Integer> queryTimeouts = Collections.synchronizedList(new ArrayList<>());
  public volatile SQLException failOnAcquire;
  public volatile SQLException failOnClose;
  public volatile StatementScript script;

  /** Answers one executed statement: a {@link ResultSet} for queries, an {@link Integer} count for updates. */
  @FunctionalInterface
  public interface StatementScript {
    Object respond(String sql, List<Object> binds) throws SQLException;
  }

  @Override
  public Connection getConnection() throws SQLException {
    if (failOnAcquire != null) throw failOnAcquire;
    acquired.incrementAndGet();
    return (Connection) Proxy.newProxyInstance(
        FakeDataSource.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "setAutoCommit" -> {
              synchronized (autoCommitModes) { autoCommitModes.add((Boolean) args[0]); }
              return null;
            }
            case "commit" -> { commits.incrementAndGet(); return null; }
            case "rollback" -> { rollbacks.incrementAndGet(); return null; }
            case "close" -> {
              closed.incrementAndGet();
              if (failOnClose != null) throw failOnClose;
              return null;
            }
            case "prepareStatement" -> {
              if (script == null) throw new UnsupportedOperationException("prepareStatement");
              return statement((String) args[0]);
            }
            case "isClosed" -> { return false; }
            case "toString" -> { return "FakeConnection"; }
            case "hashCode" -> { return System.identityHashCode(proxy); }
            case "equals" -> { return proxy == args[0]; }
            default -> throw new UnsupportedOperationException(method.getName());
          }
        });
  }

  private PreparedStatement statement(String sql) {
    Map<Integer, Object> binds = new TreeMap<>();
    List<List<Object>> batches = new ArrayList<>();
    return (PreparedStatement) Proxy.newProxyInstance(
        FakeDataSource.class.getClassLoader(),
        new Class<?>[]{PreparedStatement.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "setObject" -> { binds.put((Integer) args[0], args[1]); return null; }
            case "setNull" -> { binds.put((Integer) args[0], null); return null; }
            case "setQueryTimeout" -> { queryTimeouts.add((Integer) args[0]); return null; }
            case "setFetchSize", "close" -> { return null; }
            case "addBatch" -> { batches.add(new ArrayList<>(binds.values())); binds.clear(); return null; }
            case "executeBatch" -> {
              executed.add(sql);
              int[] counts = new int[batches.size()];
              for (int i = 0; i < counts.length; i++) counts[i] = (Integer) script.respond(sql, batches.get(i));
              return counts;
            }
            case "executeQuery" -> {
              executed.add(sql);
              return (ResultSet) script.respond(sql, new ArrayList<>(binds.values()));
            }
            case "executeUpdate" -> {
              executed.add(sql);
              return (Integer) script.respond(sql, new ArrayList<>(binds.values()));
            }
            case "cancel" -> {
              cancelled.incrementAndGet();
              cancelRequested.countDown();
              return null;
            }
            case "toString" -> { return "FakeStatement[" + sql + "]"; }
            case "hashCode" -> { return System.identityHashCode(proxy); }
            case "equals" -> { return proxy == args[0]; }
            default -> throw new UnsupportedOperationException(method.getName());
          }
        });
  }

  @Override public Connection getConnection(String username, String password) throws SQLException { return getConnection(); }
  @Override public PrintWriter getLogWriter() { return null; }
  @Override public void setLogWriter(PrintWriter out) {}
  @Override public void setLoginTimeout(int seconds) {}
  @Override public int getLoginTimeout() { return 0; }
  @Override public Logger getParentLogger() { return Logger.getGlobal(); }
  @Override public <T> T unwrap(Class<T> iface) throws SQLException { throw new SQLException("not a wrapper"); }
  @Override public boolean isWrapperFor(Class<?> iface) { return false; }
}
