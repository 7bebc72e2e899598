package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.BakkyDataException;
import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.error.UnsupportedShapeException;
import io.bakky.persistence.error.ValidationException;
import io.bakky.persistence.exec.WriteResult;
import io.bakky.persistence.jdbc.dialect.JdbcDialect;
import io.bakky.persistence.jdbc.introspect.SchemaIntrospector;
import io.bakky.persistence.rowset.RowBatch;
import io.bakky.persistence.rowset.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Relational data access over a {@link ConnectionManager}.\n
 *
 * - insert: one parameterized statement, executed as a batch in one transaction\n
 * - upsert: per-row insert-or-update, see {@link UpsertEngine}\n
 * - read: caller-chosen {@link ReadShape}\n
 * - delete/update: condition map to WHERE\n
 *
 * Writes never throw for database failures: they roll back and return a failed result carrying the
 * typed error. Reads log and return the shape's empty value.
 */
public final class JdbcDataEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataEngine.class);

  private final ConnectionManager connections;
  private final JdbcDialect dialect;
  private final SchemaIntrospector introspector;
  private final UpsertEngine upserts;
  private final int queryTimeoutSeconds;

  public JdbcDataEngine(ConnectionManager connections, JdbcDialect dialect, SchemaIntrospector introspector) {
    this(connections, dialect, introspector, Duration.ZERO);
  }

  public JdbcDataEngine(ConnectionManager connections,
                        JdbcDialect dialect,
                        SchemaIntrospector introspector,
                        Duration statementTimeout) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.introspector = Objects.requireNonNull(introspector, "introspector");
    this.queryTimeoutSeconds = statementTimeout == null ? 0 : (int) Math.max(0, statementTimeout.toSeconds());
    this.upserts = new UpsertEngine(dialect, introspector, queryTimeoutSeconds);
  }

  public ConnectionManager connections() { return connections; }
  public JdbcDialect dialect() { return dialect; }

  /** Resolves {@code schema.table} or a bare name against the handle's schema. */
  public TableName table(String name) {
    return TableName.parse(name, connections.schema());
  }

  public WriteResult insert(String table, RowSet rows) {
    return insert(table, rows, ConflictPolicy.fail());
  }

  public WriteResult insert(String table, RowSet rows, ConflictPolicy policy) {
    return insert(table, rows, policy, TransactionGuard.none());
  }

  public WriteResult insert(String table, RowSet rows, ConflictPolicy policy, TransactionGuard guard) {
    Objects.requireNonNull(rows, "rows");
    TableName t = table(table);
    final RowBatch batch;
    final SqlStatement ss;
    try {
      batch = rows.toBatch();
      if (batch.isEmpty()) throw new ValidationException("Insert into " + t + " requires at least one row");
      ss = dialect.renderInsert(t, batch.columns(), policy);
    } catch (ValidationException e) {
      log.error("bakky.jdbc op=INSERT table={} shape={} rejected: {}", t, rows.shape(), e.getMessage());
      return WriteResult.failed(e);
    }

    long start = System.nanoTime();
    debugSql("INSERT", ss, batch.size());
    try {
      long n = connections.inTransaction(c -> {
        try (PreparedStatement ps = prepare(c, ss, guard)) {
          for (List<Object> row : batch.rows()) {
            dialect.binder().bindAll(ps, row);
            ps.addBatch();
          }
          return affected(ps.executeBatch());
        }
      }, guard);
      debugDone("INSERT", ss, n, System.nanoTime() - start);
      return WriteResult.ok(n);
    } catch (SQLException e) {
      return failed("INSERT", t, dialect.translate(e, "insert into " + t));
    } catch (BakkyDataException e) {
      return failed("INSERT", t, e);
    }
  }

  public UpsertResult upsert(String table, RowSet rows) {
    return upsert(table, rows, UpsertOptions.defaults());
  }

  public UpsertResult upsert(String table, RowSet rows, UpsertOptions options) {
    return upsert(table, rows, options, TransactionGuard.none());
  }

  public UpsertResult upsert(String table, RowSet rows, UpsertOptions options, TransactionGuard guard) {
    Objects.requireNonNull(rows, "rows");
    UpsertOptions opts = options == null ? UpsertOptions.defaults() : options;
    TableName t = table(table);
    List<Map<String, Object>> data = rows.rows();
    try {
      UpsertEngine.validate(data, opts);
    } catch (ValidationException e) {
      log.error("bakky.jdbc op=UPSERT table={} rejected: {}", t, e.getMessage());
      return UpsertResult.failed(e);
    }

    long start = System.nanoTime();
    try {
      UpsertResult r = connections.inTransaction(c -> upserts.run(c, t, data, opts, guard), guard);
      if (log.isDebugEnabled()) {
        log.debug("bakky.jdbc_done op=UPSERT table={} durationMs={} inserted={} updated={}",
            t, (System.nanoTime() - start) / 1_000_000.0, r.inserted(), r.updated());
      }
      return r;
    } catch (SQLException e) {
      BakkyDataException err = dialect.translate(e, "upsert into " + t);
      log.error("bakky.jdbc op=UPSERT table={} kind={} failed: {}", t, err.kind(), err.getMessage());
      return UpsertResult.failed(err);
    } catch (BakkyDataException e) {
      log.error("bakky.jdbc op=UPSERT table={} kind={} failed: {}", t, e.kind(), e.getMessage());
      return UpsertResult.failed(e);
    }
  }

  public <R> R read(String sql, ReadShape<R> shape) {
    return read(sql, List.of(), shape);
  }

  /**
   * @throws UnsupportedShapeException when no shape is given; other failures return {@code shape.empty()}
   */
  public <R> R read(String sql, List<?> params, ReadShape<R> shape) {
    return read(sql, params, shape, TransactionGuard.none());
  }

  /** As {@link #read(String, List, ReadShape)}; the guard bounds and can cancel the query. */
  public <R> R read(String sql, List<?> params, ReadShape<R> shape, TransactionGuard guard) {
    if (shape == null) throw new UnsupportedShapeException("null");
    Objects.requireNonNull(sql, "sql");
    List<?> binds = params == null ? List.of() : params;
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("bakky.jdbc op=SELECT shape={} bindCount={} handleId={} sql={}",
          shape.name(), binds.size(), connections.id(), sql);
    }
    try {
      R out = connections.withConnection(c -> {
        try (PreparedStatement ps = prepare(c, sql, guard)) {
          ps.setFetchSize(shape.fetchSize());
          dialect.binder().bindAll(ps, binds);
          try (ResultSet rs = ps.executeQuery()) {
            return shape.read(rs);
          }
        }
      }, guard);
      if (log.isDebugEnabled()) {
        log.debug("bakky.jdbc_done op=SELECT shape={} durationMs={}", shape.name(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return out;
    } catch (SQLException e) {
      log.warn("bakky.jdbc op=SELECT shape={} failed: {}", shape.name(), dialect.translate(e, "read").getMessage());
      return shape.empty();
    } catch (BakkyDataException e) {
      log.warn("bakky.jdbc op=SELECT shape={} kind={} failed: {}", shape.name(), e.kind(), e.getMessage());
      return shape.empty();
    }
  }

  /** Shape chosen by name, e.g. from a request parameter. */
  public Object read(String sql, List<?> params, String shapeName) {
    return read(sql, params, ReadShape.named(shapeName));
  }

  public List<List<Object>> readTuples(String sql, List<?> params) {
    return read(sql, params, ReadShape.TUPLES);
  }

  /** Deletes matching rows; zero matches is a successful result with count 0. */
  public WriteResult delete(String table, Map<String, ?> conditions) {
    return delete(table, conditions, TransactionGuard.none());
  }

  public WriteResult delete(String table, Map<String, ?> conditions, TransactionGuard guard) {
    TableName t = table(table);
    final SqlStatement ss;
    try {
      ss = dialect.renderDelete(t, conditions);
    } catch (ValidationException e) {
      return failed("DELETE", t, e);
    }
    return executeUpdate("DELETE", t, ss, guard);
  }

  public WriteResult update(String table, Map<String, ?> values, Map<String, ?> conditions) {
    return update(table, values, conditions, TransactionGuard.none());
  }

  public WriteResult update(String table, Map<String, ?> values, Map<String, ?> conditions, TransactionGuard guard) {
    TableName t = table(table);
    final SqlStatement ss;
    try {
      ss = dialect.renderUpdate(t, values, conditions);
    } catch (ValidationException e) {
      return failed("UPDATE", t, e);
    }
    return executeUpdate("UPDATE", t, ss, guard);
  }

  /** Raw statement in its own transaction; returns the affected count (0 for statements without one). */
  public WriteResult execute(String sql, List<?> params) {
    return execute(sql, params, TransactionGuard.none());
  }

  public WriteResult execute(String sql, List<?> params, TransactionGuard guard) {
    List<Object> binds = new ArrayList<>();
    if (params != null) binds.addAll(params);
    SqlStatement ss = SqlStatement.update(sql, binds);
    return executeUpdate("EXECUTE", null, ss, guard);
  }

  /** @throws QueryException when the catalog cannot be queried */
  public List<String> primaryKeyColumns(String table) {
    TableName t = table(table);
    try {
      return connections.withConnection(c -> introspector.primaryKeyColumns(c, t));
    } catch (SQLException e) {
      throw new QueryException("primary key lookup for " + t + " failed: " + e.getMessage(), e);
    }
  }

  /** @throws QueryException when the catalog cannot be queried */
  public List<String> serialColumns(String table) {
    TableName t = table(table);
    try {
      return connections.withConnection(c -> introspector.serialColumns(c, t));
    } catch (SQLException e) {
      throw new QueryException("serial column lookup for " + t + " failed: " + e.getMessage(), e);
    }
  }

  private WriteResult executeUpdate(String op, TableName t, SqlStatement ss, TransactionGuard guard) {
    long start = System.nanoTime();
    debugSql(op, ss, 1);
    try {
      long n = connections.inTransaction(c -> {
        try (PreparedStatement ps = prepare(c, ss.sql(), guard)) {
          dialect.binder().bindAll(ps, ss.binds());
          return (long) Math.max(0, ps.executeUpdate());
        }
      }, guard);
      debugDone(op, ss, n, System.nanoTime() - start);
      return WriteResult.ok(n);
    } catch (SQLException e) {
      return failed(op, t, dialect.translate(e, op.toLowerCase(Locale.ROOT) + (t == null ? "" : " on " + t)));
    } catch (BakkyDataException e) {
      return failed(op, t, e);
    }
  }

  private PreparedStatement prepare(Connection c, SqlStatement ss, TransactionGuard guard) throws SQLException {
    return prepare(c, ss.sql(), guard);
  }

  private PreparedStatement prepare(Connection c, String sql, TransactionGuard guard) throws SQLException {
    guard.checkOpen("statement");
    PreparedStatement ps = c.prepareStatement(sql);
    int timeout = guard.queryTimeoutSeconds(queryTimeoutSeconds);
    if (timeout > 0) ps.setQueryTimeout(timeout);
    guard.track(ps);
    return ps;
  }

  private static long affected(int[] counts) {
    long n = 0;
    for (int c : counts) n += (c == Statement.SUCCESS_NO_INFO) ? 1 : Math.max(0, c);
    return n;
  }

  private WriteResult failed(String op, TableName t, BakkyDataException e) {
    log.error("bakky.jdbc op={} table={} kind={} failed: {}", op, t, e.kind(), e.getMessage());
    return WriteResult.failed(e);
  }

  private void debugSql(String op, SqlStatement ss, int rows) {
    if (!log.isDebugEnabled()) return;
    log.debug("bakky.jdbc op={} execKind={} bindCount={} rows={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), rows, connections.id(), connections.schema(), ss.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("bakky.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("bakky.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
