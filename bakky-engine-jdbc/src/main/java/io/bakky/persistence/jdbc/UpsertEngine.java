package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.ConflictException;
import io.bakky.persistence.error.ValidationException;
import io.bakky.persistence.jdbc.dialect.JdbcDialect;
import io.bakky.persistence.jdbc.introspect.SchemaIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Insert-or-update, one row at a time, inside the caller's transaction.\n
 *
 * Per row:\n
 * 1. every serial sequence is moved to MAX(column) + 1\n
 * 2. {@code INSERT ... ON CONFLICT DO NOTHING RETURNING *}; no returned row is the conflict signal\n
 * 3. on conflict: {@code ON CONFLICT (key) DO UPDATE} when forceUpdate, otherwise {@link ConflictException}\n
 *
 * Any exception leaves the transaction for the caller to roll back. Rows may have different column sets.
 */
public final class UpsertEngine {
  private static final Logger log = LoggerFactory.getLogger(UpsertEngine.class);

  enum RowState { START, INSERT_ATTEMPTED, CONFLICT_DETECTED, UPDATE_ATTEMPTED, COMMITTED, FAILED }

  private final JdbcDialect dialect;
  private final SchemaIntrospector introspector;
  private final int queryTimeoutSeconds;

  public UpsertEngine(JdbcDialect dialect, SchemaIntrospector introspector) {
    this(dialect, introspector, 0);
  }

  public UpsertEngine(JdbcDialect dialect, SchemaIntrospector introspector, int queryTimeoutSeconds) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.introspector = Objects.requireNonNull(introspector, "introspector");
    this.queryTimeoutSeconds = Math.max(0, queryTimeoutSeconds);
  }

  /**
   * Checks input before any statement runs.
   *
   * @throws ValidationException for an empty batch, an empty row, or an explicit key column missing from a row
   */
  public static void validate(List<Map<String, Object>> rows, UpsertOptions options) {
    if (rows == null || rows.isEmpty()) throw new ValidationException("Upsert requires at least one row");
    for (int i = 0; i < rows.size(); i++) {
      Map<String, Object> row = rows.get(i);
      if (row.isEmpty()) throw new ValidationException("Row " + i + " has no columns");
      for (String u : options.uniqueColumns()) {
        if (!row.containsKey(u)) {
          throw new ValidationException("Unique column '" + u + "' missing from row " + i + " " + row.keySet());
        }
      }
    }
  }

  public UpsertResult run(Connection c, TableName table, List<Map<String, Object>> rows, UpsertOptions options)
      throws SQLException {
    return run(c, table, rows, options, TransactionGuard.none());
  }

  /** As {@link #run(Connection, TableName, List, UpsertOptions)}; every statement is bounded by the guard. */
  public UpsertResult run(Connection c, TableName table, List<Map<String, Object>> rows, UpsertOptions options,
                          TransactionGuard guard) throws SQLException {
    validate(rows, options);
    List<String> unique = options.uniqueColumns().isEmpty()
        ? introspector.primaryKeyColumns(c, table)
        : options.uniqueColumns();
    List<String> serials = introspector.serialColumns(c, table);
    log.debug("bakky.upsert op=START table={} rows={} unique={} serial={} forceUpdate={}",
        table, rows.size(), unique, serials, options.forceUpdate());

    int inserted = 0;
    int updated = 0;
    List<Map<String, Object>> returned = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      Map<String, Object> row = rows.get(i);
      RowState state = RowState.START;
      try {
        resetSequences(c, table, serials, guard);
        state = RowState.INSERT_ATTEMPTED;
        Map<String, Object> created = insertOrNothing(c, table, row, guard);
        if (created != null) {
          returned.add(created);
          inserted++;
          state = RowState.COMMITTED;
          continue;
        }

        state = RowState.CONFLICT_DETECTED;
        if (!options.forceUpdate()) {
          throw new ConflictException("Row " + i + " conflicts with an existing row in " + table + " and forceUpdate is off");
        }
        if (unique.isEmpty()) {
          throw new ValidationException("Row " + i + " conflicts but " + table
              + " has no primary key and no unique columns were given");
        }
        state = RowState.UPDATE_ATTEMPTED;
        insertOrUpdate(c, table, row, unique, serials, guard);
        updated++;
        state = RowState.COMMITTED;
      } catch (SQLException | RuntimeException e) {
        log.debug("bakky.upsert op=ROW table={} row={} from={} to={}", table, i, state, RowState.FAILED);
        if (e instanceof SQLException se) {
          throw dialect.isUniqueViolation(se)
              ? new ConflictException("Row " + i + " violates a unique constraint of " + table + ": " + se.getMessage(), se)
              : dialect.translate(se, "upsert row " + i + " into " + table);
        }
        throw e;
      } finally {
        if (log.isTraceEnabled()) log.trace("bakky.upsert op=ROW table={} row={} state={}", table, i, state);
      }
    }
    log.debug("bakky.upsert op=DONE table={} inserted={} updated={}", table, inserted, updated);
    return UpsertResult.ok(inserted, updated, returned);
  }

  private void resetSequences(Connection c, TableName table, List<String> serials, TransactionGuard guard)
      throws SQLException {
    for (String col : serials) {
      SqlStatement ss = dialect.renderSequenceReset(table, col);
      try (PreparedStatement ps = prepare(c, ss, guard)) {
        dialect.binder().bindAll(ps, ss.binds());
        try (ResultSet rs = ps.executeQuery()) {
          if (rs.next() && log.isTraceEnabled()) {
            log.trace("bakky.upsert op=SEQUENCE_RESET table={} column={} next={}", table, col, rs.getObject(1));
          }
        }
      }
    }
  }

  private Map<String, Object> insertOrNothing(Connection c, TableName table, Map<String, Object> row,
                                              TransactionGuard guard) throws SQLException {
    List<String> cols = new ArrayList<>(row.keySet());
    SqlStatement ss = dialect.renderInsertOrNothing(table, cols);
    try (PreparedStatement ps = prepare(c, ss, guard)) {
      bindRow(ps, row, cols);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return null;
        return readRow(rs);
      }
    }
  }

  private void insertOrUpdate(Connection c, TableName table, Map<String, Object> row,
                              List<String> unique, List<String> serials, TransactionGuard guard)
      throws SQLException {
    List<String> cols = new ArrayList<>(row.keySet());
    List<String> defaults = serials.stream().filter(s -> !row.containsKey(s)).toList();
    SqlStatement ss = dialect.renderInsertOrUpdate(table, cols, defaults, unique);
    try (PreparedStatement ps = prepare(c, ss, guard)) {
      bindRow(ps, row, cols);
      int n = ps.executeUpdate();
      log.debug("bakky.upsert op=UPDATE table={} affected={}", table, n);
    }
  }

  private PreparedStatement prepare(Connection c, SqlStatement ss, TransactionGuard guard) throws SQLException {
    guard.checkOpen("upsert statement");
    if (log.isDebugEnabled()) log.debug("bakky.jdbc op=UPSERT execKind={} sql={}", ss.execKind(), ss.sql());
    PreparedStatement ps = c.prepareStatement(ss.sql());
    int timeout = guard.queryTimeoutSeconds(queryTimeoutSeconds);
    if (timeout > 0) ps.setQueryTimeout(timeout);
    guard.track(ps);
    return ps;
  }

  private void bindRow(PreparedStatement ps, Map<String, Object> row, List<String> cols) throws SQLException {
    for (int i = 0; i < cols.size(); i++) dialect.binder().bind(ps, i + 1, row.get(cols.get(i)));
  }

  static Map<String, Object> readRow(ResultSet rs) throws SQLException {
    List<String> labels = ReadShape.columnLabels(rs);
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < labels.size(); i++) out.put(labels.get(i), rs.getObject(i + 1));
    return out;
  }
}
