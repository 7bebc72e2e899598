package io.bakky.persistence.jdbc.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bakky.persistence.error.BakkyDataException;
import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.jdbc.ConflictPolicy;
import io.bakky.persistence.jdbc.SqlStatement;
import io.bakky.persistence.jdbc.SqlStatement.ExecKind;
import io.bakky.persistence.jdbc.TableName;
import io.bakky.persistence.jdbc.bind.ValueBinder;
import io.bakky.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.bakky.persistence.jdbc.dialect.JdbcDialect;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific syntax (ON CONFLICT, RETURNING, sequences) and bind behavior.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  private final PostgresValueBinder binder;

  public PostgresDialect() {
    this(new ObjectMapper());
  }

  public PostgresDialect(ObjectMapper json) {
    this.binder = new PostgresValueBinder(Objects.requireNonNull(json, "json"));
  }

  @Override public String id() { return "postgres"; }

  @Override public ValueBinder binder() { return binder; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public BakkyDataException translate(SQLException e, String context) {
    String state = sqlState(e);
    // too_many_connections, admin_shutdown, cannot_connect_now
    if ("53300".equals(state) || "57P01".equals(state) || "57P03".equals(state)) {
      return new ConnectionException(context + " failed: " + rootMessage(e), e);
    }
    if ("57014".equals(state)) return new QueryException(context + " cancelled or timed out: " + rootMessage(e), e);
    return super.translate(e, context);
  }

  @Override
  protected String renderConflictClause(List<String> columns, ConflictPolicy policy) {
    if (policy instanceof ConflictPolicy.UpdateExcluded ex) {
      return onConflictUpdate(ex.uniqueColumns(), columns);
    }
    if (policy instanceof ConflictPolicy.UpdateWith with) {
      List<String> sets = new ArrayList<>();
      // expressions are trusted SQL, column names are not
      with.assignments().forEach((col, expr) -> sets.add(quoteIdent(requireColumn(col)) + " = " + expr));
      return "ON CONFLICT (" + quotedList(with.uniqueColumns()) + ") DO UPDATE SET " + String.join(", ", sets);
    }
    return "";
  }

  @Override
  public SqlStatement renderInsertOrNothing(TableName table, List<String> columns) {
    String sql = insertPrefix(table, columns) + " VALUES (" + placeholders(columns.size()) + ")"
        + " ON CONFLICT DO NOTHING RETURNING *";
    return new SqlStatement(sql, List.of(), ExecKind.QUERY);
  }

  @Override
  public SqlStatement renderInsertOrUpdate(TableName table, List<String> columns, List<String> defaultColumns,
                                           List<String> uniqueColumns) {
    if (uniqueColumns == null || uniqueColumns.isEmpty()) throw new IllegalArgumentException("Upsert has no conflict columns");
    List<String> defaults = defaultColumns == null ? List.of() : defaultColumns;
    List<String> all = new ArrayList<>(columns);
    all.addAll(defaults);

    List<String> values = new ArrayList<>(all.size());
    for (int i = 0; i < columns.size(); i++) values.add("?");
    for (int i = 0; i < defaults.size(); i++) values.add("DEFAULT");

    String sql = insertPrefix(table, all) + " VALUES (" + String.join(", ", values) + ") "
        + onConflictUpdate(uniqueColumns, columns);
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderSequenceReset(TableName table, String column) {
    String sql = "SELECT setval(pg_get_serial_sequence(?, ?), "
        + "COALESCE((SELECT MAX(" + quoteIdent(requireColumn(column)) + ") FROM " + qualify(table) + "), 0) + 1, false)";
    return new SqlStatement(sql, List.of(qualify(table), column), ExecKind.QUERY);
  }

  /** Non-key columns take the incoming value; a row made only of key columns re-assigns the key. */
  private String onConflictUpdate(List<String> uniqueColumns, List<String> columns) {
    List<String> updateCols = columns.stream().filter(c -> !uniqueColumns.contains(c)).toList();
    if (updateCols.isEmpty()) updateCols = uniqueColumns;
    return "ON CONFLICT (" + quotedList(uniqueColumns) + ") DO UPDATE SET "
        + String.join(", ", updateCols.stream().map(c -> quoteIdent(c) + " = EXCLUDED." + quoteIdent(c)).toList());
  }
}
