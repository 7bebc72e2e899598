package io.bakky.persistence.jdbc.dialect;

import io.bakky.persistence.error.ConflictException;
import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.error.BakkyDataException;
import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.error.ValidationException;
import io.bakky.persistence.jdbc.ConflictPolicy;
import io.bakky.persistence.jdbc.SqlStatement;
import io.bakky.persistence.jdbc.TableName;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC-generic SQL rendering.\n
 *
 * Provides:\n
 * - INSERT / UPDATE / DELETE with quoted identifiers and positional binds\n
 * - condition maps to WHERE: collections become IN, null becomes IS NULL, scalars become =\n
 * - SQLState based error classification\n
 *
 * Vendor dialects supply quoting, conflict clauses and sequence handling.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {

  @Override
  public String qualify(TableName table) {
    Objects.requireNonNull(table, "table");
    return quoteIdent(table.schema()) + "." + quoteIdent(table.table());
  }

  @Override
  public SqlStatement renderInsert(TableName table, List<String> columns, ConflictPolicy policy) {
    String base = insertPrefix(table, columns) + " VALUES (" + placeholders(columns.size()) + ")";
    if (policy == null || policy instanceof ConflictPolicy.Fail) return SqlStatement.update(base, List.of());
    return SqlStatement.update(base + " " + renderConflictClause(columns, policy), List.of());
  }

  @Override
  public SqlStatement renderDelete(TableName table, Map<String, ?> conditions) {
    List<Object> binds = new ArrayList<>();
    String where = renderWhere(conditions, binds);
    return SqlStatement.update("DELETE FROM " + qualify(table) + " WHERE " + where, binds);
  }

  @Override
  public SqlStatement renderUpdate(TableName table, Map<String, ?> values, Map<String, ?> conditions) {
    if (values == null || values.isEmpty()) throw new ValidationException("Update requires at least one column to set");
    List<Object> binds = new ArrayList<>();
    List<String> sets = new ArrayList<>();
    for (var e : values.entrySet()) {
      sets.add(quoteIdent(requireColumn(e.getKey())) + " = ?");
      binds.add(e.getValue());
    }
    String where = renderWhere(conditions, binds);
    return SqlStatement.update("UPDATE " + qualify(table) + " SET " + String.join(", ", sets) + " WHERE " + where, binds);
  }

  /**
   * ANDed predicates, one per condition entry. Appends bind values in placeholder order.
   *
   * @throws ValidationException for an empty condition map (no unconditional delete/update)
   */
  protected String renderWhere(Map<String, ?> conditions, List<Object> binds) {
    if (conditions == null || conditions.isEmpty()) {
      throw new ValidationException("At least one condition is required");
    }
    List<String> parts = new ArrayList<>();
    for (var e : conditions.entrySet()) {
      String col = quoteIdent(requireColumn(e.getKey()));
      Object v = e.getValue();
      if (v == null) {
        parts.add(col + " IS NULL");
      } else if (v instanceof Collection<?> values) {
        parts.add(renderIn(col, values, binds));
      } else if (v instanceof Object[] arr) {
        parts.add(renderIn(col, Arrays.asList(arr), binds));
      } else {
        parts.add(col + " = ?");
        binds.add(v);
      }
    }
    return String.join(" AND ", parts);
  }

  protected String renderIn(String col, Collection<?> values, List<Object> binds) {
    // IN () is invalid SQL; an empty list matches nothing
    if (values.isEmpty()) return "1 = 0";
    List<String> ps = new ArrayList<>(values.size());
    for (Object x : values) {
      ps.add("?");
      binds.add(x);
    }
    return col + " IN (" + String.join(", ", ps) + ")";
  }

  protected String insertPrefix(TableName table, List<String> columns) {
    if (columns == null || columns.isEmpty()) throw new ValidationException("Insert requires at least one column");
    return "INSERT INTO " + qualify(table) + " (" + quotedList(columns) + ")";
  }

  protected String quotedList(List<String> columns) {
    return String.join(", ", columns.stream().map(c -> quoteIdent(requireColumn(c))).toList());
  }

  protected static String placeholders(int n) {
    return String.join(", ", Collections.nCopies(n, "?"));
  }

  /** Vendor syntax for the conflict clause appended to a batched insert. */
  protected abstract String renderConflictClause(List<String> columns, ConflictPolicy policy);

  @Override
  public boolean isUniqueViolation(SQLException e) {
    return "23505".equals(sqlState(e));
  }

  @Override
  public BakkyDataException translate(SQLException e, String context) {
    String state = sqlState(e);
    String msg = context + " failed: " + rootMessage(e);
    if (state != null && (state.startsWith("08") || state.startsWith("28"))) return new ConnectionException(msg, e);
    if ("23505".equals(state)) return new ConflictException(msg, e);
    return new QueryException(msg, e);
  }

  /** First non-null SQLState along the chained exceptions (batch errors hide it in getNextException). */
  protected static String sqlState(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (cur.getSQLState() != null) return cur.getSQLState();
    }
    return null;
  }

  protected static String rootMessage(SQLException e) {
    SQLException next = e.getNextException();
    return next != null && next.getMessage() != null ? next.getMessage() : e.getMessage();
  }

  protected static String requireColumn(String c) {
    if (c == null || c.isBlank()) throw new ValidationException("Column name must be non-blank");
    return c;
  }
}
