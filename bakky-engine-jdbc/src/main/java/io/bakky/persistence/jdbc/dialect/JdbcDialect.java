package io.bakky.persistence.jdbc.dialect;

import io.bakky.persistence.error.BakkyDataException;
import io.bakky.persistence.jdbc.ConflictPolicy;
import io.bakky.persistence.jdbc.SqlStatement;
import io.bakky.persistence.jdbc.TableName;
import io.bakky.persistence.jdbc.bind.ValueBinder;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Renders the statements the JDBC engines execute and classifies driver errors.\n
 *
 * Insert statements carry no binds: the engine binds each row of the batch itself.
 */
public interface JdbcDialect {
  String id();

  String quoteIdent(String ident);

  /** Quoted {@code "schema"."table"}. */
  String qualify(TableName table);

  SqlStatement renderInsert(TableName table, List<String> columns, ConflictPolicy policy);

  /** Insert that reports a conflict by returning no row: {@code ON CONFLICT DO NOTHING RETURNING *}. */
  SqlStatement renderInsertOrNothing(TableName table, List<String> columns);

  /**
   * Insert that overwrites the conflicting row's non-key columns. {@code defaultColumns} get a
   * {@code DEFAULT} placeholder instead of a bind.
   */
  SqlStatement renderInsertOrUpdate(TableName table, List<String> columns, List<String> defaultColumns,
                                    List<String> uniqueColumns);

  /** Moves the sequence behind {@code column} so its next value is {@code MAX(column) + 1}. */
  SqlStatement renderSequenceReset(TableName table, String column);

  SqlStatement renderDelete(TableName table, Map<String, ?> conditions);

  SqlStatement renderUpdate(TableName table, Map<String, ?> values, Map<String, ?> conditions);

  /** Trivial round trip used by health checks. */
  default String probeSql() { return "SELECT 1"; }

  default ValueBinder binder() { return ValueBinder.DEFAULT; }

  boolean isUniqueViolation(SQLException e);

  /** Typed error for a driver failure; {@code context} names the operation for the message. */
  BakkyDataException translate(SQLException e, String context);
}
