package io.bakky.persistence.jdbc.postgres;

import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.jdbc.TableName;
import io.bakky.persistence.jdbc.introspect.SchemaIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Catalog lookups for Postgres.
 * <p>
 * {@code to_regclass} resolves a missing table to NULL, so unknown tables give empty lists instead of errors.
 */
public final class PostgresSchemaIntrospector implements SchemaIntrospector {
  private static final Logger log = LoggerFactory.getLogger(PostgresSchemaIntrospector.class);

  static final String PRIMARY_KEY_SQL = """
      SELECT a.attname
        FROM pg_index i
        JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey)
       WHERE i.indrelid = to_regclass(?)
         AND i.indisprimary
       ORDER BY array_position(i.indkey::int2[], a.attnum)
      """;

  static final String SERIAL_COLUMNS_SQL = """
      SELECT c.column_name
        FROM information_schema.columns c
        JOIN pg_attribute a ON a.attrelid = to_regclass(?) AND a.attname = c.column_name
        JOIN pg_attrdef ad ON ad.adrelid = a.attrelid AND ad.adnum = a.attnum
       WHERE c.table_schema = ?
         AND c.table_name = ?
         AND c.column_default LIKE 'nextval%'
       ORDER BY c.ordinal_position
      """;

  private final PostgresDialect dialect;

  public PostgresSchemaIntrospector(PostgresDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public List<String> primaryKeyColumns(Connection c, TableName table) {
    return names(c, PRIMARY_KEY_SQL, "primary key", table, dialect.qualify(table));
  }

  @Override
  public List<String> serialColumns(Connection c, TableName table) {
    return names(c, SERIAL_COLUMNS_SQL, "serial columns", table, dialect.qualify(table), table.schema(), table.table());
  }

  private List<String> names(Connection c, String sql, String what, TableName table, String... params) {
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) ps.setString(i + 1, params[i]);
      try (ResultSet rs = ps.executeQuery()) {
        List<String> out = new ArrayList<>();
        while (rs.next()) out.add(rs.getString(1));
        log.debug("bakky.catalog op=LOOKUP what={} table={} result={}", what, table, out);
        return List.copyOf(out);
      }
    } catch (SQLException e) {
      throw new QueryException("Catalog lookup of " + what + " for " + table + " failed: " + e.getMessage(), e);
    }
  }
}
