package io.bakky.persistence.jdbc.postgres;

import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.jdbc.ConnectionManager;
import io.bakky.persistence.jdbc.TableName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Database, schema and table housekeeping. DDL runs in autocommit; failures raise {@link QueryException}. */
public final class PostgresAdmin {
  private static final Logger log = LoggerFactory.getLogger(PostgresAdmin.class);

  private final ConnectionManager connections;
  private final PostgresDialect dialect;

  public PostgresAdmin(ConnectionManager connections, PostgresDialect dialect) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /**
   * Creates the database with UTF8 encoding unless it exists. Run this through a manager connected
   * to a maintenance database such as {@code postgres}.
   *
   * @return true when the database was created, false when it already existed
   */
  public boolean createDatabaseIfAbsent(String name, String owner) {
    Objects.requireNonNull(name, "name");
    try {
      return connections.withConnection(c -> {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
          ps.setString(1, name);
          try (ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
              log.info("bakky.admin op=CREATE_DATABASE database={} exists=true", name);
              return false;
            }
          }
        }
        String sql = "CREATE DATABASE " + dialect.quoteIdent(name)
            + (owner == null || owner.isBlank() ? "" : " OWNER " + dialect.quoteIdent(owner))
            + " ENCODING 'UTF8'";
        try (Statement st = c.createStatement()) {
          st.execute(sql);
        }
        log.info("bakky.admin op=CREATE_DATABASE database={} owner={}", name, owner);
        return true;
      });
    } catch (SQLException e) {
      throw new QueryException("Cannot create database " + name + ": " + e.getMessage(), e);
    }
  }

  public void createSchemaIfAbsent(String schema) {
    ddl("CREATE SCHEMA IF NOT EXISTS " + dialect.quoteIdent(schema), "create schema " + schema);
  }

  /** Drops the schema and everything in it; without {@code confirm} nothing happens. */
  public boolean dropSchema(String schema, boolean confirm) {
    if (!confirm) {
      log.warn("bakky.admin op=DROP_SCHEMA schema={} skipped=unconfirmed", schema);
      return false;
    }
    ddl("DROP SCHEMA IF EXISTS " + dialect.quoteIdent(schema) + " CASCADE", "drop schema " + schema);
    return true;
  }

  /** Base tables of a schema, sorted by name; {@code nameFilter} keeps only an exact match. */
  public List<String> listTables(String schema, String nameFilter) {
    String sql = "SELECT table_name FROM information_schema.tables"
        + " WHERE table_schema = ? AND table_type = 'BASE TABLE'"
        + (nameFilter == null ? "" : " AND table_name = ?")
        + " ORDER BY table_name";
    try {
      return connections.withConnection(c -> {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
          ps.setString(1, schema);
          if (nameFilter != null) ps.setString(2, nameFilter);
          try (ResultSet rs = ps.executeQuery()) {
            List<String> out = new ArrayList<>();
            while (rs.next()) out.add(rs.getString(1));
            return out;
          }
        }
      });
    } catch (SQLException e) {
      throw new QueryException("Cannot list tables of " + schema + ": " + e.getMessage(), e);
    }
  }

  /** Column name to data type, in column order; empty for an unknown table. */
  public Map<String, String> tableSchema(TableName table) {
    String sql = "SELECT column_name, data_type FROM information_schema.columns"
        + " WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position";
    try {
      return connections.withConnection(c -> {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
          ps.setString(1, table.schema());
          ps.setString(2, table.table());
          try (ResultSet rs = ps.executeQuery()) {
            Map<String, String> out = new LinkedHashMap<>();
            while (rs.next()) out.put(rs.getString(1), rs.getString(2));
            return out;
          }
        }
      });
    } catch (SQLException e) {
      throw new QueryException("Cannot describe " + table + ": " + e.getMessage(), e);
    }
  }

  private void ddl(String sql, String what) {
    try {
      connections.withConnection(c -> {
        try (Statement st = c.createStatement()) {
          st.execute(sql);
        }
        return null;
      });
      log.info("bakky.admin op=DDL what={}", what);
    } catch (SQLException e) {
      throw new QueryException("Cannot " + what + ": " + e.getMessage(), e);
    }
  }
}
