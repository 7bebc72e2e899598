package io.bakky.persistence.jdbc.pool;

import io.bakky.persistence.jdbc.ScopedConnection;
import io.bakky.persistence.jdbc.bind.ValueBinder;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Short-lived transactional unit on a pooled connection. Closing without commit rolls back. */
public final class Session implements AutoCloseable {
  private final ScopedConnection conn;
  private final ValueBinder binder;

  Session(ScopedConnection conn, ValueBinder binder) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.binder = Objects.requireNonNull(binder, "binder");
  }

  public int execute(String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.connection().prepareStatement(sql)) {
      binder.bindAll(ps, Arrays.asList(params));
      return ps.executeUpdate();
    }
  }

  public List<Map<String, Object>> query(String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.connection().prepareStatement(sql)) {
      binder.bindAll(ps, Arrays.asList(params));
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData md = rs.getMetaData();
        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= md.getColumnCount(); i++) row.put(md.getColumnLabel(i), rs.getObject(i));
          out.add(row);
        }
        return out;
      }
    }
  }

  public void commit() throws SQLException {
    conn.commit();
  }

  public void rollback() throws SQLException {
    conn.rollback();
  }

  @Override
  public void close() {
    conn.close();
  }
}
