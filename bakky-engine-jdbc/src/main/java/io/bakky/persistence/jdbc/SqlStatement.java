package io.bakky.persistence.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Rendered SQL with positional {@code ?} placeholders and the values bound to them. */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (SELECT, RETURNING, setval). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() or executeBatch(). */
    UPDATE
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is blank");
    // binds may legitimately contain nulls
    binds = binds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  public static SqlStatement update(String sql, List<Object> binds) {
    return new SqlStatement(sql, binds, ExecKind.UPDATE);
  }

  public SqlStatement withBinds(List<Object> values) {
    return new SqlStatement(sql, values, execKind);
  }
}
