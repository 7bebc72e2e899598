package io.bakky.persistence.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/** Binds one caller value to a statement parameter. Dialects override for driver-specific types. */
@FunctionalInterface
public interface ValueBinder {
  ValueBinder DEFAULT = (ps, index, value) -> {
    if (value == null) ps.setNull(index, Types.NULL);
    else ps.setObject(index, value);
  };

  void bind(PreparedStatement ps, int index, Object value) throws SQLException;

  default void bindAll(PreparedStatement ps, List<?> values) throws SQLException {
    for (int i = 0; i < values.size(); i++) bind(ps, i + 1, values.get(i));
  }
}
