package io.bakky.persistence.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** One unit of work against a live connection. */
@FunctionalInterface
public interface SqlWork<T> {
  T run(Connection connection) throws SQLException;
}
