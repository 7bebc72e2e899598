package io.bakky.persistence.jdbc.introspect;

import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.jdbc.TableName;

import java.sql.Connection;
import java.util.List;

/**
 * Live catalog lookups that drive upsert when the caller gives no conflict key.\n
 *
 * A table that does not exist yields empty lists; a catalog query that cannot run raises
 * {@link QueryException}. Methods take the caller's connection so lookups share its transaction.
 */
public interface SchemaIntrospector {
  /** Primary-key columns in key order, empty when the table has no primary key. */
  List<String> primaryKeyColumns(Connection c, TableName table);

  /** Columns whose default draws from a sequence. */
  List<String> serialColumns(Connection c, TableName table);
}
