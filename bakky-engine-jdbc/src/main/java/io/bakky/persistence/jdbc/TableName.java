package io.bakky.persistence.jdbc;

import java.util.Objects;

/** Schema-qualified table reference; quoting is the dialect's job. */
public record TableName(String schema, String table) {
  public TableName {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(table, "table");
    if (schema.isBlank()) throw new IllegalArgumentException("schema is blank");
    if (table.isBlank()) throw new IllegalArgumentException("table is blank");
  }

  /**
   * Splits {@code schema.table} on the first dot; a bare name gets {@code defaultSchema}.
   * {@code a.b.c} is schema {@code a}, table {@code b.c}.
   */
  public static TableName parse(String name, String defaultSchema) {
    Objects.requireNonNull(name, "name");
    String n = name.trim();
    int dot = n.indexOf('.');
    if (dot < 0) {
      String schema = (defaultSchema == null || defaultSchema.isBlank()) ? ConnectionParameters.DEFAULT_SCHEMA : defaultSchema;
      return new TableName(schema, n);
    }
    return new TableName(n.substring(0, dot), n.substring(dot + 1));
  }

  public static TableName parse(String name) {
    return parse(name, ConnectionParameters.DEFAULT_SCHEMA);
  }

  @Override
  public String toString() {
    return schema + "." + table;
  }
}
