package io.bakky.persistence.rowset;

import io.bakky.persistence.error.UnsupportedShapeException;

import java.util.List;
import java.util.Locale;

/** Tag for the representation a {@link RowSet} arrives in. */
public enum DataShape {
  COLUMNS("columns", "dict", "mapping"),
  FRAME("frame", "polars", "pandas", "dataframe"),
  RECORDS("records", "list", "rows");

  private final List<String> aliases;

  DataShape(String... aliases) {
    this.aliases = List.of(aliases);
  }

  public List<String> aliases() { return aliases; }

  /**
   * Resolve a shape by name or alias, ignoring case.
   *
   * @throws UnsupportedShapeException for anything else
   */
  public static DataShape of(String name) {
    if (name == null || name.isBlank()) throw new UnsupportedShapeException(String.valueOf(name));
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (DataShape s : values()) {
      if (s.name().toLowerCase(Locale.ROOT).equals(n) || s.aliases.contains(n)) return s;
    }
    throw new UnsupportedShapeException(name);
  }
}
