package io.bakky.persistence.rowset;

import io.bakky.persistence.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rows handed to the write engines, in one of three representations.\n
 *
 * - {@link ColumnMap}: column name to the values of that column, all columns the same length\n
 * - {@link Frame}: fixed column list plus rows of the same width\n
 * - {@link Records}: independent row maps; must still share one column set to be written\n
 *
 * Values are opaque: no coercion happens here. Nulls are allowed as values, never as column names.
 */
public sealed interface RowSet permits RowSet.ColumnMap, RowSet.Frame, RowSet.Records {

  DataShape shape();

  /** Column names in insertion order (for {@link Records}: the columns of the first row). */
  List<String> columns();

  int size();

  default boolean isEmpty() { return size() == 0; }

  /** Rows as ordered maps, one per row. */
  List<Map<String, Object>> rows();

  /**
   * Uniform batch for a single parameterized statement.
   *
   * @throws ValidationException when rows do not share one column set
   */
  RowBatch toBatch();

  static ColumnMap ofColumns(Map<String, ? extends List<?>> columns) {
    Map<String, List<Object>> m = new LinkedHashMap<>();
    columns.forEach((k, v) -> m.put(k, v == null ? null : nullableCopy(v)));
    return new ColumnMap(m);
  }

  static Frame ofFrame(List<String> columns, List<? extends List<?>> rows) {
    List<List<Object>> data = new ArrayList<>(rows.size());
    for (List<?> r : rows) data.add(r == null ? null : nullableCopy(r));
    return new Frame(columns, data);
  }

  static Records ofRecords(List<? extends Map<String, ?>> rows) {
    List<Map<String, Object>> data = new ArrayList<>(rows.size());
    for (Map<String, ?> r : rows) data.add(r == null ? null : new LinkedHashMap<>(r));
    return new Records(data);
  }

  @SafeVarargs
  static Records of(Map<String, ?>... rows) {
    return ofRecords(List.of(rows));
  }

  record ColumnMap(Map<String, List<Object>> values) implements RowSet {
    public ColumnMap {
      Objects.requireNonNull(values, "values");
      Map<String, List<Object>> copy = new LinkedHashMap<>();
      int len = -1;
      for (var e : values.entrySet()) {
        String col = requireColumn(e.getKey());
        List<Object> vs = e.getValue() == null ? List.of() : nullableCopy(e.getValue());
        if (len >= 0 && vs.size() != len) {
          throw new ValidationException("Column '" + col + "' has " + vs.size() + " values, expected " + len);
        }
        len = vs.size();
        copy.put(col, vs);
      }
      values = Collections.unmodifiableMap(copy);
    }

    @Override public DataShape shape() { return DataShape.COLUMNS; }
    @Override public List<String> columns() { return List.copyOf(values.keySet()); }

    @Override
    public int size() {
      return values.isEmpty() ? 0 : values.values().iterator().next().size();
    }

    @Override
    public List<Map<String, Object>> rows() {
      int n = size();
      List<Map<String, Object>> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (var e : values.entrySet()) row.put(e.getKey(), e.getValue().get(i));
        out.add(Collections.unmodifiableMap(row));
      }
      return Collections.unmodifiableList(out);
    }

    @Override
    public RowBatch toBatch() {
      List<String> cols = columns();
      int n = size();
      List<List<Object>> rows = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        List<Object> r = new ArrayList<>(cols.size());
        for (String c : cols) r.add(values.get(c).get(i));
        rows.add(r);
      }
      return new RowBatch(cols, rows);
    }
  }

  record Frame(List<String> columns, List<List<Object>> data) implements RowSet {
    public Frame {
      Objects.requireNonNull(columns, "columns");
      Objects.requireNonNull(data, "data");
      Set<String> seen = new LinkedHashSet<>();
      for (String c : columns) {
        if (!seen.add(requireColumn(c))) throw new ValidationException("Duplicate column '" + c + "' in frame");
      }
      columns = List.copyOf(columns);
      List<List<Object>> copy = new ArrayList<>(data.size());
      for (int i = 0; i < data.size(); i++) {
        List<Object> r = data.get(i) == null ? List.of() : nullableCopy(data.get(i));
        if (r.size() != columns.size()) {
          throw new ValidationException("Frame row " + i + " has " + r.size() + " values, expected " + columns.size());
        }
        copy.add(r);
      }
      data = Collections.unmodifiableList(copy);
    }

    @Override public DataShape shape() { return DataShape.FRAME; }
    @Override public int size() { return data.size(); }

    @Override
    public List<Map<String, Object>> rows() {
      List<Map<String, Object>> out = new ArrayList<>(data.size());
      for (List<Object> r : data) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) row.put(columns.get(i), r.get(i));
        out.add(Collections.unmodifiableMap(row));
      }
      return Collections.unmodifiableList(out);
    }

    /** Values of one column, top to bottom. */
    public List<Object> column(String name) {
      int idx = columns.indexOf(name);
      if (idx < 0) throw new IllegalArgumentException("Unknown column: " + name);
      List<Object> out = new ArrayList<>(data.size());
      for (List<Object> r : data) out.add(r.get(idx));
      return Collections.unmodifiableList(out);
    }

    @Override public RowBatch toBatch() { return new RowBatch(columns, data); }
  }

  record Records(List<Map<String, Object>> data) implements RowSet {
    public Records {
      Objects.requireNonNull(data, "data");
      List<Map<String, Object>> copy = new ArrayList<>(data.size());
      for (Map<String, ?> r : data) {
        Objects.requireNonNull(r, "row");
        Map<String, Object> row = new LinkedHashMap<>();
        for (var e : r.entrySet()) row.put(requireColumn(e.getKey()), e.getValue());
        copy.add(Collections.unmodifiableMap(row));
      }
      data = Collections.unmodifiableList(copy);
    }

    @Override public DataShape shape() { return DataShape.RECORDS; }

    @Override
    public List<String> columns() {
      return data.isEmpty() ? List.of() : List.copyOf(data.get(0).keySet());
    }

    @Override public int size() { return data.size(); }
    @Override public List<Map<String, Object>> rows() { return data; }

    @Override
    public RowBatch toBatch() {
      List<String> cols = columns();
      Set<String> expected = new LinkedHashSet<>(cols);
      List<List<Object>> rows = new ArrayList<>(data.size());
      for (int i = 0; i < data.size(); i++) {
        Map<String, Object> r = data.get(i);
        if (!expected.equals(r.keySet())) {
          throw new ValidationException("Row " + i + " has columns " + r.keySet() + ", expected " + expected);
        }
        List<Object> vs = new ArrayList<>(cols.size());
        for (String c : cols) vs.add(r.get(c));
        rows.add(vs);
      }
      return new RowBatch(cols, rows);
    }
  }

  private static String requireColumn(String name) {
    if (name == null || name.isBlank()) throw new ValidationException("Column name must be non-blank");
    return name;
  }

  private static List<Object> nullableCopy(List<?> values) {
    return Collections.unmodifiableList(new ArrayList<>(values));
  }
}
