package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.UnsupportedShapeException;
import io.bakky.persistence.rowset.RowSet;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Typed token for the representation a read returns.\n
 *
 * - {@link #FRAME} and {@link #COLUMNS}: bulk fetch, values gathered column by column\n
 * - {@link #RECORDS} and {@link #TUPLES}: row cursor\n
 */
public abstract class ReadShape<R> {
  /** Fetch size hint for bulk (columnar) reads. */
  public static final int BULK_FETCH_SIZE = 10_000;
  /** Fetch size hint for cursor reads. */
  public static final int CURSOR_FETCH_SIZE = 500;

  public static final ReadShape<RowSet.Frame> FRAME = new ReadShape<>("frame", BULK_FETCH_SIZE) {
    @Override
    protected RowSet.Frame collect(ResultSet rs) throws SQLException {
      List<String> cols = columnLabels(rs);
      List<List<Object>> rows = new ArrayList<>();
      while (rs.next()) rows.add(rowValues(rs, cols.size()));
      return new RowSet.Frame(cols, rows);
    }

    @Override public RowSet.Frame empty() { return new RowSet.Frame(List.of(), List.of()); }
  };

  public static final ReadShape<RowSet.ColumnMap> COLUMNS = new ReadShape<>("columns", BULK_FETCH_SIZE) {
    @Override
    protected RowSet.ColumnMap collect(ResultSet rs) throws SQLException {
      List<String> cols = columnLabels(rs);
      List<List<Object>> values = new ArrayList<>(cols.size());
      for (int i = 0; i < cols.size(); i++) values.add(new ArrayList<>());
      while (rs.next()) {
        for (int i = 0; i < cols.size(); i++) values.get(i).add(rs.getObject(i + 1));
      }
      Map<String, List<Object>> out = new LinkedHashMap<>();
      for (int i = 0; i < cols.size(); i++) out.put(cols.get(i), values.get(i));
      return new RowSet.ColumnMap(out);
    }

    @Override public RowSet.ColumnMap empty() { return new RowSet.ColumnMap(Map.of()); }
  };

  public static final ReadShape<RowSet.Records> RECORDS = new ReadShape<>("records", CURSOR_FETCH_SIZE) {
    @Override
    protected RowSet.Records collect(ResultSet rs) throws SQLException {
      List<String> cols = columnLabels(rs);
      List<Map<String, Object>> rows = new ArrayList<>();
      while (rs.next()) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < cols.size(); i++) row.put(cols.get(i), rs.getObject(i + 1));
        rows.add(row);
      }
      return new RowSet.Records(rows);
    }

    @Override public RowSet.Records empty() { return new RowSet.Records(List.of()); }
  };

  public static final ReadShape<List<List<Object>>> TUPLES = new ReadShape<>("tuples", CURSOR_FETCH_SIZE) {
    @Override
    protected List<List<Object>> collect(ResultSet rs) throws SQLException {
      int n = rs.getMetaData().getColumnCount();
      List<List<Object>> rows = new ArrayList<>();
      while (rs.next()) rows.add(rowValues(rs, n));
      return Collections.unmodifiableList(rows);
    }

    @Override public List<List<Object>> empty() { return List.of(); }
  };

  private static final List<ReadShape<?>> ALL = List.of(FRAME, COLUMNS, RECORDS, TUPLES);

  private final String name;
  private final int fetchSize;

  protected ReadShape(String name, int fetchSize) {
    this.name = name;
    this.fetchSize = fetchSize;
  }

  public String name() { return name; }

  public int fetchSize() { return fetchSize; }

  /** Materializes the whole result set. */
  protected abstract R collect(ResultSet rs) throws SQLException;

  /** Value returned when the read fails. */
  public abstract R empty();

  public R read(ResultSet rs) throws SQLException {
    return collect(rs);
  }

  /**
   * Shape by name, ignoring case ({@code dict} is accepted for {@link #COLUMNS}, {@code tuple} for {@link #TUPLES}).
   *
   * @throws UnsupportedShapeException for unknown names
   */
  public static ReadShape<?> named(String name) {
    if (name == null) throw new UnsupportedShapeException("null");
    String n = name.trim().toLowerCase(Locale.ROOT);
    if (n.equals("dict")) return COLUMNS;
    if (n.equals("tuple")) return TUPLES;
    if (n.equals("polars") || n.equals("pandas")) return FRAME;
    for (ReadShape<?> s : ALL) {
      if (s.name.equals(n)) return s;
    }
    throw new UnsupportedShapeException(name);
  }

  /**
   * Result labels made unique: a repeated label gets a {@code _2}, {@code _3} ... suffix
   * ({@code SELECT a.id, b.id} reads as {@code id, id_2}).
   */
  static List<String> columnLabels(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> labels = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) labels.add(md.getColumnLabel(i));
    Set<String> taken = new HashSet<>(labels);
    Set<String> used = new HashSet<>();
    List<String> cols = new ArrayList<>(n);
    for (String label : labels) {
      String name = label;
      for (int k = 2; !used.add(name); k++) {
        name = label + "_" + k;
        // a suffix never reuses a label the result already carries
        while (taken.contains(name)) name = label + "_" + (++k);
      }
      cols.add(name);
    }
    return cols;
  }

  static List<Object> rowValues(ResultSet rs, int n) throws SQLException {
    List<Object> r = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) r.add(rs.getObject(i));
    return r;
  }

  @Override
  public String toString() {
    return "ReadShape[" + name + "]";
  }
}
