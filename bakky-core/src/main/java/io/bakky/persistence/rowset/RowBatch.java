package io.bakky.persistence.rowset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Uniform rows ready for a batched statement: one column list and one value list per row,
 * every value list aligned with {@link #columns()}.
 */
public record RowBatch(List<String> columns, List<List<Object>> rows) {
  public RowBatch {
    columns = List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    // values may be null, so List.copyOf is not an option here
    for (List<Object> r : rows) copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
    rows = Collections.unmodifiableList(copy);
  }

  public int size() { return rows.size(); }

  public boolean isEmpty() { return rows.isEmpty(); }
}
