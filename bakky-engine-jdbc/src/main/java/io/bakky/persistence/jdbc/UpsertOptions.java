package io.bakky.persistence.jdbc;

import java.util.List;

/**
 * @param uniqueColumns conflict key; empty means "derive from the primary key"
 * @param forceUpdate   update the existing row on conflict instead of failing the call
 */
public record UpsertOptions(List<String> uniqueColumns, boolean forceUpdate) {
  public UpsertOptions {
    uniqueColumns = uniqueColumns == null ? List.of() : List.copyOf(uniqueColumns);
  }

  public static UpsertOptions defaults() {
    return new UpsertOptions(List.of(), true);
  }

  public static UpsertOptions on(String... uniqueColumns) {
    return new UpsertOptions(List.of(uniqueColumns), true);
  }

  public UpsertOptions withForceUpdate(boolean force) {
    return new UpsertOptions(uniqueColumns, force);
  }
}
