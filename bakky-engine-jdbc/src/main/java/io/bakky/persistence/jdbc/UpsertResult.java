package io.bakky.persistence.jdbc;

import io.bakky.persistence.error.BakkyDataException;
import io.bakky.persistence.exec.WriteResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Row-level outcome of an upsert batch.
 *
 * @param insertedRows rows returned by the conflict-free insert, in input order
 */
public record UpsertResult(boolean success,
                           int inserted,
                           int updated,
                           List<Map<String, Object>> insertedRows,
                           BakkyDataException error) {
  public UpsertResult {
    insertedRows = insertedRows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(insertedRows));
  }

  public static UpsertResult ok(int inserted, int updated, List<Map<String, Object>> insertedRows) {
    return new UpsertResult(true, inserted, updated, insertedRows, null);
  }

  public static UpsertResult failed(BakkyDataException error) {
    return new UpsertResult(false, 0, 0, List.of(), error);
  }

  public int rowCount() { return inserted + updated; }

  public WriteResult toWriteResult() {
    return success ? WriteResult.ok(rowCount()) : WriteResult.failed(error);
  }

  public UpsertResult orThrow() {
    if (!success) throw error;
    return this;
  }
}
