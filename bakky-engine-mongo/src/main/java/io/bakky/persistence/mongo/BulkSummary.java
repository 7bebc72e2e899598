package io.bakky.persistence.mongo;

import java.util.List;

public record BulkSummary(int insertedCount,
                          int matchedCount,
                          int modifiedCount,
                          int deletedCount,
                          int upsertedCount,
                          List<String> upsertedIds) {
  public BulkSummary {
    upsertedIds = upsertedIds == null ? List.of() : List.copyOf(upsertedIds);
  }
}
