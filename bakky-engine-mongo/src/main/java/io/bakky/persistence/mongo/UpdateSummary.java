package io.bakky.persistence.mongo;

/** Counts from an update; {@code upsertedId} is set only when the update inserted a document. */
public record UpdateSummary(long matchedCount, long modifiedCount, String upsertedId) {
  public boolean upserted() { return upsertedId != null; }
}
