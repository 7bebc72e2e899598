package io.bakky.persistence.exec;

import io.bakky.persistence.error.BakkyDataException;

import java.util.Optional;

/**
 * Outcome of a write: success flag, affected rows and, on failure, the typed error.
 * <p>
 * Write paths report failures here instead of throwing; {@link #orThrow()} restores exception flow.
 */
public record WriteResult(boolean success, long rowCount, BakkyDataException error) {
  public WriteResult {
    if (success && error != null) throw new IllegalArgumentException("successful result cannot carry an error");
    if (!success && error == null) throw new IllegalArgumentException("failed result requires an error");
  }

  public static WriteResult ok(long rowCount) {
    return new WriteResult(true, rowCount, null);
  }

  public static WriteResult failed(BakkyDataException error) {
    return new WriteResult(false, 0, error);
  }

  public Optional<BakkyDataException> failure() {
    return Optional.ofNullable(error);
  }

  public WriteResult orThrow() {
    if (!success) throw error;
    return this;
  }
}
