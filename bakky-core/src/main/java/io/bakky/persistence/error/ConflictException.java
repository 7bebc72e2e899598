package io.bakky.persistence.error;

/** Unique-constraint violation that the caller did not ask to resolve. */
public final class ConflictException extends BakkyDataException {
  public ConflictException(String message) {
    super(message);
  }

  public ConflictException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override public String kind() { return "conflict"; }
}
