package io.bakky.persistence.error;

/** Malformed caller input, such as heterogeneous rows or a missing unique column. */
public final class ValidationException extends BakkyDataException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override public String kind() { return "validation"; }
}
