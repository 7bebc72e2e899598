package io.bakky.persistence.error;

/**
 * Base of every error raised by the bakky data layer.
 * <p>
 * The driver error, when there is one, is kept as the cause so callers can log the original text.
 */
public abstract class BakkyDataException extends RuntimeException {
  protected BakkyDataException(String message) {
    super(message);
  }

  protected BakkyDataException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short machine-friendly kind, e.g. {@code conflict}. */
  public abstract String kind();
}
