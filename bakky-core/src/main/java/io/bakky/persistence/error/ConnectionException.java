package io.bakky.persistence.error;

/** Cannot reach or authenticate to the backing store. */
public final class ConnectionException extends BakkyDataException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override public String kind() { return "connection"; }
}
