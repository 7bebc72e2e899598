package io.bakky.persistence.error;

/** Any other failure reported by the driver while executing a statement. */
public final class QueryException extends BakkyDataException {
  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override public String kind() { return "query"; }
}
