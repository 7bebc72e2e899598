package io.bakky.persistence.error;

/** Raised when a caller asks for a row representation the engine does not know. */
public final class UnsupportedShapeException extends BakkyDataException {
  private final String shape;

  public UnsupportedShapeException(String shape) {
    super("Unsupported data shape: " + shape);
    this.shape = shape;
  }

  public String shape() { return shape; }

  @Override public String kind() { return "unsupported_shape"; }
}
