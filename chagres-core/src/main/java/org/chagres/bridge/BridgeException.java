package org.chagres.bridge;

/**
 * Checked failure of a bridge operation.
 *
 * <p>Every operation that crosses into the managed runtime reports failures through this type (or
 * one of its subclasses) instead of letting managed exceptions escape. The {@link #kind()} is
 * stable and meant for programmatic handling; the message is for humans.
 */
public class BridgeException extends Exception {
  private final ErrorKind kind;

  public BridgeException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public BridgeException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
  }

  // ========== FACTORIES ==========

  static BridgeException runtimeUnavailable(String message) {
    return new BridgeException(ErrorKind.RUNTIME_UNAVAILABLE, message);
  }

  static BridgeException classNotFound(String className, Throwable cause) {
    return new BridgeException(ErrorKind.CLASS_NOT_FOUND, "Class not found: " + className, cause);
  }

  static BridgeException conversion(String message) {
    return new BridgeException(ErrorKind.CONVERSION_ERROR, message);
  }

  static BridgeException numericOverflow(Object value, Class<?> target) {
    return new BridgeException(
        ErrorKind.NUMERIC_OVERFLOW,
        "Value " + value + " does not fit in " + target.getSimpleName());
  }

  static BridgeException invalidCast(Object value, Class<?> target) {
    return new BridgeException(
        ErrorKind.INVALID_CAST,
        "Managed value of type "
            + value.getClass().getName()
            + " cannot be converted to host type "
            + target.getName());
  }

  static BridgeException nullResult(Class<?> target) {
    return new BridgeException(
        ErrorKind.NULL_RESULT, "Managed reference is null; cannot produce " + target.getName());
  }
}
