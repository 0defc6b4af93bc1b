package org.chagres.bridge;

/**
 * The managed runtime raised an exception while executing a constructor, method or field access.
 *
 * <p>The managed exception is recovered and reported here together with its formatted stack trace
 * (cause chain included), so the host never sees an unhandled managed fault.
 */
public final class InvocationFailedException extends BridgeException {
  private final String managedExceptionClass;
  private final String managedStackTrace;

  InvocationFailedException(String target, Throwable managed) {
    super(
        ErrorKind.INVOCATION_FAILED,
        target + " failed: " + managed.getClass().getName() + ": " + managed.getMessage(),
        managed);
    this.managedExceptionClass = managed.getClass().getName();
    this.managedStackTrace = formatException(managed);
  }

  /** Fully qualified class name of the exception the managed code threw. */
  public String managedExceptionClass() {
    return managedExceptionClass;
  }

  public String managedStackTrace() {
    return managedStackTrace;
  }

  private static String formatException(Throwable t) {
    StringBuilder sb = new StringBuilder();
    sb.append(t.getClass().getName()).append(": ").append(t.getMessage());
    for (StackTraceElement ste : t.getStackTrace()) {
      sb.append("\n\tat ").append(ste.toString());
    }
    // Include cause chain
    Throwable cause = t.getCause();
    while (cause != null && cause != t) {
      sb.append("\nCaused by: ")
          .append(cause.getClass().getName())
          .append(": ")
          .append(cause.getMessage());
      for (StackTraceElement ste : cause.getStackTrace()) {
        sb.append("\n\tat ").append(ste.toString());
      }
      t = cause;
      cause = cause.getCause();
    }
    return sb.toString();
  }
}
