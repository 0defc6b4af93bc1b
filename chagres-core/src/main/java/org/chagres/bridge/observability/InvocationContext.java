package org.chagres.bridge.observability;

/**
 * Captures context for a single boundary-crossing operation, used for structured logging and
 * diagnostics.
 *
 * <p>This record is immutable and captures all relevant information at operation start time.
 */
public record InvocationContext(
    long runtimeId, long invocationId, Operation operation, String target, long startNanos) {

  /** Create a new invocation context with current timestamp. */
  public static InvocationContext create(
      long runtimeId, long invocationId, Operation operation, String target) {
    return new InvocationContext(runtimeId, invocationId, operation, target, System.nanoTime());
  }

  public String operationName() {
    return operation.displayName();
  }

  /** Calculate elapsed time in microseconds. */
  public long elapsedMicros() {
    return (System.nanoTime() - startNanos) / 1000;
  }
}
