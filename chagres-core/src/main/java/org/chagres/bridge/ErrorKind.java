package org.chagres.bridge;

/**
 * Classification of every failure a boundary-crossing operation can report.
 *
 * <p>Client errors are caused by the caller's input (a misspelled class, a wrong argument type) and
 * are logged quietly; the rest point at the runtime or the managed code and are logged as warnings.
 */
public enum ErrorKind {
  RUNTIME_UNAVAILABLE(false),
  ATTACH_FAILED(false),
  CLASS_NOT_FOUND(true),
  CONVERSION_ERROR(true),
  NUMERIC_OVERFLOW(true),
  INVALID_CAST(true),
  ILLEGAL_CAST(true),
  METHOD_NOT_FOUND(true),
  FIELD_NOT_FOUND(true),
  INVOCATION_FAILED(false),
  NULL_RESULT(true),
  CHANNEL_CLOSED(false),
  ARTIFACT_DEPLOY_FAILED(false),
  RESOURCE_LIMIT(false);

  private final boolean clientError;

  ErrorKind(boolean clientError) {
    this.clientError = clientError;
  }

  /** True if the failure was caused by the caller's input rather than the runtime. */
  public boolean isClientError() {
    return clientError;
  }
}
