package org.chagres.bridge;

/**
 * One thread's attachment to a {@link BridgeRuntime}.
 *
 * <p>Obtained from {@link BridgeRuntime#attachCurrentThread()}; a thread holds at most one live
 * attachment per runtime. An attachment belongs to the thread that created it and cannot be used
 * from another.
 */
public final class RuntimeAccess {
  private final BridgeRuntime runtime;
  private final ThreadGateway gateway;
  private final Thread owner;
  private volatile boolean detachOnExit;
  private volatile boolean attached = true;

  RuntimeAccess(BridgeRuntime runtime, ThreadGateway gateway, Thread owner, boolean detachOnExit) {
    this.runtime = runtime;
    this.gateway = gateway;
    this.owner = owner;
    this.detachOnExit = detachOnExit;
  }

  public BridgeRuntime runtime() {
    return runtime;
  }

  public Thread thread() {
    return owner;
  }

  /** Whether the attachment is torn down automatically once its thread has ended. */
  public boolean detachOnExit() {
    return detachOnExit;
  }

  public boolean isAttached() {
    return attached;
  }

  /** Detach now. Later calls from this thread attach it again. */
  public void detach() {
    gateway.detach(this);
  }

  void disableDetachOnExit() {
    detachOnExit = false;
  }

  void markDetached() {
    attached = false;
  }

  /**
   * @throws IllegalStateException if detached or used from a thread other than its owner
   */
  void checkUsable() {
    if (!attached) {
      throw new IllegalStateException("Attachment of thread " + owner.getName() + " is detached");
    }
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "Attachment of thread "
              + owner.getName()
              + " used from thread "
              + Thread.currentThread().getName());
    }
  }

  @Override
  public String toString() {
    return "RuntimeAccess{runtime="
        + runtime.id()
        + ", thread="
        + owner.getName()
        + ", detachOnExit="
        + detachOnExit
        + ", attached="
        + attached
        + "}";
  }
}
