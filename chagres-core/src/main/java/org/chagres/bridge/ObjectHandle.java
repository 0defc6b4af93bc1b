package org.chagres.bridge;

import java.lang.ref.Cleaner;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * An owned reference to one object inside a {@link BridgeRuntime}.
 *
 * <p>A handle is a capability, not a pointer: the object stays reachable in the managed runtime
 * until the handle's reference is released, which happens exactly once, either explicitly through
 * {@link #release()} / {@link #close()} or, for a handle that is dropped without being released,
 * when it becomes unreachable. A second {@link #release()} and any use after release throw {@link
 * IllegalStateException}.
 *
 * <p>There is no way to copy a handle. {@link #cloneReference()} asks the runtime for a second,
 * independent reference to the same object; the two are released separately.
 *
 * <p>A handle carries the class it is declared as, and that class drives overload resolution for
 * calls made through it (see {@link #cast(String)}). Handles are not synchronized; using one handle
 * from two threads at once is the caller's responsibility.
 */
public final class ObjectHandle implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(ObjectHandle.class.getName());
  private static final Cleaner CLEANER = Cleaner.create();

  private final BridgeRuntime runtime;
  private final long token;
  private final Class<?> declaredClass;
  private final boolean staticReceiver;
  private final ReleaseState state;
  private final Cleaner.Cleanable cleanable;

  ObjectHandle(
      BridgeRuntime runtime,
      ObjectRegistry registry,
      long token,
      Class<?> declaredClass,
      boolean staticReceiver) {
    this.runtime = runtime;
    this.token = token;
    this.declaredClass = declaredClass;
    this.staticReceiver = staticReceiver;
    this.state = new ReleaseState(registry, token);
    this.cleanable = CLEANER.register(this, state);
  }

  /** Releases the reference of a handle that was dropped without being released. */
  private static final class ReleaseState implements Runnable {
    private final ObjectRegistry registry;
    private final long token;
    private final AtomicBoolean released = new AtomicBoolean();

    ReleaseState(ObjectRegistry registry, long token) {
      this.registry = registry;
      this.token = token;
    }

    boolean markReleased() {
      return released.compareAndSet(false, true);
    }

    @Override
    public void run() {
      if (markReleased()) {
        LOG.fine("Reclaiming unreleased reference " + token);
        registry.release(token);
      }
    }
  }

  // ========== LIFETIME ==========

  /**
   * Release the managed reference.
   *
   * @throws IllegalStateException if this handle was already released
   */
  public void release() {
    if (!state.markReleased()) {
      throw new IllegalStateException("Handle " + this + " was already released");
    }
    state.registry.release(token);
    cleanable.clean();
  }

  /** Release the reference if it is still held; does nothing otherwise. */
  @Override
  public void close() {
    if (state.markReleased()) {
      state.registry.release(token);
      cleanable.clean();
    }
  }

  public boolean isReleased() {
    return state.released.get();
  }

  // ========== CONVENIENCE ==========

  /** Same as {@link BridgeRuntime#invoke(ObjectHandle, String, InvocationArg...)}. */
  public ObjectHandle invoke(String methodName, InvocationArg... args) throws BridgeException {
    return runtime.invoke(this, methodName, args);
  }

  public ObjectHandle field(String fieldName) throws BridgeException {
    return runtime.field(this, fieldName);
  }

  public ObjectHandle cast(String targetClassName) throws BridgeException {
    return runtime.cast(this, targetClassName);
  }

  public ObjectHandle cloneReference() throws BridgeException {
    return runtime.cloneReference(this);
  }

  public <T> T toHost(Class<T> type) throws BridgeException {
    return runtime.toHost(this, type);
  }

  public <T> Optional<T> toHostOptional(Class<T> type) throws BridgeException {
    return runtime.toHostOptional(this, type);
  }

  public <E> List<E> toHostList(Class<E> elementType) throws BridgeException {
    return runtime.toHostList(this, elementType);
  }

  // ========== ACCESSORS ==========

  /** Name of the class this handle is declared as. */
  public String className() {
    return declaredClass.getName();
  }

  /** True for handles from {@link BridgeRuntime#staticClass}, which stand for a class itself. */
  public boolean isStaticClass() {
    return staticReceiver;
  }

  public BridgeRuntime runtime() {
    return runtime;
  }

  Class<?> declaredClass() {
    return declaredClass;
  }

  long token() {
    return token;
  }

  /** The referenced object, after checking the handle is still live. */
  Object target() {
    checkLive();
    return state.registry.resolve(token);
  }

  void checkLive() {
    if (state.released.get()) {
      throw new IllegalStateException("Handle " + this + " was released");
    }
  }

  @Override
  public String toString() {
    return "ObjectHandle{"
        + (staticReceiver ? "static " : "")
        + className()
        + "#"
        + token
        + (isReleased() ? ", released" : "")
        + "}";
  }
}
