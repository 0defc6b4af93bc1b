package org.chagres.bridge;

/**
 * Base class for managed objects that push results back to the host asynchronously.
 *
 * <p>The host registers a channel with {@link BridgeRuntime#initCallbackChannel(ObjectHandle)},
 * which calls {@link #initCallbackChannel(long)} on the object. Afterwards each {@link
 * #doCallback(Object)}, from any thread, delivers one object to the host's {@link
 * CallbackReceiver}.
 *
 * <p>A calling thread stays attached to the runtime after it ends, until the runtime closes. Call
 * {@link #doCallback(Object)} from a long-lived thread or a fixed pool: a fresh thread per callback
 * uses up {@code chagres.limits.max_attached_threads}, and later deliveries fail with {@link
 * ErrorKind#ATTACH_FAILED}.
 */
public abstract class NativeCallbackSupport {
  private volatile long channelToken;
  private volatile boolean initialized;

  public final void initCallbackChannel(long channelToken) {
    this.channelToken = channelToken;
    this.initialized = true;
  }

  /**
   * Deliver {@code value} to the host.
   *
   * @throws IllegalStateException if no callback channel was initialized for this object
   */
  protected void doCallback(Object value) {
    if (!initialized) {
      throw new IllegalStateException(
          "No callback channel initialized for " + getClass().getName());
    }
    CallbackBridge.deliver(channelToken, value);
  }
}
