package org.chagres.bridge;

import org.chagres.bridge.observability.BridgeEvents;
import org.chagres.bridge.observability.Metrics;
import org.chagres.bridge.observability.StructuredLogger;

/**
 * Entry point through which managed code delivers objects to a host callback channel.
 *
 * <p>Callable from any thread, concurrently, for the same or different registrations. A delivering
 * thread is attached with {@code detachOnExit=false}, since it belongs to the managed runtime. The
 * entry point never throws into its caller: an unknown token, a closed channel or a shut-down
 * runtime fails that one delivery, which is logged at SEVERE and counted.
 */
public final class CallbackBridge {

  private CallbackBridge() {}

  /**
   * Deliver {@code value} to the channel registered under {@code channelToken}.
   *
   * @return whether the value was queued for the receiver
   */
  public static boolean deliver(long channelToken, Object value) {
    long startNanos = System.nanoTime();
    String valueType = value == null ? "null" : value.getClass().getName();
    BridgeEvents.CallbackEvent event = BridgeEvents.beginCallback(channelToken, valueType);

    String error = null;
    CallbackChannel channel = CallbackRegistry.getInstance().lookup(channelToken);
    if (channel == null) {
      error = "Unknown or reclaimed callback channel " + channelToken;
    } else {
      try {
        BridgeRuntime runtime = channel.runtime();
        runtime.attachCurrentThread(false);
        ObjectHandle handle = runtime.adopt(value);
        try {
          channel.send(handle);
        } catch (BridgeException e) {
          handle.close();
          throw e;
        }
      } catch (BridgeException | RuntimeException e) {
        error = e.toString();
      }
    }

    boolean success = error == null;
    Metrics.getInstance().recordCallback(success);
    StructuredLogger.logCallback(
        channelToken, valueType, (System.nanoTime() - startNanos) / 1000, success, error);
    BridgeEvents.endCallback(event, success, error);
    return success;
  }
}
