package org.chagres.bridge;

import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * One callback registration: an unbounded FIFO of delivered handles between the managed runtime
 * (sending through {@link CallbackBridge}) and one {@link CallbackReceiver}.
 *
 * <p>Deliveries are queued in the order the entry point was entered. Once the receiver is closed or
 * the runtime shuts down, further sends fail with {@link ErrorKind#CHANNEL_CLOSED}, and a blocked
 * receiver is woken.
 */
final class CallbackChannel {
  private static final Logger LOG = Logger.getLogger(CallbackChannel.class.getName());

  /** Queued after the last handle once the channel is closed. */
  private static final Object END_OF_STREAM = new Object();

  private final long token;
  private final BridgeRuntime runtime;
  private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
  private boolean closed;

  CallbackChannel(long token, BridgeRuntime runtime) {
    this.token = token;
    this.runtime = runtime;
  }

  long token() {
    return token;
  }

  BridgeRuntime runtime() {
    return runtime;
  }

  // --- SENDER SIDE ---

  synchronized void send(ObjectHandle handle) throws BridgeException {
    if (closed || !runtime.isOpen()) {
      throw new BridgeException(
          ErrorKind.CHANNEL_CLOSED, "Callback channel " + token + " is closed");
    }
    queue.add(handle);
  }

  // --- RECEIVER SIDE ---

  ObjectHandle take() throws BridgeException, InterruptedException {
    return unwrap(queue.take());
  }

  Optional<ObjectHandle> poll(long timeout, TimeUnit unit)
      throws BridgeException, InterruptedException {
    Object next = queue.poll(timeout, unit);
    return next == null ? Optional.empty() : Optional.of(unwrap(next));
  }

  int pending() {
    int size = queue.size();
    return queue.contains(END_OF_STREAM) ? size - 1 : size;
  }

  synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Close the channel and release every handle that was delivered but never received.
   *
   * @return the number of handles released
   */
  synchronized int close() {
    if (closed) {
      return 0;
    }
    closed = true;
    int dropped = 0;
    Object next;
    while ((next = queue.poll()) != null) {
      if (next instanceof ObjectHandle handle) {
        handle.close();
        dropped++;
      }
    }
    queue.add(END_OF_STREAM);
    if (dropped > 0) {
      LOG.fine("Callback channel " + token + " closed with " + dropped + " unreceived handles");
    }
    return dropped;
  }

  private ObjectHandle unwrap(Object next) throws BridgeException {
    if (next == END_OF_STREAM) {
      // Leave the marker for later receives
      queue.add(END_OF_STREAM);
      throw new BridgeException(
          ErrorKind.CHANNEL_CLOSED, "Callback channel " + token + " is closed");
    }
    return (ObjectHandle) next;
  }
}
