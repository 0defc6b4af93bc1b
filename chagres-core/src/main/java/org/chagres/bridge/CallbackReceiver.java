package org.chagres.bridge;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The host end of a callback registration. Each receive yields one {@link ObjectHandle} per
 * callback, in the order the managed runtime delivered them; the caller owns and releases it.
 *
 * <p>Closing the receiver releases handles that were delivered but never received; later
 * deliveries to the registration are reported by the entry point as {@link
 * ErrorKind#CHANNEL_CLOSED}.
 */
public final class CallbackReceiver implements AutoCloseable {
  private final CallbackChannel channel;

  CallbackReceiver(CallbackChannel channel) {
    this.channel = channel;
  }

  /**
   * Block until the next callback arrives.
   *
   * @throws BridgeException with {@link ErrorKind#CHANNEL_CLOSED} if the receiver was closed or the
   *     runtime shut down
   */
  public ObjectHandle receive() throws BridgeException, InterruptedException {
    return channel.take();
  }

  /** Wait up to {@code timeout} for the next callback; empty if none arrived in time. */
  public Optional<ObjectHandle> receive(long timeout, TimeUnit unit)
      throws BridgeException, InterruptedException {
    return channel.poll(timeout, unit);
  }

  /** Callbacks delivered and not yet received. */
  public int pending() {
    return channel.pending();
  }

  /** The token the managed side uses to reach this receiver. */
  public long registrationToken() {
    return channel.token();
  }

  public boolean isClosed() {
    return channel.isClosed();
  }

  @Override
  public void close() {
    channel.close();
  }
}
