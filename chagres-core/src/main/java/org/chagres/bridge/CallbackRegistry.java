package org.chagres.bridge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide table of callback registrations, keyed by the opaque token handed to managed code.
 *
 * <p>The managed side only ever holds the token; {@link CallbackBridge} turns it back into a
 * channel with a checked lookup. There is no unregister for a live registration: a registration
 * stays until its runtime shuts down, so tokens handed to long-lived managed objects remain valid
 * for as long as the runtime does.
 */
final class CallbackRegistry {
  private static final CallbackRegistry INSTANCE = new CallbackRegistry();

  private final Map<Long, CallbackChannel> channels = new ConcurrentHashMap<>();
  private final AtomicLong nextToken = new AtomicLong(1);

  private CallbackRegistry() {}

  static CallbackRegistry getInstance() {
    return INSTANCE;
  }

  CallbackChannel register(BridgeRuntime runtime) {
    long token = nextToken.getAndIncrement();
    CallbackChannel channel = new CallbackChannel(token, runtime);
    channels.put(token, channel);
    return channel;
  }

  /** The channel behind {@code token}, or {@code null} if it is unknown or reclaimed. */
  CallbackChannel lookup(long token) {
    return channels.get(token);
  }

  /** Drop a registration whose token never reached managed code. */
  void discard(CallbackChannel channel) {
    channels.remove(channel.token(), channel);
    channel.close();
  }

  /**
   * Reclaim every registration of {@code runtime}, closing its channels.
   *
   * @return the number of registrations reclaimed
   */
  int reclaim(BridgeRuntime runtime) {
    List<CallbackChannel> owned = new ArrayList<>();
    for (CallbackChannel channel : channels.values()) {
      if (channel.runtime() == runtime) {
        owned.add(channel);
      }
    }
    for (CallbackChannel channel : owned) {
      channels.remove(channel.token(), channel);
      channel.close();
    }
    return owned.size();
  }

  /** Number of registrations of {@code runtime}. */
  int count(BridgeRuntime runtime) {
    int count = 0;
    for (CallbackChannel channel : channels.values()) {
      if (channel.runtime() == runtime) count++;
    }
    return count;
  }
}
