package org.chagres.bridge;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.chagres.bridge.observability.BridgeEvents;
import org.chagres.bridge.observability.Metrics;
import org.chagres.bridge.observability.StructuredLogger;

/**
 * The reference table of one runtime: every managed object the host can reach is held here under
 * an opaque token, and stays strongly reachable until its token is released.
 *
 * <p>Registering the same object twice yields two independent tokens, each released separately.
 * {@code null} is stored as a sentinel so a null result still owns a token like any other.
 */
final class ObjectRegistry {
  private static final Logger LOG = Logger.getLogger(ObjectRegistry.class.getName());

  private static final Object NULL_REFERENCE = new Object();

  private final long runtimeId;
  private final BridgeLimits limits;
  private final Map<Long, Object> objects = new ConcurrentHashMap<>();
  private final AtomicLong nextToken = new AtomicLong(1);
  private final AtomicLong peak = new AtomicLong(0);
  private volatile boolean closed;

  ObjectRegistry(long runtimeId, BridgeLimits limits) {
    this.runtimeId = runtimeId;
    this.limits = limits;
  }

  /** Take a new strong reference to {@code value} and return its token. */
  long register(Object value) throws BridgeException {
    if (closed) {
      throw BridgeException.runtimeUnavailable("Runtime " + runtimeId + " is closed");
    }
    limits.checkReferenceLimit(objects.size());
    long token = nextToken.getAndIncrement();
    objects.put(token, value == null ? NULL_REFERENCE : value);

    int size = objects.size();
    peak.accumulateAndGet(size, Math::max);
    Metrics.getInstance().updateReferenceCount(1);
    String type = value == null ? "null" : value.getClass().getName();
    StructuredLogger.logReference(runtimeId, token, "add", type, size);
    BridgeEvents.emitReference(runtimeId, token, "add", type, size);
    return token;
  }

  /**
   * The object behind {@code token}.
   *
   * @throws IllegalStateException if the token is unknown or already released
   */
  Object resolve(long token) {
    Object value = objects.get(token);
    if (value == null) {
      throw new IllegalStateException(
          "Reference " + token + " is not live in runtime " + runtimeId);
    }
    return value == NULL_REFERENCE ? null : value;
  }

  /**
   * Drop the reference behind {@code token}. After {@link #clear()} every reference is already gone
   * and this is a no-op.
   *
   * @throws IllegalStateException if the runtime is open and the token is not live
   */
  void release(long token) {
    Object removed = objects.remove(token);
    if (removed == null) {
      if (closed) return;
      throw new IllegalStateException(
          "Reference " + token + " is not live in runtime " + runtimeId);
    }
    int size = objects.size();
    Metrics.getInstance().updateReferenceCount(-1);
    String type = removed == NULL_REFERENCE ? "null" : removed.getClass().getName();
    StructuredLogger.logReference(runtimeId, token, "release", type, size);
    BridgeEvents.emitReference(runtimeId, token, "release", type, size);
  }

  int size() {
    return objects.size();
  }

  long peakSize() {
    return peak.get();
  }

  boolean isClosed() {
    return closed;
  }

  /**
   * Close the table and drop every remaining reference.
   *
   * @return the number of references that were never released
   */
  int clear() {
    closed = true;
    int leaked = objects.size();
    if (leaked > 0 && LOG.isLoggable(Level.FINE)) {
      Map<String, Integer> byType = new TreeMap<>();
      for (Object value : objects.values()) {
        String type = value == NULL_REFERENCE ? "null" : value.getClass().getName();
        byType.merge(type, 1, Integer::sum);
      }
      LOG.fine("Runtime " + runtimeId + " closing with unreleased references: " + byType);
    }
    objects.clear();
    Metrics.getInstance().updateReferenceCount(-leaked);
    return leaked;
  }
}
