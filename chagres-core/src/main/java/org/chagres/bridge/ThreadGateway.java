package org.chagres.bridge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import org.chagres.bridge.observability.BridgeEvents;
import org.chagres.bridge.observability.Metrics;
import org.chagres.bridge.observability.StructuredLogger;

/**
 * Hands out per-thread {@link RuntimeAccess} attachments for one runtime.
 *
 * <p>Attachment is lazy and idempotent: the first call on a thread attaches it and later calls
 * return the cached attachment. Attachments of threads that have ended are torn down on the next
 * attach or count, unless they opted out of auto-detach; those stay until detached explicitly or
 * until the runtime shuts down. Once a thread has asked for {@code detachOnExit=false} its
 * attachment keeps that setting.
 */
final class ThreadGateway {
  private static final Logger LOG = Logger.getLogger(ThreadGateway.class.getName());

  private final BridgeRuntime runtime;
  private final BridgeLimits limits;
  private final ThreadLocal<RuntimeAccess> current = new ThreadLocal<>();
  private final Map<Thread, RuntimeAccess> attached = new ConcurrentHashMap<>();
  private volatile boolean shutdown;

  ThreadGateway(BridgeRuntime runtime, BridgeLimits limits) {
    this.runtime = runtime;
    this.limits = limits;
  }

  RuntimeAccess attach(boolean detachOnExit) throws BridgeException {
    if (shutdown) {
      throw BridgeException.runtimeUnavailable("Runtime " + runtime.id() + " is closed");
    }
    RuntimeAccess existing = current.get();
    if (existing != null && existing.isAttached()) {
      if (!detachOnExit && existing.detachOnExit()) {
        existing.disableDetachOnExit();
      }
      return existing;
    }

    Thread thread = Thread.currentThread();
    RuntimeAccess access = new RuntimeAccess(runtime, this, thread, detachOnExit);
    synchronized (attached) {
      // Re-check under the lock so shutdown cannot miss this attachment
      if (shutdown) {
        throw BridgeException.runtimeUnavailable("Runtime " + runtime.id() + " is closed");
      }
      reapDeadThreads();
      limits.checkAttachedThreads(attached.size());
      attached.put(thread, access);
    }
    current.set(access);

    Metrics.getInstance().updateAttachedThreadCount(1);
    StructuredLogger.logAttach(runtime.id(), thread.getName(), "attach", detachOnExit);
    BridgeEvents.emitAttach(runtime.id(), thread.getName(), "attach", detachOnExit);
    return access;
  }

  void detach(RuntimeAccess access) {
    if (!attached.remove(access.thread(), access)) {
      return;
    }
    access.markDetached();
    if (Thread.currentThread() == access.thread()) {
      current.remove();
    }
    Metrics.getInstance().updateAttachedThreadCount(-1);
    StructuredLogger.logAttach(
        runtime.id(), access.thread().getName(), "detach", access.detachOnExit());
    BridgeEvents.emitAttach(
        runtime.id(), access.thread().getName(), "detach", access.detachOnExit());
  }

  /** Number of live attachments, after reaping ended threads. */
  int attachedCount() {
    synchronized (attached) {
      reapDeadThreads();
      return attached.size();
    }
  }

  /** Detach every thread. Later attach calls fail with {@link ErrorKind#RUNTIME_UNAVAILABLE}. */
  int shutdown() {
    List<RuntimeAccess> remaining;
    synchronized (attached) {
      shutdown = true;
      remaining = new ArrayList<>(attached.values());
    }
    for (RuntimeAccess access : remaining) {
      detach(access);
    }
    current.remove();
    return remaining.size();
  }

  private void reapDeadThreads() {
    List<RuntimeAccess> dead = new ArrayList<>();
    for (RuntimeAccess access : attached.values()) {
      if (access.detachOnExit() && !access.thread().isAlive()) {
        dead.add(access);
      }
    }
    for (RuntimeAccess access : dead) {
      LOG.fine("Detaching ended thread " + access.thread().getName());
      detach(access);
    }
  }
}
