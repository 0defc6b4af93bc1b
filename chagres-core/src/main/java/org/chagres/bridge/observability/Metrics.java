package org.chagres.bridge.observability;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Collects and exposes metrics for monitoring bridge traffic.
 *
 * <p>Metrics include:
 *
 * <ul>
 *   <li>Operation counts per {@link Operation}
 *   <li>Latency percentiles (p50, p99) per operation
 *   <li>Live and peak managed reference counts
 *   <li>Attached host threads
 *   <li>Callback deliveries and failures
 * </ul>
 *
 * <p>Process-wide: all runtimes report into the same instance. Uses lock-free data structures for
 * minimal overhead on the invocation path.
 */
public class Metrics {
  private static final Metrics INSTANCE = new Metrics();

  private final Map<Operation, LongAdder> operationCounts = new ConcurrentHashMap<>();
  private final Map<Operation, LongAdder> errorCounts = new ConcurrentHashMap<>();
  private final Map<Operation, LatencyTracker> latencyTrackers = new ConcurrentHashMap<>();

  private final LongAdder totalOperations = new LongAdder();
  private final LongAdder totalErrors = new LongAdder();
  private final LongAdder totalCallbackDeliveries = new LongAdder();
  private final LongAdder totalCallbackFailures = new LongAdder();
  private final LongAdder totalArtifactsDeployed = new LongAdder();

  private final AtomicLong currentReferenceCount = new AtomicLong(0);
  private final AtomicLong peakReferenceCount = new AtomicLong(0);
  private final AtomicLong attachedThreadCount = new AtomicLong(0);
  private final AtomicLong openRuntimeCount = new AtomicLong(0);

  private final long startTimeNanos = System.nanoTime();

  private Metrics() {}

  public static Metrics getInstance() {
    return INSTANCE;
  }

  /** Record a completed operation. */
  public void recordOperation(Operation operation, long latencyMicros, boolean success) {
    totalOperations.increment();
    operationCounts.computeIfAbsent(operation, k -> new LongAdder()).increment();

    if (!success) {
      totalErrors.increment();
      errorCounts.computeIfAbsent(operation, k -> new LongAdder()).increment();
    }

    latencyTrackers.computeIfAbsent(operation, k -> new LatencyTracker()).record(latencyMicros);
  }

  /** Record one pass through the callback entry point. */
  public void recordCallback(boolean success) {
    totalCallbackDeliveries.increment();
    if (!success) {
      totalCallbackFailures.increment();
    }
  }

  public void recordArtifactDeployed() {
    totalArtifactsDeployed.increment();
  }

  /** Update reference count (called on register/release). */
  public void updateReferenceCount(long delta) {
    long newCount = currentReferenceCount.addAndGet(delta);
    // Approximate under contention
    long peak = peakReferenceCount.get();
    while (newCount > peak && !peakReferenceCount.compareAndSet(peak, newCount)) {
      peak = peakReferenceCount.get();
    }
  }

  public void updateAttachedThreadCount(long delta) {
    attachedThreadCount.addAndGet(delta);
  }

  public void updateOpenRuntimeCount(long delta) {
    openRuntimeCount.addAndGet(delta);
  }

  public long getTotalOperations() {
    return totalOperations.sum();
  }

  public long getTotalErrors() {
    return totalErrors.sum();
  }

  /** Get operations per second since start. */
  public double getOperationsPerSecond() {
    long elapsedNanos = System.nanoTime() - startTimeNanos;
    if (elapsedNanos <= 0) return 0;
    return totalOperations.sum() * 1_000_000_000.0 / elapsedNanos;
  }

  public long getCurrentReferenceCount() {
    return currentReferenceCount.get();
  }

  public long getPeakReferenceCount() {
    return peakReferenceCount.get();
  }

  public long getAttachedThreadCount() {
    return attachedThreadCount.get();
  }

  public long getOpenRuntimeCount() {
    return openRuntimeCount.get();
  }

  /** Get latency percentile (upper bucket bound, microseconds) for an operation. */
  public long getLatencyPercentile(Operation operation, double percentile) {
    LatencyTracker tracker = latencyTrackers.get(operation);
    return tracker != null ? tracker.getPercentile(percentile) : 0;
  }

  public long getOperationCount(Operation operation) {
    LongAdder counter = operationCounts.get(operation);
    return counter != null ? counter.sum() : 0;
  }

  public long getErrorCount(Operation operation) {
    LongAdder counter = errorCounts.get(operation);
    return counter != null ? counter.sum() : 0;
  }

  public long getTotalCallbackDeliveries() {
    return totalCallbackDeliveries.sum();
  }

  public long getTotalCallbackFailures() {
    return totalCallbackFailures.sum();
  }

  public long getTotalArtifactsDeployed() {
    return totalArtifactsDeployed.sum();
  }

  /** Format all metrics as a human-readable report. */
  public String report() {
    StringBuilder sb = new StringBuilder();
    sb.append("=== Chagres Bridge Metrics ===\n");

    sb.append("\nGlobal:\n");
    sb.append(String.format("  total_operations: %d\n", getTotalOperations()));
    sb.append(String.format("  total_errors: %d\n", getTotalErrors()));
    sb.append(String.format("  operations_per_sec: %.2f\n", getOperationsPerSecond()));
    sb.append(String.format("  open_runtimes: %d\n", getOpenRuntimeCount()));
    sb.append(String.format("  attached_threads: %d\n", getAttachedThreadCount()));
    sb.append(String.format("  current_references: %d\n", getCurrentReferenceCount()));
    sb.append(String.format("  peak_references: %d\n", getPeakReferenceCount()));
    sb.append(String.format("  artifacts_deployed: %d\n", getTotalArtifactsDeployed()));

    sb.append("\nCallbacks:\n");
    sb.append(String.format("  total_deliveries: %d\n", getTotalCallbackDeliveries()));
    sb.append(String.format("  total_failures: %d\n", getTotalCallbackFailures()));

    sb.append("\nPer-Operation Latency (microseconds):\n");
    for (Operation operation : Operation.values()) {
      long count = getOperationCount(operation);
      if (count == 0) continue;
      sb.append(
          String.format(
              "  %s: count=%d errors=%d p50=%d p99=%d mean=%d\n",
              operation.displayName(),
              count,
              getErrorCount(operation),
              getLatencyPercentile(operation, 0.50),
              getLatencyPercentile(operation, 0.99),
              latencyTrackers.get(operation).getMean()));
    }

    return sb.toString();
  }

  /**
   * Simple latency tracker using bucketed histogram. Provides approximate percentiles with minimal
   * overhead.
   */
  private static class LatencyTracker {
    // Buckets: 0-10us, 10-100us, 100-1000us, 1-10ms, 10-100ms, 100ms-1s, >1s
    private static final long[] BUCKET_BOUNDS = {
      10, 100, 1000, 10_000, 100_000, 1_000_000, Long.MAX_VALUE
    };
    private final LongAdder[] buckets = new LongAdder[BUCKET_BOUNDS.length];
    private final LongAdder totalCount = new LongAdder();
    private final LongAdder totalSum = new LongAdder();

    LatencyTracker() {
      for (int i = 0; i < buckets.length; i++) {
        buckets[i] = new LongAdder();
      }
    }

    void record(long latencyMicros) {
      totalCount.increment();
      totalSum.add(latencyMicros);

      for (int i = 0; i < BUCKET_BOUNDS.length; i++) {
        if (latencyMicros < BUCKET_BOUNDS[i]) {
          buckets[i].increment();
          break;
        }
      }
    }

    long getPercentile(double percentile) {
      long total = totalCount.sum();
      if (total == 0) return 0;

      long target = (long) Math.ceil(total * percentile);
      long cumulative = 0;

      for (int i = 0; i < buckets.length; i++) {
        cumulative += buckets[i].sum();
        if (cumulative >= target) {
          return BUCKET_BOUNDS[i];
        }
      }
      return BUCKET_BOUNDS[BUCKET_BOUNDS.length - 1];
    }

    long getMean() {
      long count = totalCount.sum();
      return count > 0 ? totalSum.sum() / count : 0;
    }
  }

  /** Reset all metrics (for testing). */
  public void reset() {
    totalOperations.reset();
    totalErrors.reset();
    totalCallbackDeliveries.reset();
    totalCallbackFailures.reset();
    totalArtifactsDeployed.reset();
    operationCounts.clear();
    errorCounts.clear();
    latencyTrackers.clear();
    currentReferenceCount.set(0);
    peakReferenceCount.set(0);
    attachedThreadCount.set(0);
    openRuntimeCount.set(0);
  }
}
