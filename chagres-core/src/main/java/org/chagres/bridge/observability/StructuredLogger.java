package org.chagres.bridge.observability;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structured logger that outputs key-value pairs for easy parsing.
 *
 * <p>Log format: {@code runtimeId=N invocationId=N op=X target=Y latency_us=Z status=OK}
 *
 * <p>Client errors (bad class names, wrong argument shapes) go to FINE; runtime and managed-code
 * failures go to WARNING. Method resolution traces are only produced in trace mode
 * ({@code -Dchagres.trace=true}).
 */
public class StructuredLogger {
  private static final Logger LOG = Logger.getLogger("org.chagres.bridge");

  /** Enable trace mode for verbose method resolution logging. */
  private static volatile boolean traceMode =
      Boolean.parseBoolean(System.getProperty("chagres.trace", "false"));

  /** Enable metrics logging (stats dump on runtime shutdown). */
  private static volatile boolean metricsEnabled =
      Boolean.parseBoolean(System.getProperty("chagres.metrics", "false"));

  private StructuredLogger() {}

  public static boolean isTraceEnabled() {
    return traceMode;
  }

  public static void setTraceMode(boolean enabled) {
    traceMode = enabled;
    LOG.info("Trace mode " + (enabled ? "enabled" : "disabled"));
  }

  public static boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public static void setMetricsEnabled(boolean enabled) {
    metricsEnabled = enabled;
  }

  /** Log a completed operation with structured fields. */
  public static void logOperation(InvocationContext ctx, boolean success, String errorKind) {
    if (!LOG.isLoggable(Level.FINE)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("runtimeId=").append(ctx.runtimeId());
    sb.append(" invocationId=").append(ctx.invocationId());
    sb.append(" op=").append(ctx.operationName());

    if (ctx.target() != null && !ctx.target().isEmpty()) {
      sb.append(" target=").append(truncate(ctx.target(), 100));
    }

    sb.append(" latency_us=").append(ctx.elapsedMicros());

    if (!success) {
      sb.append(" status=ERROR");
      if (errorKind != null) {
        sb.append(" errorKind=").append(errorKind);
      }
    } else {
      sb.append(" status=OK");
    }

    LOG.fine(sb.toString());
  }

  /**
   * Log a failed operation.
   *
   * @param ctx the operation context
   * @param errorKind the stable error classification
   * @param errorMessage the human-readable message
   * @param clientError whether the caller's input caused the failure
   */
  public static void logError(
      InvocationContext ctx, String errorKind, String errorMessage, boolean clientError) {
    StringBuilder sb = new StringBuilder();
    sb.append("ERROR runtimeId=").append(ctx.runtimeId());
    sb.append(" invocationId=").append(ctx.invocationId());
    sb.append(" op=").append(ctx.operationName());
    if (ctx.target() != null) {
      sb.append(" target=").append(truncate(ctx.target(), 100));
    }
    sb.append(" errorKind=").append(errorKind);
    sb.append(" message=").append(truncate(errorMessage, 200));
    sb.append(" type=").append(clientError ? "CLIENT" : "RUNTIME");

    if (clientError) {
      if (LOG.isLoggable(Level.FINE)) {
        LOG.fine(sb.toString());
      }
    } else {
      LOG.warning(sb.toString());
    }
  }

  /** Log one pass through the callback entry point. */
  public static void logCallback(
      long channelToken,
      String valueType,
      long latencyMicros,
      boolean success,
      String errorMessage) {
    if (success && !LOG.isLoggable(Level.FINE)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("channelToken=").append(channelToken);
    sb.append(" valueType=").append(valueType);
    sb.append(" latency_us=").append(latencyMicros);

    if (!success) {
      sb.append(" status=ERROR");
      if (errorMessage != null) {
        sb.append(" error=").append(truncate(errorMessage, 200));
      }
      LOG.severe("CALLBACK " + sb);
    } else {
      sb.append(" status=OK");
      LOG.fine("CALLBACK " + sb);
    }
  }

  /** Log method resolution decision (only in trace mode). */
  public static void logMethodResolution(
      String className,
      String memberName,
      int candidateCount,
      String chosenMember,
      int phase,
      Class<?>[] argTypes) {
    if (!traceMode || !LOG.isLoggable(Level.FINER)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("METHOD_RESOLUTION class=").append(className);
    sb.append(" member=").append(memberName);
    sb.append(" candidates=").append(candidateCount);
    sb.append(" chosen=").append(chosenMember);
    sb.append(" phase=").append(phase);

    if (argTypes != null && argTypes.length > 0) {
      sb.append(" argTypes=[");
      for (int i = 0; i < argTypes.length; i++) {
        if (i > 0) sb.append(",");
        sb.append(argTypes[i] != null ? argTypes[i].getSimpleName() : "null");
      }
      sb.append("]");
    }

    LOG.finer(sb.toString());
  }

  public static void logRuntimeStart(long runtimeId, int classpathEntries, int javaOpts) {
    if (!LOG.isLoggable(Level.FINE)) return;
    LOG.fine(
        "RUNTIME_START runtimeId="
            + runtimeId
            + " classpathEntries="
            + classpathEntries
            + " javaOpts="
            + javaOpts);
  }

  /** Log runtime shutdown with summary. */
  public static void logRuntimeEnd(
      long runtimeId, int leakedReferences, int attachedThreads, long durationMillis) {
    if (!LOG.isLoggable(Level.FINE)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("RUNTIME_END runtimeId=").append(runtimeId);
    sb.append(" leakedReferences=").append(leakedReferences);
    sb.append(" attachedThreads=").append(attachedThreads);
    sb.append(" duration_ms=").append(durationMillis);

    LOG.fine(sb.toString());
  }

  /** Log reference table change. */
  public static void logReference(
      long runtimeId, long token, String operation, String objectType, int tableSize) {
    if (!LOG.isLoggable(Level.FINER)) return;

    StringBuilder sb = new StringBuilder();
    sb.append("REFERENCE runtimeId=").append(runtimeId);
    sb.append(" token=").append(token);
    sb.append(" op=").append(operation);
    if (objectType != null) {
      sb.append(" type=").append(objectType);
    }
    sb.append(" tableSize=").append(tableSize);

    LOG.finer(sb.toString());
  }

  public static void logAttach(
      long runtimeId, String threadName, String operation, boolean detachOnExit) {
    if (!LOG.isLoggable(Level.FINE)) return;
    LOG.fine(
        "THREAD runtimeId="
            + runtimeId
            + " thread="
            + threadName
            + " op="
            + operation
            + " detachOnExit="
            + detachOnExit);
  }

  /** Dump metrics to log (called on runtime shutdown if metrics enabled). */
  public static void dumpMetrics() {
    if (!metricsEnabled) return;
    LOG.info(Metrics.getInstance().report());
  }

  private static String truncate(String s, int maxLen) {
    if (s == null) return "";
    return s.length() <= maxLen ? s : s.substring(0, maxLen - 3) + "...";
  }
}
