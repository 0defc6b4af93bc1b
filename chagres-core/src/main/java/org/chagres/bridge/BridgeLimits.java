package org.chagres.bridge;

/**
 * Resource limits that keep a buggy host from exhausting the managed runtime.
 *
 * <p>Defaults come from system properties, read once at class initialization:
 *
 * <ul>
 *   <li>chagres.limits.max_references - Max live references per runtime (default: 1,000,000)
 *   <li>chagres.limits.max_string_length - Max host string length in chars (default: 10M)
 *   <li>chagres.limits.max_array_length - Max elements in a marshaled array (default: 1,000,000)
 *   <li>chagres.limits.max_attached_threads - Max attached threads per runtime (default: 10,000)
 * </ul>
 *
 * <p>A runtime can be given its own limits through {@link BridgeRuntimeBuilder#limits}.
 */
public final class BridgeLimits {

  // ========== DEFAULTS ==========

  public static final int DEFAULT_MAX_REFERENCES =
      Integer.getInteger("chagres.limits.max_references", 1_000_000);

  public static final int DEFAULT_MAX_STRING_LENGTH =
      Integer.getInteger("chagres.limits.max_string_length", 10 * 1024 * 1024);

  public static final int DEFAULT_MAX_ARRAY_LENGTH =
      Integer.getInteger("chagres.limits.max_array_length", 1_000_000);

  public static final int DEFAULT_MAX_ATTACHED_THREADS =
      Integer.getInteger("chagres.limits.max_attached_threads", 10_000);

  private static final BridgeLimits DEFAULTS =
      new BridgeLimits(
          DEFAULT_MAX_REFERENCES,
          DEFAULT_MAX_STRING_LENGTH,
          DEFAULT_MAX_ARRAY_LENGTH,
          DEFAULT_MAX_ATTACHED_THREADS);

  private final int maxReferences;
  private final int maxStringLength;
  private final int maxArrayLength;
  private final int maxAttachedThreads;

  private BridgeLimits(
      int maxReferences, int maxStringLength, int maxArrayLength, int maxAttachedThreads) {
    this.maxReferences = requirePositive("maxReferences", maxReferences);
    this.maxStringLength = requirePositive("maxStringLength", maxStringLength);
    this.maxArrayLength = requirePositive("maxArrayLength", maxArrayLength);
    this.maxAttachedThreads = requirePositive("maxAttachedThreads", maxAttachedThreads);
  }

  public static BridgeLimits defaults() {
    return DEFAULTS;
  }

  public BridgeLimits withMaxReferences(int max) {
    return new BridgeLimits(max, maxStringLength, maxArrayLength, maxAttachedThreads);
  }

  public BridgeLimits withMaxStringLength(int max) {
    return new BridgeLimits(maxReferences, max, maxArrayLength, maxAttachedThreads);
  }

  public BridgeLimits withMaxArrayLength(int max) {
    return new BridgeLimits(maxReferences, maxStringLength, max, maxAttachedThreads);
  }

  public BridgeLimits withMaxAttachedThreads(int max) {
    return new BridgeLimits(maxReferences, maxStringLength, maxArrayLength, max);
  }

  public int maxReferences() {
    return maxReferences;
  }

  public int maxStringLength() {
    return maxStringLength;
  }

  public int maxArrayLength() {
    return maxArrayLength;
  }

  public int maxAttachedThreads() {
    return maxAttachedThreads;
  }

  // ========== VALIDATION METHODS ==========

  void checkReferenceLimit(int currentCount) throws BridgeException {
    if (currentCount >= maxReferences) {
      throw new BridgeException(
          ErrorKind.RESOURCE_LIMIT,
          String.format(
              "Reference limit exceeded: runtime holds %d references (max: %d). "
                  + "Release unused handles or increase chagres.limits.max_references.",
              currentCount, maxReferences));
    }
  }

  void checkStringLength(String s) throws BridgeException {
    if (s != null && s.length() > maxStringLength) {
      throw new BridgeException(
          ErrorKind.RESOURCE_LIMIT,
          String.format(
              "String too long: %d chars (max: %d). "
                  + "Increase chagres.limits.max_string_length if needed.",
              s.length(), maxStringLength));
    }
  }

  void checkArrayLength(int length) throws BridgeException {
    if (length > maxArrayLength) {
      throw new BridgeException(
          ErrorKind.RESOURCE_LIMIT,
          String.format(
              "Array too large: %d elements (max: %d). "
                  + "Increase chagres.limits.max_array_length if needed.",
              length, maxArrayLength));
    }
  }

  void checkAttachedThreads(int currentCount) throws BridgeException {
    if (currentCount >= maxAttachedThreads) {
      throw new BridgeException(
          ErrorKind.ATTACH_FAILED,
          String.format(
              "Cannot attach thread: %d threads already attached (max: %d). "
                  + "Increase chagres.limits.max_attached_threads if needed.",
              currentCount, maxAttachedThreads));
    }
  }

  /** Summary of the limits for logging. */
  public String getSummary() {
    return String.format(
        "BridgeLimits: max_references=%d, max_string=%d, max_array=%d, max_attached_threads=%d",
        maxReferences, maxStringLength, maxArrayLength, maxAttachedThreads);
  }

  private static int requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
    return value;
  }
}
