package ca.gc.cra.secretscan.application.collect;

/**
 * Collector tuning parameters.
 *
 * @param concurrency worker count and job queue capacity; at least 1
 * @param threadPrefix worker thread-name prefix
 * @since 0.1.0
 */
public record CollectorSettings(int concurrency, String threadPrefix) {
  /** Default worker count. */
  public static final int DEFAULT_CONCURRENCY = 4;
  /** Upper bound accepted from configuration. */
  public static final int MAX_CONCURRENCY = 256;

  /**
   * Validates the worker count and defaults the thread prefix.
   *
   * @param concurrency requested worker count
   * @param threadPrefix requested prefix; blank selects {@code scan-worker}
   */
  public CollectorSettings {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1 (was " + concurrency + ")");
    }
    threadPrefix = threadPrefix == null || threadPrefix.isBlank() ? "scan-worker" : threadPrefix.trim();
  }

  /**
   * Creates settings with the default thread prefix.
   *
   * @param concurrency worker count
   * @return settings
   */
  public static CollectorSettings ofConcurrency(int concurrency) {
    return new CollectorSettings(concurrency, null);
  }

  /**
   * Returns the default settings.
   *
   * @return settings with {@link #DEFAULT_CONCURRENCY} workers
   */
  public static CollectorSettings defaults() {
    return ofConcurrency(DEFAULT_CONCURRENCY);
  }
}
