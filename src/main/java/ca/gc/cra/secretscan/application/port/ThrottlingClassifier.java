package ca.gc.cra.secretscan.application.port;

/**
 * Decides whether a remote failure is a transient throttling signal worth retrying.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ThrottlingClassifier {
  /**
   * Classifies {@code failure}.
   *
   * @param failure failure raised by a remote call; never {@code null}
   * @return {@code true} when the call should be retried after backing off
   */
  boolean isThrottling(Throwable failure);

  /** Classifier that never retries. */
  ThrottlingClassifier NEVER = failure -> false;
}
