package ca.gc.cra.secretscan.application.collect;

import ca.gc.cra.secretscan.application.port.MetricsPort;
import ca.gc.cra.secretscan.application.port.ThrottlingClassifier;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded exponential backoff around one remote call, retrying throttling only.
 * <p><strong>Why:</strong> AWS describe/get APIs throttle bursts from concurrent workers; backing off keeps a
 * scan progressing without hammering the endpoint.</p>
 * <p><strong>Role:</strong> Application service used by collector workers.</p>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant; every {@link #execute} call keeps its own
 * attempt counter.</p>
 * <p><strong>Observability:</strong> Increments {@code retry.throttled} per throttled attempt and
 * {@code retry.exhausted} when all attempts throttled.</p>
 *
 * @since 0.1.0
 */
public final class RetryPolicy {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

  private final int maxAttempts;
  private final Duration baseDelay;
  private final ThrottlingClassifier classifier;
  private final BackoffSleeper sleeper;
  private final MetricsPort metrics;

  /**
   * Creates a policy with the default attempt cap, one-second base delay and cancellable sleeper.
   *
   * @param classifier throttling classifier
   * @param metrics metrics sink
   */
  public RetryPolicy(ThrottlingClassifier classifier, MetricsPort metrics) {
    this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, classifier, BackoffSleeper.CANCELLABLE, metrics);
  }

  /**
   * Creates a fully configured policy.
   *
   * @param maxAttempts total attempts including the first; at least 1
   * @param baseDelay delay before the second attempt; doubles for every further attempt
   * @param classifier throttling classifier
   * @param sleeper cancellable delay
   * @param metrics metrics sink
   */
  public RetryPolicy(
      int maxAttempts,
      Duration baseDelay,
      ThrottlingClassifier classifier,
      BackoffSleeper sleeper,
      MetricsPort metrics) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs {@code operation} until it succeeds, fails with a non-throttling error or runs out of attempts.
   *
   * @param operation remote call
   * @param cancellation run cancellation; checked before every attempt and every sleep
   * @param <T> result type
   * @return operation result
   * @throws ItemFetchException when the operation failed terminally or the run was cancelled
   * @throws InterruptedException when the calling thread is interrupted
   */
  public <T> T execute(Callable<T> operation, CancellationSignal cancellation)
      throws ItemFetchException, InterruptedException {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(cancellation, "cancellation");
    Exception last = null;
    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      if (cancellation.isCancelled()) {
        throw new ItemFetchException("cancelled before attempt " + (attempt + 1), attempt, last, true);
      }
      try {
        return operation.call();
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw ie;
      } catch (Exception ex) {
        last = ex;
        if (!classifier.isThrottling(ex)) {
          throw new ItemFetchException(describe(ex), attempt + 1, ex, false);
        }
        metrics.increment("retry.throttled");
        if (attempt == maxAttempts - 1) {
          break;
        }
        Duration delay = backoff(attempt);
        log.debug("Throttled on attempt {}/{}; backing off {} ms", attempt + 1, maxAttempts, delay.toMillis());
        if (!sleeper.sleep(delay, cancellation)) {
          throw new ItemFetchException("cancelled during backoff", attempt + 1, ex, true);
        }
      }
    }
    metrics.increment("retry.exhausted");
    throw new ItemFetchException("throttled on all " + maxAttempts + " attempts", maxAttempts, last, false);
  }

  /**
   * Returns the delay slept after the zero-based {@code attempt}: {@code baseDelay * 2^attempt}.
   *
   * @param attempt zero-based attempt index
   * @return backoff delay
   */
  public Duration backoff(int attempt) {
    return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return ex.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }
}
