package ca.gc.cra.secretscan.application.collect;

import java.time.Duration;

/**
 * Cancellable delay used between retry attempts.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BackoffSleeper {
  /**
   * Sleeps for {@code delay} unless {@code cancellation} fires first.
   *
   * @param delay requested delay
   * @param cancellation run cancellation signal
   * @return {@code true} if the full delay elapsed, {@code false} if cancelled
   * @throws InterruptedException if the sleeping thread is interrupted
   */
  boolean sleep(Duration delay, CancellationSignal cancellation) throws InterruptedException;

  /** Sleeper that waits on the cancellation signal itself. */
  BackoffSleeper CANCELLABLE = (delay, cancellation) -> !cancellation.await(delay);
}
