package ca.gc.cra.secretscan.application.collect;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> One-shot cancellation flag with an optional deadline and interruptible waits.
 * <p><strong>Why:</strong> Lets the feeder, workers and retry backoff observe an abort or deadline without
 * relying on thread interruption alone.</p>
 * <p><strong>Role:</strong> Passed from the CLI down to the collector and the retry policy; collectors derive a
 * {@link #child()} per run so an enumeration failure can stop that run's workers without cancelling the
 * caller.</p>
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private static final long NO_DEADLINE = Long.MAX_VALUE;

  private final CountDownLatch latch = new CountDownLatch(1);
  private final AtomicReference<String> reason = new AtomicReference<>();
  private final List<CancellationSignal> children = new CopyOnWriteArrayList<>();
  private final long deadlineNanos;

  private CancellationSignal(long deadlineNanos) {
    this.deadlineNanos = deadlineNanos;
  }

  /**
   * Creates a signal without deadline.
   *
   * @return new signal
   */
  public static CancellationSignal create() {
    return new CancellationSignal(NO_DEADLINE);
  }

  /**
   * Creates a signal that cancels itself once {@code timeout} has elapsed.
   *
   * @param timeout positive time budget
   * @return new signal
   */
  public static CancellationSignal withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    return new CancellationSignal(System.nanoTime() + timeout.toNanos());
  }

  /**
   * Creates a signal that is cancelled whenever this one is, but can also be cancelled on its own.
   *
   * @return child signal sharing this signal's deadline
   */
  public CancellationSignal child() {
    CancellationSignal child = new CancellationSignal(deadlineNanos);
    children.add(child);
    if (latch.getCount() == 0) {
      child.cancel(reason.get());
    }
    return child;
  }

  /**
   * Cancels this signal and its children. Only the first reason is kept.
   *
   * @param why human-readable reason for logs
   */
  public void cancel(String why) {
    reason.compareAndSet(null, why == null ? "cancelled" : why);
    latch.countDown();
    for (CancellationSignal child : children) {
      if (!child.isCancelled()) {
        child.cancel(reason.get());
      }
    }
  }

  /**
   * Reports whether the signal was cancelled or its deadline passed.
   *
   * @return {@code true} once cancelled
   */
  public boolean isCancelled() {
    if (latch.getCount() == 0) {
      return true;
    }
    if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
      cancel("deadline exceeded");
      return true;
    }
    return false;
  }

  /**
   * Returns the first cancellation reason.
   *
   * @return reason, empty while not cancelled
   */
  public Optional<String> reason() {
    return Optional.ofNullable(reason.get());
  }

  /**
   * Waits up to {@code timeout} for cancellation.
   *
   * @param timeout maximum wait
   * @return {@code true} if the signal was cancelled before the wait completed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    if (isCancelled()) {
      return true;
    }
    long waitNanos = Math.max(0L, timeout.toNanos());
    if (deadlineNanos != NO_DEADLINE) {
      waitNanos = Math.min(waitNanos, Math.max(0L, deadlineNanos - System.nanoTime()));
    }
    latch.await(waitNanos, TimeUnit.NANOSECONDS);
    return isCancelled();
  }
}
