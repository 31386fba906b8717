package ca.gc.cra.secretscan.application.collect;

/**
 * Checked exception raised when a single detail fetch gives up.
 *
 * @since 0.1.0
 */
public final class ItemFetchException extends Exception {
  private final int attempts;
  private final boolean cancelled;

  /**
   * Creates an exception for a failed or abandoned operation.
   *
   * @param msg human-readable error
   * @param attempts attempts performed before giving up
   * @param cause last failure; may be {@code null} when cancelled before the first attempt
   * @param cancelled whether the run was cancelled rather than the operation failing
   */
  public ItemFetchException(String msg, int attempts, Throwable cause, boolean cancelled) {
    super(msg, cause);
    this.attempts = attempts;
    this.cancelled = cancelled;
  }

  /** Number of attempts performed. */
  public int attempts() {
    return attempts;
  }

  /** Whether the operation stopped because the run was cancelled. */
  public boolean cancelled() {
    return cancelled;
  }
}
