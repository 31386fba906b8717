package ca.gc.cra.secretscan.application.collect;

/**
 * Checked exception raised when a listing source fails; the collection of that resource type is abandoned.
 *
 * @since 0.1.0
 */
public final class EnumerationException extends Exception {
  private final int pagesFetched;

  /**
   * Creates an exception wrapping the listing failure.
   *
   * @param msg human-readable error
   * @param pagesFetched pages successfully fetched before the failure
   * @param cause listing failure
   */
  public EnumerationException(String msg, int pagesFetched, Throwable cause) {
    super(msg, cause);
    this.pagesFetched = pagesFetched;
  }

  /** Pages fetched before the failure. */
  public int pagesFetched() {
    return pagesFetched;
  }
}
