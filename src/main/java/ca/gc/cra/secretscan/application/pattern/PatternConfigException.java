package ca.gc.cra.secretscan.application.pattern;

/**
 * Checked exception thrown when a pattern source cannot be read or parsed.
 *
 * @since 0.1.0
 */
public final class PatternConfigException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public PatternConfigException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause IO or JSON parsing failure
   */
  public PatternConfigException(String msg, Throwable cause) { super(msg, cause); }
}
