package ca.gc.cra.secretscan.application.pattern;

/**
 * Masks and truncates matched values before display.
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Redactor {
  /** Leading characters left visible by {@link #redact(String)}. */
  public static final int VISIBLE_PREFIX = 4;
  /** Fixed-width mask appended after the visible prefix. */
  public static final String MASK = "******";
  /** Longest string emitted by {@link #truncateForDisplay(String)}. */
  public static final int MAX_DISPLAY_LENGTH = 150;
  private static final String ELLIPSIS = "...";

  private Redactor() {
    // Utility
  }

  /**
   * Obscures {@code text}: up to four characters become asterisks, longer values keep their first four
   * characters followed by six asterisks.
   *
   * @param text value to mask; {@code null} is treated as empty
   * @return masked value
   */
  public static String redact(String text) {
    if (text == null) {
      return "";
    }
    if (text.length() <= VISIBLE_PREFIX) {
      return "*".repeat(text.length());
    }
    return text.substring(0, VISIBLE_PREFIX) + MASK;
  }

  /**
   * Cuts {@code text} to at most 150 characters, ending in {@code ...} when shortened, then strips
   * surrounding whitespace.
   *
   * @param text value to display; {@code null} is treated as empty
   * @return display-safe value
   */
  public static String truncateForDisplay(String text) {
    if (text == null) {
      return "";
    }
    String shown = text;
    if (shown.length() > MAX_DISPLAY_LENGTH) {
      shown = shown.substring(0, MAX_DISPLAY_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
    }
    return shown.strip();
  }

  /**
   * Renders a matched value for output.
   *
   * @param text matched value
   * @param show {@code true} to show the value verbatim, {@code false} to redact it
   * @return truncated, optionally redacted value
   */
  public static String display(String text, boolean show) {
    return truncateForDisplay(show ? text : redact(text));
  }
}
