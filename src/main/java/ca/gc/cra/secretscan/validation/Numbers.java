package ca.gc.cra.secretscan.validation;

/**
 * Numeric validation helpers for CLI and configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is not an integer or is out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String text = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + raw + ")", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
