package ca.gc.cra.secretscan.domain.pattern;

/**
 * Character-class rules applied on top of the password pattern's base expression.
 *
 * @since 0.1.0
 */
public final class PasswordPolicy {
  /** Reserved pattern name that carries the compound validator. */
  public static final String RESERVED_NAME = "Password Pattern";
  /** Expression substituted when the configured password expression fails to compile. */
  public static final String FALLBACK_EXPRESSION = "^[A-Za-z\\d]{8,}$";
  /** Characters accepted as the required special character. */
  public static final String SPECIAL_CHARACTERS = "!@#$%^&*";

  private PasswordPolicy() {
    // Utility
  }

  /**
   * Checks that {@code candidate} holds at least one ASCII uppercase letter, lowercase letter, digit and
   * special character.
   *
   * @param candidate text to inspect; {@code null} is never strong
   * @return {@code true} when every character class is present
   */
  public static boolean isStrong(CharSequence candidate) {
    if (candidate == null) {
      return false;
    }
    boolean upper = false;
    boolean lower = false;
    boolean digit = false;
    boolean special = false;
    for (int i = 0; i < candidate.length(); i++) {
      char c = candidate.charAt(i);
      if (c >= 'A' && c <= 'Z') {
        upper = true;
      } else if (c >= 'a' && c <= 'z') {
        lower = true;
      } else if (c >= '0' && c <= '9') {
        digit = true;
      } else if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
        special = true;
      }
    }
    return upper && lower && digit && special;
  }
}
