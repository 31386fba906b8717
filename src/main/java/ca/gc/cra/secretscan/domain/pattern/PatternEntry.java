package ca.gc.cra.secretscan.domain.pattern;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiled pattern registered under a unique name.
 *
 * <p>{@code passwordPolicy} marks the single entry whose candidates must also pass
 * {@link PasswordPolicy#isStrong(CharSequence)}; such entries are always evaluated line by line.</p>
 *
 * @param name unique pattern name as it appears in the pattern file
 * @param pattern compiled expression
 * @param exclusions substrings that void a candidate when present
 * @param passwordPolicy whether the compound password validator applies
 * @param fallback whether {@code pattern} is the built-in fallback rather than the configured expression
 * @since 0.1.0
 */
public record PatternEntry(
    String name, Pattern pattern, List<String> exclusions, boolean passwordPolicy, boolean fallback) {

  /**
   * Validates the entry and freezes the exclusion list.
   *
   * @param name unique pattern name
   * @param pattern compiled expression
   * @param exclusions disqualifying substrings; {@code null} means none
   * @param passwordPolicy whether the compound password validator applies
   * @param fallback whether the built-in fallback expression is in use
   */
  public PatternEntry {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(pattern, "pattern");
    if (name.isBlank()) {
      throw new IllegalArgumentException("pattern name must not be blank");
    }
    exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
  }

  /**
   * Creates a plain entry without password validation.
   *
   * @param name pattern name
   * @param pattern compiled expression
   * @param exclusions disqualifying substrings
   * @return new entry
   */
  public static PatternEntry of(String name, Pattern pattern, List<String> exclusions) {
    return new PatternEntry(name, pattern, exclusions, false, false);
  }

  /**
   * Returns {@code true} when {@code candidate} contains any exclusion substring.
   *
   * @param candidate matched text
   * @return whether the candidate must be dropped
   */
  public boolean isExcluded(String candidate) {
    for (String exclusion : exclusions) {
      if (!exclusion.isEmpty() && candidate.contains(exclusion)) {
        return true;
      }
    }
    return false;
  }
}
