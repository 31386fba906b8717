package ca.gc.cra.secretscan.application.pattern;

import ca.gc.cra.secretscan.domain.pattern.MatchMode;
import ca.gc.cra.secretscan.domain.pattern.MatchSet;
import ca.gc.cra.secretscan.domain.pattern.PasswordPolicy;
import ca.gc.cra.secretscan.domain.pattern.PatternEntry;
import ca.gc.cra.secretscan.domain.pattern.PatternSet;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Applies a {@link PatternSet} to a text blob under a {@link MatchMode}.
 * <p><strong>Role:</strong> Application service used by the finding extractor and the {@code patterns}
 * tool.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Generate candidates per entry (whole matches or whole lines).</li>
 *   <li>Validate password candidates line by line with {@link PasswordPolicy}.</li>
 *   <li>Drop candidates containing an exclusion substring of their entry.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable pattern set; a single instance is
 * shared by all threads.</p>
 * <p><strong>Performance:</strong> Lines are split once per call and reused across entries.</p>
 *
 * @since 0.1.0
 */
public final class PatternMatcher {
  private static final Pattern LINE_BREAK = Pattern.compile("\\R");

  private final PatternSet patterns;

  /**
   * Creates a matcher over {@code patterns}.
   *
   * @param patterns compiled pattern set
   */
  public PatternMatcher(PatternSet patterns) {
    this.patterns = Objects.requireNonNull(patterns, "patterns");
  }

  /**
   * Returns the pattern set this matcher applies.
   *
   * @return pattern set
   */
  public PatternSet patterns() {
    return patterns;
  }

  /**
   * Matches {@code text} against every registered pattern.
   *
   * @param text text to scan; {@code null} or empty yields an empty result
   * @param mode candidate generation mode
   * @return matches grouped by pattern name, omitting patterns without surviving candidates
   */
  public MatchSet match(String text, MatchMode mode) {
    Objects.requireNonNull(mode, "mode");
    if (text == null || text.isEmpty() || patterns.isEmpty()) {
      return MatchSet.empty();
    }
    String[] lines = null;
    MatchSet.Builder result = MatchSet.builder();
    for (PatternEntry entry : patterns.entries()) {
      if (entry.passwordPolicy() || mode == MatchMode.LINE) {
        if (lines == null) {
          lines = LINE_BREAK.split(text, -1);
        }
        matchLines(entry, lines, result);
      } else {
        matchOccurrences(entry, text, result);
      }
    }
    return result.build();
  }

  private static void matchLines(PatternEntry entry, String[] lines, MatchSet.Builder result) {
    for (String line : lines) {
      if (line.isEmpty() || !entry.pattern().matcher(line).find()) {
        continue;
      }
      if (entry.passwordPolicy() && !PasswordPolicy.isStrong(line)) {
        continue;
      }
      if (!entry.isExcluded(line)) {
        result.add(entry.name(), line);
      }
    }
  }

  private static void matchOccurrences(PatternEntry entry, String text, MatchSet.Builder result) {
    Matcher matcher = entry.pattern().matcher(text);
    while (matcher.find()) {
      String candidate = matcher.group();
      if (candidate.isEmpty() || entry.isExcluded(candidate)) {
        continue;
      }
      result.add(entry.name(), candidate);
    }
  }
}
