package ca.gc.cra.secretscan.domain.pattern;

import java.util.Locale;

/**
 * Strategy used to turn pattern hits into reported candidates.
 *
 * @since 0.1.0
 */
public enum MatchMode {
  /** Every non-overlapping occurrence anywhere in the text; the candidate is the matched substring. */
  ALL_SUBMATCHES,
  /** Text is split into lines; a line containing a hit is reported whole. */
  LINE;

  /**
   * Parses a mode selector.
   *
   * <p>Accepts {@code all}, {@code all-submatches}, {@code allsubmatches}, {@code findallstringsubmatch},
   * {@code findallstring}, {@code line} and {@code matchstring}, ignoring case. Blank selects
   * {@link #LINE}.</p>
   *
   * @param raw configured value; may be {@code null}
   * @return parsed mode
   * @throws IllegalArgumentException when the value is not recognised
   */
  public static MatchMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return LINE;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return switch (normalized) {
      case "all", "all-submatches", "allsubmatches", "findallstringsubmatch", "findallstring" ->
          ALL_SUBMATCHES;
      case "line", "lines", "matchstring" -> LINE;
      default -> throw new IllegalArgumentException(
          "matchMode must be 'line' or 'all-submatches' (was '" + raw + "')");
    };
  }
}
