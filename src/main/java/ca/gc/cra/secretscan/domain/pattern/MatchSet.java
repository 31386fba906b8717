package ca.gc.cra.secretscan.domain.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches grouped by pattern name for a single scanned text.
 *
 * <p>Names never map to an empty list; patterns without surviving candidates are absent.</p>
 *
 * @since 0.1.0
 */
public final class MatchSet {
  private static final MatchSet EMPTY = new MatchSet(Map.of());

  private final Map<String, List<String>> matches;

  private MatchSet(Map<String, List<String>> matches) {
    this.matches = matches;
  }

  /**
   * Returns the shared empty result.
   *
   * @return empty match set
   */
  public static MatchSet empty() {
    return EMPTY;
  }

  /**
   * Returns a builder that collects candidates in discovery order.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the matches keyed by pattern name in registry order.
   *
   * @return unmodifiable map of non-empty lists
   */
  public Map<String, List<String>> asMap() {
    return matches;
  }

  /**
   * Returns the matches recorded for {@code patternName}.
   *
   * @param patternName pattern name
   * @return matches in discovery order, empty when the pattern produced none
   */
  public List<String> get(String patternName) {
    return matches.getOrDefault(patternName, List.of());
  }

  public boolean isEmpty() {
    return matches.isEmpty();
  }

  /**
   * Returns the total number of matched candidates across all patterns.
   *
   * @return candidate count
   */
  public int totalMatches() {
    int total = 0;
    for (List<String> values : matches.values()) {
      total += values.size();
    }
    return total;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MatchSet that && matches.equals(that.matches);
  }

  @Override
  public int hashCode() {
    return matches.hashCode();
  }

  @Override
  public String toString() {
    return "MatchSet" + matches;
  }

  /** Mutable accumulator; not thread-safe. */
  public static final class Builder {
    private final Map<String, List<String>> matches = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Appends a candidate for {@code patternName}.
     *
     * @param patternName pattern name
     * @param candidate surviving candidate
     * @return this builder
     */
    public Builder add(String patternName, String candidate) {
      Objects.requireNonNull(patternName, "patternName");
      Objects.requireNonNull(candidate, "candidate");
      matches.computeIfAbsent(patternName, key -> new ArrayList<>()).add(candidate);
      return this;
    }

    /**
     * Freezes the collected matches.
     *
     * @return immutable match set
     */
    public MatchSet build() {
      if (matches.isEmpty()) {
        return EMPTY;
      }
      Map<String, List<String>> frozen = new LinkedHashMap<>();
      matches.forEach((name, values) -> frozen.put(name, List.copyOf(values)));
      return new MatchSet(Collections.unmodifiableMap(frozen));
    }
  }
}
