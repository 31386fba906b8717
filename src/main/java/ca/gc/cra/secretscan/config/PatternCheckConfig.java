package ca.gc.cra.secretscan.config;

import ca.gc.cra.secretscan.domain.pattern.MatchMode;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the offline {@code patterns} command.
 *
 * @param patternsFile pattern JSON file; empty selects the bundled patterns
 * @param sampleFile local file to scan; empty only lists the patterns
 * @param matchMode matching strategy for the sample
 * @param show whether matched values are printed unredacted
 * @param exclusions extra exclusion substrings keyed by pattern name
 * @since 0.1.0
 */
public record PatternCheckConfig(
    Optional<Path> patternsFile,
    Optional<Path> sampleFile,
    MatchMode matchMode,
    boolean show,
    Map<String, List<String>> exclusions) {

  public PatternCheckConfig {
    patternsFile = Objects.requireNonNullElse(patternsFile, Optional.empty());
    sampleFile = Objects.requireNonNullElse(sampleFile, Optional.empty());
    Objects.requireNonNull(matchMode, "matchMode");
    exclusions = exclusions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(exclusions));
  }

  /**
   * Builds the configuration from a flat key/value map.
   *
   * @param values merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static PatternCheckConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new PatternCheckConfig(
        ScanConfig.optionalPath(values.get("patterns")),
        ScanConfig.optionalPath(values.get("file")),
        MatchMode.fromString(values.get("matchMode")),
        ScanConfig.parseBoolean("show", values.get("show")),
        ScanConfig.parseExclusions(values));
  }
}
