package ca.gc.cra.secretscan.config;

import ca.gc.cra.secretscan.application.collect.CollectorSettings;
import ca.gc.cra.secretscan.application.collect.RetryPolicy;
import ca.gc.cra.secretscan.domain.pattern.MatchMode;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import ca.gc.cra.secretscan.validation.Numbers;
import ca.gc.cra.secretscan.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings of a {@code scan} run.
 * <p><strong>Why:</strong> Validates every key once, before any AWS client is created.</p>
 * <p><strong>Role:</strong> Produced by {@link #fromMap(Map)} from the merged CLI/YAML/defaults map.</p>
 *
 * @param region AWS region id
 * @param profile shared-credentials profile; blank means the default provider chain
 * @param patternsFile pattern JSON file; empty selects the bundled patterns
 * @param resourceTypes resource types to scan, in scan order
 * @param threads detail-fetch workers per resource type
 * @param matchMode matching strategy
 * @param show whether matched values are printed unredacted
 * @param exclusions extra exclusion substrings keyed by pattern name
 * @param retryMaxAttempts attempts per remote call, including the first
 * @param retryBaseDelay delay before the second attempt
 * @since 0.1.0
 */
public record ScanConfig(
    String region,
    String profile,
    Optional<Path> patternsFile,
    List<ResourceType> resourceTypes,
    int threads,
    MatchMode matchMode,
    boolean show,
    Map<String, List<String>> exclusions,
    int retryMaxAttempts,
    Duration retryBaseDelay) {

  public static final String DEFAULT_REGION = "us-east-1";
  public static final String DEFAULT_PROFILE = "default";
  static final String EXCLUSION_PREFIX = "exclusions.";
  static final int MAX_RETRY_ATTEMPTS = 10;
  static final long MAX_RETRY_BASE_DELAY_MILLIS = 60_000L;

  public ScanConfig {
    Objects.requireNonNull(region, "region");
    profile = profile == null ? "" : profile;
    patternsFile = Objects.requireNonNullElse(patternsFile, Optional.empty());
    resourceTypes = List.copyOf(Objects.requireNonNull(resourceTypes, "resourceTypes"));
    Objects.requireNonNull(matchMode, "matchMode");
    exclusions = exclusions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(exclusions));
    Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
  }

  /** @return defaults for every key */
  public static ScanConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap(DefaultsForMode.SCAN));
  }

  /**
   * Builds a configuration from a flat key/value map. Missing keys take their defaults.
   *
   * @param values merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ScanConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    String region = Strings.requireRegion("region", valueOr(values, "region", DEFAULT_REGION));
    String profile = valueOr(values, "profile", DEFAULT_PROFILE);
    if (!profile.isEmpty()) {
      profile = Strings.requirePrintableAscii("profile", profile, 128);
    }
    Optional<Path> patterns = optionalPath(values.get("patterns"));
    String services = valueOr(values, "services", valueOr(values, "service", ResourceType.DEFAULT_SERVICES));
    List<ResourceType> types = ResourceType.forServices(services);
    int threads = Numbers.parseIntInRange("threads",
        valueOr(values, "threads", Integer.toString(CollectorSettings.DEFAULT_CONCURRENCY)),
        1, CollectorSettings.MAX_CONCURRENCY);
    MatchMode mode = MatchMode.fromString(values.get("matchMode"));
    boolean show = parseBoolean("show", values.get("show"));
    int maxAttempts = Numbers.parseIntInRange("retry.maxAttempts",
        valueOr(values, "retry.maxAttempts", Integer.toString(RetryPolicy.DEFAULT_MAX_ATTEMPTS)),
        1, MAX_RETRY_ATTEMPTS);
    long baseDelayMillis = Numbers.requireRange("retry.baseDelayMillis",
        parseLong("retry.baseDelayMillis",
            valueOr(values, "retry.baseDelayMillis", Long.toString(RetryPolicy.DEFAULT_BASE_DELAY.toMillis()))),
        0, MAX_RETRY_BASE_DELAY_MILLIS);
    return new ScanConfig(
        region,
        profile,
        patterns,
        types,
        threads,
        mode,
        show,
        parseExclusions(values),
        maxAttempts,
        Duration.ofMillis(baseDelayMillis));
  }

  /**
   * Collects {@code exclusions.<Pattern>=a,b} entries.
   *
   * @param values flat configuration
   * @return exclusion substrings keyed by pattern name, in key order
   */
  public static Map<String, List<String>> parseExclusions(Map<String, String> values) {
    Map<String, List<String>> exclusions = new LinkedHashMap<>();
    values.forEach((key, value) -> {
      if (key != null && key.startsWith(EXCLUSION_PREFIX)) {
        String pattern = key.substring(EXCLUSION_PREFIX.length()).trim();
        if (pattern.isEmpty()) {
          throw new IllegalArgumentException("exclusions key must name a pattern: " + key);
        }
        List<String> items = Strings.splitCsv(value);
        if (!items.isEmpty()) {
          exclusions.put(pattern, List.copyOf(items));
        }
      }
    });
    return exclusions;
  }

  static String valueOr(Map<String, String> values, String key, String defaultValue) {
    String value = values.get(key);
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  static Optional<Path> optionalPath(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(Strings.requireNonBlank("path", raw)));
  }

  static boolean parseBoolean(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }

  private static long parseLong(String key, String raw) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }
}
