package ca.gc.cra.secretscan.config;

import ca.gc.cra.secretscan.application.collect.CollectorSettings;
import ca.gc.cra.secretscan.application.collect.RetryPolicy;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForMode {
  public static final String SCAN = "scan";
  public static final String PATTERNS = "patterns";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged with the common defaults.
   *
   * @param mode {@code scan} or {@code patterns}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case SCAN -> buildScanDefaults();
      case PATTERNS -> buildPatternDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("patterns", "");
    map.put("matchMode", "line");
    map.put("show", "false");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildScanDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("region", ScanConfig.DEFAULT_REGION);
    map.put("profile", ScanConfig.DEFAULT_PROFILE);
    map.put("services", ResourceType.DEFAULT_SERVICES);
    map.put("threads", Integer.toString(CollectorSettings.DEFAULT_CONCURRENCY));
    map.put("retry.maxAttempts", Integer.toString(RetryPolicy.DEFAULT_MAX_ATTEMPTS));
    map.put("retry.baseDelayMillis", Long.toString(RetryPolicy.DEFAULT_BASE_DELAY.toMillis()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return map;
  }

  private static Map<String, String> buildPatternDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("file", "");
    return map;
  }
}
