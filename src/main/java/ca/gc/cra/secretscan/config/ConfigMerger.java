package ca.gc.cra.secretscan.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI command
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = normalizeAliases(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = normalizeAliases(cli == null ? Map.of() : cli);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  // "service" is accepted for "services"; the plural wins when both are given.
  private static Map<String, String> normalizeAliases(Map<String, String> source) {
    Map<String, String> normalized = new LinkedHashMap<>(source);
    String alias = normalized.remove("service");
    if (alias != null && !normalized.containsKey("services")) {
      normalized.put("services", alias);
    }
    return normalized;
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (DefaultsForMode.SCAN.equalsIgnoreCase(mode)) {
      String exporter = trim(effective.get("metricsExporter"));
      String endpoint = trim(effective.get("otelEndpoint"));
      if (!endpoint.isEmpty() && exporter.equalsIgnoreCase("none")) {
        throw new IllegalArgumentException("otelEndpoint requires metricsExporter=otlp");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
