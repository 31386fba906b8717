package ca.gc.cra.secretscan.api;

import ca.gc.cra.secretscan.config.ConfigMerger;
import ca.gc.cra.secretscan.config.DefaultsForMode;
import ca.gc.cra.secretscan.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared CLI plumbing for the {@code config=} argument and the defaults/YAML/CLI merge.
 *
 * @since 0.1.0
 */
public final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} (or {@code --config}) argument.
   *
   * @param args mutable CLI map
   * @return YAML path, or {@code null} when absent
   */
  public static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Loads the YAML file (if any) and merges it with the mode defaults and CLI values.
   *
   * @param mode CLI command
   * @param configPath YAML path or {@code null}
   * @param cli CLI key/value map without the {@code config} key
   * @param log logger of the calling command; receives override warnings
   * @return effective configuration
   * @throws IllegalArgumentException when the file does not exist, the YAML is malformed or validation fails
   * @throws IOException when the file cannot be read
   */
  public static Map<String, String> effectiveConfig(
      String mode, String configPath, Map<String, String> cli, Logger log) throws IOException {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} keys from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
