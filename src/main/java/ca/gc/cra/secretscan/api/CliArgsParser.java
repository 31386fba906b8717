package ca.gc.cra.secretscan.api;

import ca.gc.cra.secretscan.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses {@code key=value} CLI arguments into an ordered map.
 *
 * <p>Keys are limited to {@code [A-Za-z0-9._-]} so they line up with flattened YAML keys such as
 * {@code retry.maxAttempts} or {@code exclusions.AWS_Client}. Values may contain {@code =}.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments to a mutable map; later duplicates win.
   *
   * @param args {@code key=value} arguments
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!value.isEmpty()) {
        value = Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
