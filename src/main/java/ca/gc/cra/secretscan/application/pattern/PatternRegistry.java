package ca.gc.cra.secretscan.application.pattern;

import ca.gc.cra.secretscan.domain.pattern.PasswordPolicy;
import ca.gc.cra.secretscan.domain.pattern.PatternEntry;
import ca.gc.cra.secretscan.domain.pattern.PatternSet;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads a flat JSON pattern file and compiles it into an immutable {@link PatternSet}.
 * <p><strong>Why:</strong> Centralizes per-pattern fallback and exclusion rules so the matcher only sees typed
 * entries.</p>
 * <p><strong>Role:</strong> Application service invoked once during CLI bootstrap.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse {@code {"name": "expression"}} documents with jackson-core streaming.</li>
 *   <li>Compile each expression; drop invalid ones with a warning, except the reserved password pattern
 *   which falls back to {@link PasswordPolicy#FALLBACK_EXPRESSION}.</li>
 *   <li>Attach the built-in and configured exclusion lists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are immutable after construction; loads may run concurrently.</p>
 * <p><strong>Observability:</strong> Logs one WARN per dropped or substituted pattern and an INFO summary.</p>
 *
 * @since 0.1.0
 */
public final class PatternRegistry {
  private static final Logger log = LoggerFactory.getLogger(PatternRegistry.class);

  /** Classpath location of the bundled pattern file. */
  public static final String DEFAULT_RESOURCE = "/patterns/default-patterns.json";
  /** Exclusions applied regardless of configuration. */
  public static final Map<String, List<String>> DEFAULT_EXCLUSIONS =
      Map.of("AWS_Client", List.of("iam:PassRole", "S3Key"));

  private final JsonFactory factory = new JsonFactory();
  private final Map<String, List<String>> exclusions;

  /** Creates a registry using only {@link #DEFAULT_EXCLUSIONS}. */
  public PatternRegistry() {
    this(Map.of());
  }

  /**
   * Creates a registry that appends {@code extraExclusions} to the built-in exclusions.
   *
   * @param extraExclusions additional disqualifying substrings keyed by pattern name
   */
  public PatternRegistry(Map<String, List<String>> extraExclusions) {
    Objects.requireNonNull(extraExclusions, "extraExclusions");
    Map<String, List<String>> merged = new LinkedHashMap<>();
    DEFAULT_EXCLUSIONS.forEach((name, values) -> merged.put(name, new ArrayList<>(values)));
    extraExclusions.forEach((name, values) -> {
      List<String> target = merged.computeIfAbsent(name, key -> new ArrayList<>());
      for (String value : values) {
        if (value != null && !value.isBlank() && !target.contains(value.trim())) {
          target.add(value.trim());
        }
      }
    });
    Map<String, List<String>> frozen = new LinkedHashMap<>();
    merged.forEach((name, values) -> frozen.put(name, List.copyOf(values)));
    this.exclusions = Map.copyOf(frozen);
  }

  /**
   * Loads patterns from a JSON file.
   *
   * @param path pattern file
   * @return compiled pattern set
   * @throws PatternConfigException when the file is missing, unreadable or not a flat JSON object of strings
   */
  public PatternSet load(Path path) throws PatternConfigException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new PatternConfigException("Pattern file not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return load(in, path.toString());
    } catch (IOException ex) {
      throw new PatternConfigException("Failed to read pattern file " + path, ex);
    }
  }

  /**
   * Loads the pattern file bundled on the classpath.
   *
   * @return compiled pattern set
   * @throws PatternConfigException when the resource is missing or invalid
   */
  public PatternSet loadDefault() throws PatternConfigException {
    try (InputStream in = PatternRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new PatternConfigException("Bundled pattern resource missing: " + DEFAULT_RESOURCE);
      }
      return load(in, "classpath:" + DEFAULT_RESOURCE);
    } catch (IOException ex) {
      throw new PatternConfigException("Failed to read bundled patterns", ex);
    }
  }

  /**
   * Loads patterns from an open stream; the caller owns and closes the stream.
   *
   * <p>A name that appears twice in the document is rejected rather than resolved to its last value, so a
   * copy-paste slip cannot silently replace an earlier expression.</p>
   *
   * @param in JSON document
   * @param sourceName name used in diagnostics
   * @return compiled pattern set
   * @throws PatternConfigException when the document is not a flat JSON object of strings or repeats a name
   */
  public PatternSet load(InputStream in, String sourceName) throws PatternConfigException {
    Objects.requireNonNull(in, "in");
    return compile(parse(in, sourceName));
  }

  /**
   * Compiles already-parsed expressions.
   *
   * @param expressions pattern expressions keyed by name, in registration order
   * @return compiled pattern set; empty when nothing compiled
   */
  public PatternSet compile(Map<String, String> expressions) {
    Objects.requireNonNull(expressions, "expressions");
    List<PatternEntry> entries = new ArrayList<>(expressions.size());
    int dropped = 0;
    for (Map.Entry<String, String> expression : expressions.entrySet()) {
      PatternEntry entry = compileEntry(expression.getKey(), expression.getValue());
      if (entry == null) {
        dropped++;
      } else {
        entries.add(entry);
      }
    }
    log.info("Compiled {} patterns ({} dropped)", entries.size(), dropped);
    return PatternSet.of(entries);
  }

  /**
   * Returns the effective exclusions keyed by pattern name.
   *
   * @return immutable exclusion mapping
   */
  public Map<String, List<String>> exclusions() {
    return exclusions;
  }

  private PatternEntry compileEntry(String name, String expression) {
    boolean password = PasswordPolicy.RESERVED_NAME.equals(name);
    List<String> excluded = exclusions.getOrDefault(name, List.of());
    try {
      return new PatternEntry(name, Pattern.compile(expression), excluded, password, false);
    } catch (PatternSyntaxException ex) {
      if (password) {
        log.warn("Using fallback expression for '{}': {}", name, ex.getDescription());
        return new PatternEntry(
            name, Pattern.compile(PasswordPolicy.FALLBACK_EXPRESSION), excluded, true, true);
      }
      log.warn("Dropping invalid pattern '{}': {}", name, ex.getDescription());
      return null;
    }
  }

  private Map<String, String> parse(InputStream in, String sourceName) throws PatternConfigException {
    Map<String, String> expressions = new LinkedHashMap<>();
    try (JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new PatternConfigException(
            "Pattern source " + sourceName + " must be a JSON object of name to expression");
      }
      while (true) {
        token = parser.nextToken();
        if (token == JsonToken.END_OBJECT) {
          break;
        }
        if (token != JsonToken.FIELD_NAME) {
          throw new PatternConfigException("Malformed pattern source " + sourceName);
        }
        String name = parser.getCurrentName();
        JsonToken valueToken = parser.nextToken();
        if (valueToken != JsonToken.VALUE_STRING) {
          throw new PatternConfigException(
              "Pattern '" + name + "' in " + sourceName + " must map to a string expression");
        }
        if (name == null || name.isBlank()) {
          throw new PatternConfigException("Pattern source " + sourceName + " contains a blank name");
        }
        if (expressions.putIfAbsent(name, parser.getText()) != null) {
          throw new PatternConfigException(
              "Pattern source " + sourceName + " defines '" + name + "' more than once");
        }
      }
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new PatternConfigException("Pattern source " + sourceName + " contains trailing content");
      }
    } catch (IOException ex) {
      throw new PatternConfigException("Invalid JSON in pattern source " + sourceName, ex);
    }
    return expressions;
  }
}
