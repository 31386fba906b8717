package ca.gc.cra.secretscan.application.pipeline;

import ca.gc.cra.secretscan.application.pattern.PatternMatcher;
import ca.gc.cra.secretscan.domain.pattern.MatchMode;
import ca.gc.cra.secretscan.domain.pattern.MatchSet;
import ca.gc.cra.secretscan.domain.resource.Finding;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the matcher over every field of a {@link ResourceDetail}.
 *
 * <p>Text fields are matched as a whole. In key/value fields a matching key reports the entry's value and a
 * matching value reports the matched portions. Each field gets its own match set.</p>
 *
 * @since 0.1.0
 */
public final class FindingExtractor {
  private final PatternMatcher matcher;
  private final MatchMode mode;

  /**
   * Creates an extractor.
   *
   * @param matcher shared matcher
   * @param mode candidate generation mode
   */
  public FindingExtractor(PatternMatcher matcher, MatchMode mode) {
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.mode = Objects.requireNonNull(mode, "mode");
  }

  /**
   * Extracts findings from {@code detail}.
   *
   * @param detail fetched resource
   * @return findings in field order; empty when nothing matched
   */
  public List<Finding> extract(ResourceDetail detail) {
    Objects.requireNonNull(detail, "detail");
    List<Finding> findings = new ArrayList<>();
    for (ResourceDetail.TextField field : detail.textFields()) {
      MatchSet matches = matcher.match(field.text(), mode);
      matches.asMap().forEach((pattern, values) ->
          findings.add(new Finding(field.name(), field.name(), pattern, Finding.Kind.TEXT, values)));
    }
    for (ResourceDetail.KeyValueField field : detail.keyValueFields()) {
      for (Map.Entry<String, String> entry : field.entries().entrySet()) {
        String key = entry.getKey();
        String value = entry.getValue();
        matcher.match(key, mode).asMap().forEach((pattern, ignored) ->
            findings.add(new Finding(
                field.name(),
                "Key Matched in " + field.name() + ": " + key + " (Pattern: " + pattern + ")",
                pattern,
                Finding.Kind.KEY,
                List.of(value))));
        matcher.match(value, mode).asMap().forEach((pattern, values) ->
            findings.add(new Finding(
                field.name(),
                "Value of " + field.name() + " key: " + key + " (Pattern: " + pattern + ")",
                pattern,
                Finding.Kind.VALUE,
                values)));
      }
    }
    return findings;
  }
}
