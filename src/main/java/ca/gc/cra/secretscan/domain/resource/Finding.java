package ca.gc.cra.secretscan.domain.resource;

import java.util.List;
import java.util.Objects;

/**
 * Pattern hits found in one field of a resource.
 *
 * @param field field the hits came from
 * @param heading report heading; for key/value fields it names the key and the pattern
 * @param patternName pattern that produced the hits
 * @param kind where in the field the pattern matched
 * @param values matched values in discovery order; never empty
 * @since 0.1.0
 */
public record Finding(String field, String heading, String patternName, Kind kind, List<String> values) {
  public Finding {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(heading, "heading");
    Objects.requireNonNull(patternName, "patternName");
    Objects.requireNonNull(kind, "kind");
    values = List.copyOf(values);
    if (values.isEmpty()) {
      throw new IllegalArgumentException("finding requires at least one value");
    }
  }

  /** Location of a hit. */
  public enum Kind {
    /** Hit inside a free-text field. */
    TEXT,
    /** Key of a key/value entry matched; the reported value is the entry value. */
    KEY,
    /** Value of a key/value entry matched. */
    VALUE
  }
}
