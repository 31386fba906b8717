package ca.gc.cra.secretscan.domain.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enriched record produced by a detail fetch: descriptive labels plus the text and key/value fields to
 * scan.
 *
 * <p>Immutable once built; handed from collector workers to the matcher without further mutation.</p>
 *
 * @param ref originating reference
 * @param labels descriptive attributes printed with findings (version, source location, ...)
 * @param textFields free text fields scanned as a whole
 * @param keyValueFields maps whose keys and values are scanned separately
 * @since 0.1.0
 */
public record ResourceDetail(
    ResourceRef ref,
    Map<String, String> labels,
    List<TextField> textFields,
    List<KeyValueField> keyValueFields) {

  public ResourceDetail {
    Objects.requireNonNull(ref, "ref");
    labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    textFields = textFields == null ? List.of() : List.copyOf(textFields);
    keyValueFields = keyValueFields == null ? List.of() : List.copyOf(keyValueFields);
  }

  /**
   * Starts a builder for {@code ref}.
   *
   * @param ref originating reference
   * @return new builder
   */
  public static Builder builder(ResourceRef ref) {
    return new Builder(ref);
  }

  /**
   * Named free-text field.
   *
   * @param name field name shown in reports (for example {@code UserData})
   * @param text field content; {@code null} is stored as empty
   */
  public record TextField(String name, String text) {
    public TextField {
      Objects.requireNonNull(name, "name");
      text = text == null ? "" : text;
    }
  }

  /**
   * Named key/value field such as environment variables or job arguments.
   *
   * @param name field name shown in reports
   * @param entries ordered entries; {@code null} values are stored as empty strings
   */
  public record KeyValueField(String name, Map<String, String> entries) {
    public KeyValueField {
      Objects.requireNonNull(name, "name");
      Map<String, String> copy = new LinkedHashMap<>();
      if (entries != null) {
        entries.forEach((key, value) -> {
          if (key != null) {
            copy.put(key, value == null ? "" : value);
          }
        });
      }
      entries = Collections.unmodifiableMap(copy);
    }
  }

  /** Mutable builder used by detail fetchers; not thread-safe. */
  public static final class Builder {
    private final ResourceRef ref;
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final List<TextField> textFields = new ArrayList<>();
    private final List<KeyValueField> keyValueFields = new ArrayList<>();

    private Builder(ResourceRef ref) {
      this.ref = Objects.requireNonNull(ref, "ref");
    }

    /** Adds a label unless {@code value} is {@code null} or blank. */
    public Builder label(String name, String value) {
      if (value != null && !value.isBlank()) {
        labels.put(name, value);
      }
      return this;
    }

    /** Adds a text field unless {@code text} is {@code null} or empty. */
    public Builder text(String name, String text) {
      if (text != null && !text.isEmpty()) {
        textFields.add(new TextField(name, text));
      }
      return this;
    }

    /** Adds a key/value field unless {@code entries} is {@code null} or empty. */
    public Builder keyValues(String name, Map<String, String> entries) {
      if (entries != null && !entries.isEmpty()) {
        keyValueFields.add(new KeyValueField(name, entries));
      }
      return this;
    }

    public ResourceDetail build() {
      return new ResourceDetail(ref, labels, textFields, keyValueFields);
    }
  }
}
