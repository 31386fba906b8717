package ca.gc.cra.secretscan.domain.pattern;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable, name-keyed collection of compiled {@link PatternEntry} values.
 * <p><strong>Why:</strong> Built once at startup and shared by every matcher invocation of a scan.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across worker threads without locking.</p>
 *
 * @since 0.1.0
 */
public final class PatternSet {
  private static final PatternSet EMPTY = new PatternSet(List.of());

  private final Map<String, PatternEntry> entries;

  private PatternSet(Collection<PatternEntry> source) {
    Map<String, PatternEntry> map = new LinkedHashMap<>();
    for (PatternEntry entry : source) {
      Objects.requireNonNull(entry, "entry");
      if (map.putIfAbsent(entry.name(), entry) != null) {
        throw new IllegalArgumentException("Duplicate pattern name: " + entry.name());
      }
    }
    this.entries = Collections.unmodifiableMap(map);
  }

  /**
   * Creates a pattern set preserving the iteration order of {@code entries}.
   *
   * @param entries compiled entries with unique names
   * @return immutable pattern set
   * @throws IllegalArgumentException when two entries share a name
   */
  public static PatternSet of(Collection<PatternEntry> entries) {
    Objects.requireNonNull(entries, "entries");
    return entries.isEmpty() ? EMPTY : new PatternSet(entries);
  }

  /**
   * Returns the shared empty pattern set.
   *
   * @return empty set
   */
  public static PatternSet empty() {
    return EMPTY;
  }

  /**
   * Returns the entries in registration order.
   *
   * @return unmodifiable view of entries
   */
  public Collection<PatternEntry> entries() {
    return entries.values();
  }

  /**
   * Returns the registered names in registration order.
   *
   * @return unmodifiable view of names
   */
  public Set<String> names() {
    return entries.keySet();
  }

  /**
   * Looks up an entry by name.
   *
   * @param name pattern name
   * @return matching entry, if registered
   */
  public Optional<PatternEntry> find(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
