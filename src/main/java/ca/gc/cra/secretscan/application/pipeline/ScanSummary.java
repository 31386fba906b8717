package ca.gc.cra.secretscan.application.pipeline;

import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Totals of a scan run, one entry per resource type in scan order.
 *
 * @param types per-type totals
 * @param elapsed wall-clock duration of the run
 * @since 0.1.0
 */
public record ScanSummary(List<TypeSummary> types, Duration elapsed) {
  public ScanSummary {
    types = List.copyOf(Objects.requireNonNull(types, "types"));
    Objects.requireNonNull(elapsed, "elapsed");
  }

  /** Whether any resource type could not be enumerated. */
  public boolean hasEnumerationFailures() {
    return types.stream().anyMatch(type -> type.enumerationError().isPresent());
  }

  /** Findings reported across all types. */
  public int totalFindings() {
    return types.stream().mapToInt(TypeSummary::findings).sum();
  }

  /**
   * Totals for one resource type.
   *
   * @param type resource type
   * @param enumerated references listed
   * @param fetched details fetched
   * @param failed items skipped after fetch failures
   * @param resourcesWithFindings fetched resources that produced at least one finding
   * @param findings findings reported
   * @param enumerationError listing failure message, when the type was abandoned
   */
  public record TypeSummary(
      ResourceType type,
      int enumerated,
      int fetched,
      int failed,
      int resourcesWithFindings,
      int findings,
      Optional<String> enumerationError) {
    public TypeSummary {
      Objects.requireNonNull(type, "type");
      enumerationError = Objects.requireNonNullElse(enumerationError, Optional.empty());
    }

    /**
     * Creates the summary of an abandoned type.
     *
     * @param type resource type
     * @param error listing failure message
     * @return summary with zero counts
     */
    public static TypeSummary enumerationFailed(ResourceType type, String error) {
      return new TypeSummary(type, 0, 0, 0, 0, 0, Optional.of(error == null ? "listing failed" : error));
    }
  }
}
