package ca.gc.cra.secretscan.application.collect;

import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a completed listing: every fetched detail plus the items that could not be fetched.
 *
 * @param details fetched details in no particular order
 * @param enumerated references produced by the listing source
 * @param failures items skipped after their fetch failed
 * @since 0.1.0
 */
public record CollectionResult(List<ResourceDetail> details, int enumerated, List<ItemFailure> failures) {
  public CollectionResult {
    details = List.copyOf(Objects.requireNonNull(details, "details"));
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  /**
   * A reference whose detail could not be fetched.
   *
   * @param ref skipped reference
   * @param cause terminal failure
   */
  public record ItemFailure(ResourceRef ref, ItemFetchException cause) {
    public ItemFailure {
      Objects.requireNonNull(ref, "ref");
      Objects.requireNonNull(cause, "cause");
    }
  }
}
