package ca.gc.cra.secretscan.application.port;

import ca.gc.cra.secretscan.domain.resource.ResourceType;

/**
 * <strong>What:</strong> Listing and detail-fetch pair for one resource type.
 * <p><strong>Why:</strong> Keeps resource-specific field extraction behind a single seam so the collector and
 * matcher stay generic.</p>
 * <p><strong>Role:</strong> Port implemented by the AWS adapters; consumed by {@code ScanUseCase}.</p>
 * <p><strong>Thread-safety:</strong> {@link #detailFetcher()} must return a thread-safe fetcher; listing
 * sources are single-threaded.</p>
 *
 * @since 0.1.0
 */
public interface ResourceScanner {
  /** Resource type handled by this scanner. */
  ResourceType resourceType();

  /**
   * Creates a fresh listing source positioned at the first page.
   *
   * @return new listing source
   */
  ListingSource newListingSource();

  /**
   * Returns the detail fetcher shared by all workers of a run.
   *
   * @return thread-safe fetcher
   */
  DetailFetcher detailFetcher();
}
