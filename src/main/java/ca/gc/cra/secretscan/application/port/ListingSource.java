package ca.gc.cra.secretscan.application.port;

import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Paginated enumeration of resource references.
 * <p><strong>Role:</strong> Port implemented per resource type; consumed by the collector's feeder.</p>
 * <p><strong>Thread-safety:</strong> Not required; a single feeder thread drives each instance, and a new
 * instance is created per collection run.</p>
 *
 * @since 0.1.0
 */
public interface ListingSource {
  /**
   * Fetches the next page of references.
   *
   * <p>Called repeatedly until a page reports {@code hasMore == false}; never called again after that or
   * after it throws.</p>
   *
   * @return next page
   * @throws Exception when the remote listing call fails; the collector treats this as fatal
   */
  Page nextPage() throws Exception;

  /**
   * One page of references plus the continuation indicator.
   *
   * @param items references in listing order
   * @param hasMore whether another page should be requested
   */
  record Page(List<ResourceRef> items, boolean hasMore) {
    public Page {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    /**
     * Returns a terminal page.
     *
     * @param items references in listing order
     * @return page with {@code hasMore == false}
     */
    public static Page last(List<ResourceRef> items) {
      return new Page(items, false);
    }
  }
}
