package ca.gc.cra.secretscan.infrastructure.aws;

import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import java.util.List;
import java.util.Objects;

/**
 * {@link ListingSource} over AWS list/describe calls that paginate with a continuation token or marker.
 *
 * <p>Single-threaded: one instance per collection run.</p>
 *
 * @since 0.1.0
 */
final class TokenPagedListingSource implements ListingSource {
  private final PageFetcher fetcher;
  private String token;
  private boolean finished;

  TokenPagedListingSource(PageFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  @Override
  public Page nextPage() throws Exception {
    if (finished) {
      return Page.last(List.of());
    }
    TokenPage page = fetcher.fetch(token);
    String next = page.nextToken();
    if (next != null && next.equals(token)) {
      throw new IllegalStateException("Listing returned the same continuation token twice");
    }
    token = next;
    finished = next == null || next.isEmpty();
    return new Page(page.items(), !finished);
  }

  /** Fetches the page identified by {@code token}; {@code null} requests the first page. */
  @FunctionalInterface
  interface PageFetcher {
    TokenPage fetch(String token) throws Exception;
  }

  /**
   * Page returned by a token-based AWS call.
   *
   * @param items references on this page
   * @param nextToken continuation token; {@code null} or empty on the last page
   */
  record TokenPage(List<ResourceRef> items, String nextToken) {
    TokenPage {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }
  }
}
