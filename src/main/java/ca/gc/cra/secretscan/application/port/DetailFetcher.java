package ca.gc.cra.secretscan.application.port;

import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;

/**
 * Retrieves the scannable detail of one resource.
 *
 * <p>Invoked concurrently by collector workers for distinct references; implementations must be
 * thread-safe and must not depend on invocation order.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DetailFetcher {
  /**
   * Fetches the detail for {@code ref}.
   *
   * @param ref reference produced by the listing source
   * @return enriched detail
   * @throws Exception when the remote call fails; throttling failures are retried by the caller
   */
  ResourceDetail fetch(ResourceRef ref) throws Exception;
}
