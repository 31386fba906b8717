/**
 * Resource domain model: supported resource types, listing references, fetched details and findings.
 * <p><strong>Role:</strong> Domain layer exchanged between the collector, the finding extractor and the
 * report adapters.</p>
 */
package ca.gc.cra.secretscan.domain.resource;
