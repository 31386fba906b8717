/**
 * Pattern domain model: compiled entries, immutable pattern sets, match modes and match results.
 * <p><strong>Role:</strong> Pure domain layer shared by the matcher and the reporting adapters.</p>
 * <p><strong>Concurrency:</strong> All types except builders are immutable and freely shareable.</p>
 */
package ca.gc.cra.secretscan.domain.pattern;
