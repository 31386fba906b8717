/**
 * Ports separating the scan pipeline from AWS, presentation and telemetry adapters.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code infrastructure} and {@code api}.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.secretscan.application.port.DetailFetcher},
 * {@link ca.gc.cra.secretscan.application.port.ThrottlingClassifier} and
 * {@link ca.gc.cra.secretscan.application.port.MetricsPort} are invoked from collector worker threads and
 * must be thread-safe.</p>
 */
package ca.gc.cra.secretscan.application.port;
