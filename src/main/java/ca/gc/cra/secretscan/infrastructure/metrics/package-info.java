/**
 * OpenTelemetry implementation of the metrics port.
 * <p><strong>Metrics:</strong> Publishes under {@code collector.*}, {@code retry.*} and {@code scan.*}.</p>
 * <p><strong>Security:</strong> Only counts and latencies are exported; matched values never leave the process.</p>
 */
package ca.gc.cra.secretscan.infrastructure.metrics;
