/**
 * CLI entry points for the {@code scan} and {@code patterns} commands.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, merge configuration, configure logging and
 * metrics, and invoke the scan use case.</p>
 * <p><strong>Security:</strong> Matched values are redacted on output unless {@code show=true}; they are never
 * logged.</p>
 */
package ca.gc.cra.secretscan.api;
