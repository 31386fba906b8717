/**
 * AWS SDK v2 adapters: one {@link ca.gc.cra.secretscan.application.port.ResourceScanner} per resource type,
 * plus the client factory, throttling classifier and script/package readers they share.
 */
package ca.gc.cra.secretscan.infrastructure.aws;
