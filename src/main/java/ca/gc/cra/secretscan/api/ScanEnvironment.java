package ca.gc.cra.secretscan.api;

import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.application.port.ThrottlingClassifier;
import ca.gc.cra.secretscan.config.ScanConfig;
import ca.gc.cra.secretscan.infrastructure.aws.AwsClientFactory;
import ca.gc.cra.secretscan.infrastructure.aws.AwsScannerCatalog;
import ca.gc.cra.secretscan.infrastructure.aws.AwsThrottlingClassifier;
import java.util.List;

/**
 * Cloud-side collaborators of a scan run: the throttling rules and one scanner per selected resource type.
 * Closing the environment releases its clients.
 */
interface ScanEnvironment extends AutoCloseable {

  ThrottlingClassifier throttling();

  List<ResourceScanner> scanners();

  @Override
  void close();

  /** Opens AWS SDK clients for the configured region and profile. */
  static ScanEnvironment aws(ScanConfig config) {
    AwsClientFactory clients = new AwsClientFactory(config.region(), config.profile());
    AwsThrottlingClassifier throttling = new AwsThrottlingClassifier();
    List<ResourceScanner> scanners;
    try {
      scanners = new AwsScannerCatalog(clients, throttling).scannersFor(config.resourceTypes());
    } catch (RuntimeException ex) {
      clients.close();
      throw ex;
    }
    return new ScanEnvironment() {
      @Override
      public ThrottlingClassifier throttling() {
        return throttling;
      }

      @Override
      public List<ResourceScanner> scanners() {
        return scanners;
      }

      @Override
      public void close() {
        clients.close();
      }
    };
  }
}
