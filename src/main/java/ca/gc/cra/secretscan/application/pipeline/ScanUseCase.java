package ca.gc.cra.secretscan.application.pipeline;

import ca.gc.cra.secretscan.application.collect.CancellationSignal;
import ca.gc.cra.secretscan.application.collect.CollectionResult;
import ca.gc.cra.secretscan.application.collect.ConcurrentCollector;
import ca.gc.cra.secretscan.application.collect.EnumerationException;
import ca.gc.cra.secretscan.application.port.FindingReportPort;
import ca.gc.cra.secretscan.application.port.MetricsPort;
import ca.gc.cra.secretscan.application.port.ResourceScanner;
import ca.gc.cra.secretscan.domain.resource.Finding;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Scans each selected resource type: collect details, extract findings, report them.
 * <p><strong>Why:</strong> Keeps the failure scope per resource type: a listing failure abandons that type only,
 * and partial detail sets are still matched and reported.</p>
 * <p><strong>Role:</strong> Application use case invoked by the {@code scan} CLI.</p>
 * <p><strong>Thread-safety:</strong> Runs on the caller thread; concurrency lives inside the collector.</p>
 * <p><strong>Observability:</strong> Logs per-type totals, observes {@code scan.findings} per type and
 * increments {@code scan.enumeration.failed}.</p>
 *
 * @since 0.1.0
 */
public final class ScanUseCase {
  private static final Logger log = LoggerFactory.getLogger(ScanUseCase.class);
  private static final Comparator<ResourceDetail> REPORT_ORDER =
      Comparator.comparing((ResourceDetail detail) -> detail.ref().displayName())
          .thenComparing(detail -> detail.ref().id());

  private final ConcurrentCollector collector;
  private final FindingExtractor extractor;
  private final FindingReportPort reporter;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param collector collector shared by every resource type
   * @param extractor finding extractor
   * @param reporter presentation sink
   * @param metrics metrics sink
   */
  public ScanUseCase(
      ConcurrentCollector collector,
      FindingExtractor extractor,
      FindingReportPort reporter,
      MetricsPort metrics) {
    this.collector = Objects.requireNonNull(collector, "collector");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Scans every resource type in order.
   *
   * @param scanners scanners, one per resource type
   * @param cancellation run cancellation
   * @return per-type totals; also passed to {@link FindingReportPort#summary(ScanSummary)}
   * @throws InterruptedException when the scan thread is interrupted
   * @throws CancellationException when {@code cancellation} fires
   */
  public ScanSummary run(List<ResourceScanner> scanners, CancellationSignal cancellation)
      throws InterruptedException {
    Objects.requireNonNull(scanners, "scanners");
    Objects.requireNonNull(cancellation, "cancellation");
    long startNanos = System.nanoTime();
    List<ScanSummary.TypeSummary> totals = new ArrayList<>();
    for (ResourceScanner scanner : scanners) {
      if (cancellation.isCancelled()) {
        throw new CancellationException("Scan cancelled: " + cancellation.reason().orElse("cancelled"));
      }
      totals.add(scan(scanner, cancellation));
    }
    ScanSummary summary = new ScanSummary(totals, Duration.ofNanos(System.nanoTime() - startNanos));
    reporter.summary(summary);
    return summary;
  }

  private ScanSummary.TypeSummary scan(ResourceScanner scanner, CancellationSignal cancellation)
      throws InterruptedException {
    ResourceType type = scanner.resourceType();
    log.info("Scanning {}", type.label());
    CollectionResult result;
    try {
      result = collector.collect(type.id(), scanner.newListingSource(), scanner.detailFetcher(), cancellation);
    } catch (EnumerationException ex) {
      metrics.increment("scan.enumeration.failed");
      log.error("Failed to enumerate {}", type.label(), ex);
      return ScanSummary.TypeSummary.enumerationFailed(type, ex.getMessage());
    }

    List<ResourceDetail> details = new ArrayList<>(result.details());
    details.sort(REPORT_ORDER);
    int withFindings = 0;
    int findingCount = 0;
    MDC.put("resourceType", type.id());
    try {
      for (ResourceDetail detail : details) {
        List<Finding> findings = extractor.extract(detail);
        if (findings.isEmpty()) {
          continue;
        }
        withFindings++;
        findingCount += findings.size();
        reporter.report(detail, findings);
      }
    } finally {
      MDC.remove("resourceType");
    }
    metrics.observe("scan.findings", findingCount);
    log.info("{}: {} enumerated, {} fetched, {} failed, {} with findings",
        type.label(), result.enumerated(), details.size(), result.failures().size(), withFindings);
    return new ScanSummary.TypeSummary(
        type,
        result.enumerated(),
        details.size(),
        result.failures().size(),
        withFindings,
        findingCount,
        Optional.empty());
  }
}
