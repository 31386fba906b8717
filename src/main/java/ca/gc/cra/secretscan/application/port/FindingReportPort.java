package ca.gc.cra.secretscan.application.port;

import ca.gc.cra.secretscan.application.pipeline.ScanSummary;
import ca.gc.cra.secretscan.domain.resource.Finding;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import java.util.List;

/**
 * Presentation sink for findings and the end-of-run summary.
 *
 * <p>Called from the scan thread only, one resource at a time.</p>
 *
 * @since 0.1.0
 */
public interface FindingReportPort {
  /**
   * Reports the findings of one resource.
   *
   * @param detail resource the findings belong to
   * @param findings non-empty findings in field order
   */
  void report(ResourceDetail detail, List<Finding> findings);

  /**
   * Reports the end-of-run summary.
   *
   * @param summary totals per resource type
   */
  void summary(ScanSummary summary);
}
