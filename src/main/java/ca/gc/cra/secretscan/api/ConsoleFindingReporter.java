package ca.gc.cra.secretscan.api;

import ca.gc.cra.secretscan.application.pattern.Redactor;
import ca.gc.cra.secretscan.application.pipeline.ScanSummary;
import ca.gc.cra.secretscan.application.port.FindingReportPort;
import ca.gc.cra.secretscan.domain.resource.Finding;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import java.util.List;
import java.util.Locale;

/**
 * Prints findings and the run summary to standard output through {@link CliPrinter}.
 *
 * <p>Every matched value passes through {@link Redactor#display(String, boolean)}; values are shown in full
 * only when {@code show} is set.</p>
 *
 * @since 0.1.0
 */
final class ConsoleFindingReporter implements FindingReportPort {
  private final boolean show;

  ConsoleFindingReporter(boolean show) {
    this.show = show;
  }

  @Override
  public void report(ResourceDetail detail, List<Finding> findings) {
    ResourceRef ref = detail.ref();
    String title = ref.displayName().equals(ref.id())
        ? ref.id()
        : ref.displayName() + " (" + ref.id() + ")";
    CliPrinter.println("[" + ref.type().label() + "] " + title);
    detail.labels().forEach((name, value) -> CliPrinter.println("  " + name + ": " + value));
    for (Finding finding : findings) {
      CliPrinter.println("  " + describe(finding));
      for (String value : finding.values()) {
        CliPrinter.println("    " + Redactor.display(value, show));
      }
    }
    CliPrinter.println("");
  }

  @Override
  public void summary(ScanSummary summary) {
    CliPrinter.println(String.format(Locale.ROOT, "Scan summary (%.1fs)", summary.elapsed().toMillis() / 1000.0));
    for (ScanSummary.TypeSummary type : summary.types()) {
      if (type.enumerationError().isPresent()) {
        CliPrinter.println("  " + type.type().label() + ": listing failed: " + type.enumerationError().get());
      } else {
        CliPrinter.println(String.format(Locale.ROOT,
            "  %s: %d enumerated, %d fetched, %d failed, %d with findings, %d findings",
            type.type().label(),
            type.enumerated(),
            type.fetched(),
            type.failed(),
            type.resourcesWithFindings(),
            type.findings()));
      }
    }
    CliPrinter.println("Total findings: " + summary.totalFindings());
  }

  static String describe(Finding finding) {
    if (finding.kind() == Finding.Kind.TEXT) {
      return finding.heading() + " (Pattern: " + finding.patternName() + ")";
    }
    return finding.heading();
  }
}
