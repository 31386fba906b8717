package ca.gc.cra.secretscan.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterDisablesMetrics() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void malformedResourceAttributesAreSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=secops, broken, =x,env=prod");

    assertEquals(2, attributes.size());
    assertEquals("secops", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
  }
}
