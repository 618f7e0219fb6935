package ca.gc.cra.calsync.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @BeforeEach
  void rememberProperties() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

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
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      assertTrue(adapter.isNoop(), "Expected noop metrics when exporter=none");
      adapter.increment("sync.mutation.created");
      adapter.observe("sync.events.fetched", 3);
    }
  }

  @Test
  void unknownExporterIsTreatedAsNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("zipkin"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=calendar, broken, =x, env=dev");

    assertEquals(2, attributes.size());
    assertEquals("calendar", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("dev", attributes.get(AttributeKey.stringKey("env")));
  }
}
