package ca.gc.cra.calsync.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void mutationCountersAreExportedWithServiceResource() {
    assertFalse(adapter.isNoop());
    adapter.increment("sync.mutation.created");
    adapter.increment("sync.mutation.created");
    adapter.increment("sync.mutation.failed");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData created = find(metrics, "sync.mutation.created").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, created.getType());
    LongPointData point = created.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("sync.mutation.created",
        point.getAttributes().get(AttributeKey.stringKey("calsync.metric.key")));
    assertEquals("calsync", created.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", created.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertTrue(find(metrics, "sync.mutation.failed").isPresent());
  }

  @Test
  void observationsBecomeHistograms() {
    adapter.observe("sync.run.latencyMillis", 40);
    adapter.observe("sync.run.latencyMillis", 60);
    adapter.forceFlush();

    MetricData latency = find(reader.collectAllMetrics(), "sync.run.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, latency.getType());
    HistogramPointData point = latency.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum(), 0.0001);
    assertEquals("sync.run.latencyMillis",
        point.getAttributes().get(AttributeKey.stringKey("calsync.metric.key")));
  }

  @Test
  void metricNamesAreSanitized() {
    assertEquals("sync.events.fetched", OpenTelemetryMetricsAdapter.sanitizeName("sync.events.fetched"));
    assertEquals("sync.run.latencymillis", OpenTelemetryMetricsAdapter.sanitizeName("sync.run.latencyMillis"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitizeName("9 lives"));
    assertEquals("calsync.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
