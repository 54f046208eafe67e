package ca.gc.cra.loganalyzer.infrastructure.metrics;

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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("loganalyzer.metric.key");

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
  void incrementRecordsCounterWithKeyAttributeAndResource() {
    assertFalse(adapter.isNoop());
    adapter.increment("search.records.produced");
    adapter.increment("search.records.produced");
    adapter.increment("search.records.produced");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "search.records.produced").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("search.records.produced", point.getAttributes().get(METRIC_KEY));
    assertEquals("loganalyzer", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramSamplesUnderSanitizedName() {
    adapter.observe("search.run.elapsedMillis", 10L);
    adapter.observe("search.run.elapsedMillis", 30L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "search.run.elapsedmillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40.0, point.getSum());
    assertEquals("search.run.elapsedMillis", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameProducesLegalInstrumentNames() {
    assertEquals("search.queue.highwater", OpenTelemetryMetricsAdapter.sanitizeName("search.queue.highWater"));
    assertEquals("m1st_metric", OpenTelemetryMetricsAdapter.sanitizeName("1st metric"));
    assertEquals("loganalyzer.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match;
  }
}
