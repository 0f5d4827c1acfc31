package com.rottenpotatoes.intake.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
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
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("intake.submit.committed");
    adapter.increment("intake.submit.committed");
    adapter.forceFlush();

    MetricData counter = find("intake.submit.committed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("intake.submit.committed", point.getAttributes().get(AttributeKey.stringKey("intake.metric.key")));
    assertEquals("review-intake", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("intake.submit.latencyNanos", 1_000);
    adapter.observe("intake.submit.latencyNanos", 3_000);

    MetricData histogram = find("intake.submit.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("events.remote.failed", OpenTelemetryMetricsAdapter.instrumentName("events.remote.failed"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.instrumentName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.instrumentName("A B"));
    assertEquals("intake.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  @Test
  void exporterModeDefaultsToNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
  }

  private Optional<MetricData> find(String name) {
    return reader.collectAllMetrics().stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
