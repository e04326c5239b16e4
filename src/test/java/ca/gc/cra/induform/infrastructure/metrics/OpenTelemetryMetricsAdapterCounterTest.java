package ca.gc.cra.induform.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap = OpenTelemetryBootstrap.forTesting(reader);
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("engine.policy.success");
    adapter.increment("engine.policy.success");
    adapter.increment("engine.policy.success");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    Optional<MetricData> maybeCounter = metrics.stream()
        .filter(metric -> metric.getName().equals("engine.policy.success"))
        .findFirst();
    assertTrue(maybeCounter.isPresent(), "Expected counter metric to be exported");

    MetricData counter = maybeCounter.orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    AttributeKey<String> keyAttr = AttributeKey.stringKey("induform.metric.key");
    assertEquals("engine.policy.success", point.getAttributes().get(keyAttr));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("induform", counter.getResource().getAttribute(serviceName));
    AttributeKey<String> serviceNamespace = AttributeKey.stringKey("service.namespace");
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(serviceNamespace));
  }

  @Test
  void sanitizedNamesKeepOriginalKeyAttribute() {
    adapter.increment("9 validate/errors");
    adapter.forceFlush();

    MetricData counter = reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals("m9_validate_errors"))
        .findFirst()
        .orElseThrow();
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("9 validate/errors", point.getAttributes().get(AttributeKey.stringKey("induform.metric.key")));
  }

  @Test
  void blankKeysUseFallbackName() {
    assertEquals("induform.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("engine.risk.failure", OpenTelemetryMetricsAdapter.sanitizeName("Engine.Risk.Failure"));
  }
}
