package ca.gc.cra.induform.infrastructure.metrics;

import ca.gc.cra.induform.application.port.MetricsPort;

/**
 * Metrics adapter selected when telemetry is disabled ({@code metricsExporter=none}).
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {
    // metrics disabled
  }

  @Override
  public void observe(String key, long value) {
    // metrics disabled
  }
}
