package ca.gc.cra.induform.application.port;

/**
 * <strong>What:</strong> Port through which the engine reports counters and timings.
 * <p><strong>Why:</strong> Keeps the validator, policy evaluator, risk engine and resolver free of any telemetry SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates; assessments may run in
 * parallel.</p>
 * <p><strong>Observability:</strong> Metric keys are dotted, e.g. {@code engine.validate.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds one to a counter.
   *
   * @param key dotted metric key; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records a sample, typically a latency in nanoseconds or a finding count.
   *
   * @param key dotted metric key; must not be {@code null}
   * @param value sample value
   */
  void observe(String key, long value);

  /** Port that drops every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
