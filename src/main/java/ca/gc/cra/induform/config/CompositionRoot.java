package ca.gc.cra.induform.config;

import ca.gc.cra.induform.application.firewall.FirewallRuleGenerator;
import ca.gc.cra.induform.application.pipeline.ProjectAssessmentUseCase;
import ca.gc.cra.induform.application.port.MetricsPort;
import ca.gc.cra.induform.application.vlan.VlanMappingGenerator;
import ca.gc.cra.induform.infrastructure.export.IptablesExporter;
import ca.gc.cra.induform.infrastructure.export.JsonReportWriter;
import ca.gc.cra.induform.infrastructure.export.TextReportWriter;
import ca.gc.cra.induform.infrastructure.export.VlanExporter;
import ca.gc.cra.induform.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.induform.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.induform.infrastructure.persistence.ProjectYamlReader;
import ca.gc.cra.induform.infrastructure.persistence.ProjectYamlWriter;
import ca.gc.cra.induform.infrastructure.persistence.VulnerabilityYamlReader;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires InduForm use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place where the CLI obtains the engine, readers and exporters.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning read -> assess -> export.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Construct the assessment use case with the configured metrics adapter.</li>
 *   <li>Expose project and vulnerability readers, the project writer and report exporters.</li>
 *   <li>Flush and release telemetry resources when the CLI finishes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 * <p><strong>Observability:</strong> Supplies the metrics port shared by every use case built here.</p>
 *
 * @since 0.1.0
 * @see ProjectAssessmentUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;

  /**
   * Creates a composition root backed by OpenTelemetry metrics configured from {@code otel.*} properties, or by
   * {@link NoOpMetricsAdapter} when {@code otel.metrics.exporter=none}.
   */
  public CompositionRoot() {
    this(metricsFromEnvironment());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metricsPort) {
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
  }

  /** Builds the assessment use case running validator, policies, risk, resolver, attack paths and gaps. */
  public ProjectAssessmentUseCase assessmentUseCase() {
    return new ProjectAssessmentUseCase(metrics);
  }

  public FirewallRuleGenerator firewallRuleGenerator() {
    return new FirewallRuleGenerator();
  }

  public VlanMappingGenerator vlanMappingGenerator() {
    return new VlanMappingGenerator();
  }

  public ProjectYamlReader projectReader() {
    return new ProjectYamlReader();
  }

  public ProjectYamlWriter projectWriter() {
    return new ProjectYamlWriter();
  }

  public VulnerabilityYamlReader vulnerabilityReader() {
    return new VulnerabilityYamlReader();
  }

  public JsonReportWriter jsonReportWriter() {
    return new JsonReportWriter();
  }

  public TextReportWriter textReportWriter() {
    return new TextReportWriter();
  }

  public IptablesExporter iptablesExporter() {
    return new IptablesExporter();
  }

  public VlanExporter vlanExporter() {
    return new VlanExporter();
  }

  /**
   * Supplies the metrics implementation used across use cases.
   *
   * @return shared metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  static MetricsPort metricsFromEnvironment() {
    String exporter = System.getProperty("otel.metrics.exporter", "");
    if (exporter.trim().equalsIgnoreCase("none")) {
      log.debug("Metrics exporter disabled; using noop metrics adapter");
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter();
  }

  /** Flushes pending metrics and shuts down the telemetry SDK when one is in use. */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      try {
        otel.forceFlush();
      } catch (RuntimeException ex) {
        log.warn("Metrics flush failed during shutdown", ex);
      } finally {
        otel.close();
      }
    }
  }
}
