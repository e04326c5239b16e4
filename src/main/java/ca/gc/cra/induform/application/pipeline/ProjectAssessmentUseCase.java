package ca.gc.cra.induform.application.pipeline;

import ca.gc.cra.induform.application.attackpath.AttackPathAnalysis;
import ca.gc.cra.induform.application.attackpath.AttackPathAnalyzer;
import ca.gc.cra.induform.application.gap.GapAnalysisReport;
import ca.gc.cra.induform.application.gap.GapAnalyzer;
import ca.gc.cra.induform.application.policy.PolicyEvaluator;
import ca.gc.cra.induform.application.policy.PolicyViolation;
import ca.gc.cra.induform.application.port.MetricsPort;
import ca.gc.cra.induform.application.resolver.ResolvedControls;
import ca.gc.cra.induform.application.resolver.SecurityControlResolver;
import ca.gc.cra.induform.application.risk.RiskAssessment;
import ca.gc.cra.induform.application.risk.RiskEngine;
import ca.gc.cra.induform.application.validation.ProjectValidator;
import ca.gc.cra.induform.application.validation.ValidationReport;
import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.domain.model.Project;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the validator, policy evaluator, risk engine and resolver over one project, and
 * exposes the attack path and gap analyses as separate stages.
 * <p><strong>Why:</strong> CLI commands and embedding services need a single entry point that produces every
 * engine output consistently and reports how long each stage took.</p>
 * <p><strong>Role:</strong> Application-layer use case composed by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the active compliance standards for filtering.</li>
 *   <li>Invoke each engine component and time it.</li>
 *   <li>Record counters and latencies through {@link MetricsPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected collaborators, which are themselves
 * stateless; safe for concurrent use provided the metrics port is.</p>
 * <p><strong>Observability:</strong> Emits {@code engine.validate.*}, {@code engine.policy.*},
 * {@code engine.risk.*}, {@code engine.resolve.*}, {@code engine.attackpath.*} and {@code engine.gap.*} metrics
 * and logs a summary at INFO.</p>
 *
 * @since 0.1.0
 */
public final class ProjectAssessmentUseCase {
  private static final Logger log = LoggerFactory.getLogger(ProjectAssessmentUseCase.class);

  private final ProjectValidator validator;
  private final PolicyEvaluator policyEvaluator;
  private final RiskEngine riskEngine;
  private final SecurityControlResolver resolver;
  private final AttackPathAnalyzer attackPathAnalyzer;
  private final GapAnalyzer gapAnalyzer;
  private final MetricsPort metrics;

  public ProjectAssessmentUseCase(MetricsPort metrics) {
    this(new ProjectValidator(), new PolicyEvaluator(), new RiskEngine(), new SecurityControlResolver(),
        new AttackPathAnalyzer(), new GapAnalyzer(), metrics);
  }

  /**
   * Creates a use case with explicit collaborators.
   *
   * @param validator project validator
   * @param policyEvaluator policy evaluator
   * @param riskEngine risk engine
   * @param resolver control resolver
   * @param attackPathAnalyzer attack path analyzer
   * @param gapAnalyzer gap analyzer
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} to disable
   */
  public ProjectAssessmentUseCase(
      ProjectValidator validator,
      PolicyEvaluator policyEvaluator,
      RiskEngine riskEngine,
      SecurityControlResolver resolver,
      AttackPathAnalyzer attackPathAnalyzer,
      GapAnalyzer gapAnalyzer,
      MetricsPort metrics) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.policyEvaluator = Objects.requireNonNull(policyEvaluator, "policyEvaluator");
    this.riskEngine = Objects.requireNonNull(riskEngine, "riskEngine");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.attackPathAnalyzer = Objects.requireNonNull(attackPathAnalyzer, "attackPathAnalyzer");
    this.gapAnalyzer = Objects.requireNonNull(gapAnalyzer, "gapAnalyzer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Assesses a project.
   *
   * @param project project to assess
   * @param options run options
   * @return combined assessment
   */
  public ProjectAssessment assess(Project project, AssessmentOptions options) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(options, "options");
    Set<ComplianceStandard> standards = activeStandards(project, options);

    ValidationReport validation = validate(project, options.strict(), standards);
    List<PolicyViolation> violations = evaluatePolicies(project, standards);
    RiskAssessment risk = timed("engine.risk", () -> riskEngine.assess(project, options.vulnerabilities()));
    ResolvedControls controls = resolve(project);

    log.info("Assessed project '{}': valid={} errors={} warnings={} violations={} risk={} ({})",
        project.metadata().name(), validation.valid(), validation.errorCount(), validation.warningCount(),
        violations.size(), risk.score(), risk.level().wireName());
    return new ProjectAssessment(project.metadata().name(), validation, violations, risk, controls);
  }

  /**
   * Runs only validation, with the same standards resolution and metrics as {@link #assess}.
   *
   * @param project project to validate
   * @param options run options
   * @return validation report
   */
  public ValidationReport validate(Project project, AssessmentOptions options) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(options, "options");
    return validate(project, options.strict(), activeStandards(project, options));
  }

  /**
   * Runs only policy evaluation.
   *
   * @param project project to evaluate
   * @param options run options
   * @return violations in rule order
   */
  public List<PolicyViolation> evaluatePolicies(Project project, AssessmentOptions options) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(options, "options");
    return evaluatePolicies(project, activeStandards(project, options));
  }

  /**
   * Runs only the risk engine.
   *
   * @param project project to score
   * @param options run options supplying vulnerability data
   * @return risk assessment
   */
  public RiskAssessment assessRisk(Project project, AssessmentOptions options) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(options, "options");
    return timed("engine.risk", () -> riskEngine.assess(project, options.vulnerabilities()));
  }

  /**
   * Runs only the control resolver.
   *
   * @param project project to resolve
   * @return resolved controls
   */
  public ResolvedControls resolve(Project project) {
    Objects.requireNonNull(project, "project");
    return timed("engine.resolve", () -> resolver.resolve(project));
  }

  /**
   * Runs only the attack path analysis.
   *
   * @param project project to analyze
   * @param maxPaths maximum number of paths to report
   * @return analysis with the riskiest paths first
   */
  public AttackPathAnalysis findAttackPaths(Project project, int maxPaths) {
    Objects.requireNonNull(project, "project");
    AttackPathAnalysis analysis = timed("engine.attackpath", () -> attackPathAnalyzer.analyze(project, maxPaths));
    metrics.observe("engine.attackpath.paths", analysis.paths().size());
    return analysis;
  }

  /**
   * Runs only the IEC 62443-3-3 gap analysis.
   *
   * @param project project to analyze
   * @return gap analysis report
   */
  public GapAnalysisReport analyzeGaps(Project project) {
    Objects.requireNonNull(project, "project");
    return timed("engine.gap", () -> gapAnalyzer.analyze(project));
  }

  private ValidationReport validate(Project project, boolean strict, Set<ComplianceStandard> standards) {
    ValidationReport report = timed("engine.validate", () -> validator.validate(project, strict, standards));
    metrics.observe("engine.validate.errors", report.errorCount());
    metrics.observe("engine.validate.warnings", report.warningCount());
    metrics.increment(report.valid() ? "engine.validate.valid" : "engine.validate.invalid");
    return report;
  }

  private List<PolicyViolation> evaluatePolicies(Project project, Set<ComplianceStandard> standards) {
    List<PolicyViolation> violations = timed("engine.policy", () -> policyEvaluator.evaluate(project, standards));
    metrics.observe("engine.policy.violations", violations.size());
    return violations;
  }

  private <T> T timed(String prefix, Supplier<T> stage) {
    long start = System.nanoTime();
    try {
      T result = stage.get();
      metrics.increment(prefix + ".success");
      return result;
    } catch (RuntimeException ex) {
      metrics.increment(prefix + ".failure");
      throw ex;
    } finally {
      metrics.observe(prefix + ".latencyNanos", System.nanoTime() - start);
    }
  }

  private static Set<ComplianceStandard> activeStandards(Project project, AssessmentOptions options) {
    if (options.standards() != null) {
      return options.standards();
    }
    return Set.copyOf(project.metadata().enabledStandards());
  }
}
