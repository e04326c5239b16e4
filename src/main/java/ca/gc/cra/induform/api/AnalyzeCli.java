package ca.gc.cra.induform.api;

import ca.gc.cra.induform.application.pipeline.AssessmentOptions;
import ca.gc.cra.induform.application.pipeline.ProjectAssessmentUseCase;
import ca.gc.cra.induform.application.risk.VulnerabilityInfo;
import ca.gc.cra.induform.config.AnalyzeConfig;
import ca.gc.cra.induform.config.CompositionRoot;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.infrastructure.export.JsonReportWriter;
import ca.gc.cra.induform.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code analyze} subcommand: policy evaluation, risk scoring, control resolution,
 * attack paths and gap analysis rendered as JSON.
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String MODE = "analyze";
  private static final String SUMMARY_USAGE =
      "usage: analyze project=PATH [analysis=policies|risk|controls|attack_paths|gaps|all] "
          + "[vulnerabilities=PATH] [maxPaths=N] "
          + "[standards=A,B|all] [strict=true|false] [out=PATH] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      InduForm project analysis

      Usage:
        analyze project=./induform.yaml analysis=risk [options]

      Required:
        project=PATH             Project document (default ./induform.yaml)

      Optional:
        analysis=TYPE            policies | risk | controls | attack_paths | gaps | all (default all)
        vulnerabilities=PATH     YAML mapping zone ids to CVE findings; weights zone risk
        maxPaths=N               Attack paths reported by analysis=attack_paths (default 10)
        standards=A,B|all        Standards used to filter validation and policy findings
        strict=true|false        Strict validation in combined output (default false)
        out=PATH                 Write the JSON document to a file instead of stdout
        config=PATH              YAML settings with 'common' and 'analyze' sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private AnalyzeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the analyze command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(MODE, input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    AnalyzeConfig config;
    try {
      config = AnalyzeConfig.fromMap(resolution.options());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return CommandSupport.guard(MODE, log, () -> execute(config));
  }

  private static ExitCode execute(AnalyzeConfig config) throws IOException {
    try (CompositionRoot root = new CompositionRoot()) {
      Project project = root.projectReader().read(config.projectPath());
      Map<String, List<VulnerabilityInfo>> vulnerabilities = Map.of();
      if (config.vulnerabilitiesPath().isPresent()) {
        Path path = config.vulnerabilitiesPath().get();
        vulnerabilities = root.vulnerabilityReader().read(path);
        warnUnknownZones(project, vulnerabilities);
      }
      AssessmentOptions options =
          new AssessmentOptions(config.strict(), config.standards().orElse(null), vulnerabilities);

      ProjectAssessmentUseCase useCase = root.assessmentUseCase();
      JsonReportWriter json = root.jsonReportWriter();
      String document = switch (config.analysis()) {
        case POLICIES -> json.policyViolations(useCase.evaluatePolicies(project, options));
        case RISK -> json.riskAssessment(useCase.assessRisk(project, options));
        case CONTROLS -> json.controls(useCase.resolve(project));
        case ATTACK_PATHS -> json.attackPaths(useCase.findAttackPaths(project, config.maxPaths()));
        case GAPS -> json.gapAnalysis(useCase.analyzeGaps(project));
        case ALL -> json.assessment(useCase.assess(project, options));
      };
      CommandSupport.emit(document, config.outputPath(), config.allowOverwrite(), log);
      log.info(
          "Analysis '{}' completed for {}",
          config.analysis().name().toLowerCase(Locale.ROOT),
          config.projectPath());
      return ExitCode.SUCCESS;
    }
  }

  private static void warnUnknownZones(Project project, Map<String, List<VulnerabilityInfo>> vulnerabilities) {
    for (String zoneId : vulnerabilities.keySet()) {
      if (project.zone(zoneId).isEmpty()) {
        log.warn("Vulnerabilities listed for unknown zone '{}' are ignored", zoneId);
      }
    }
  }
}
