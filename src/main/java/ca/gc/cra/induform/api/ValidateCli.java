package ca.gc.cra.induform.api;

import ca.gc.cra.induform.application.pipeline.AssessmentOptions;
import ca.gc.cra.induform.application.validation.ValidationReport;
import ca.gc.cra.induform.config.CompositionRoot;
import ca.gc.cra.induform.config.OutputFormat;
import ca.gc.cra.induform.config.ValidateConfig;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code validate} subcommand.
 *
 * <p>Exits {@link ExitCode#SUCCESS} when the project is valid and {@link ExitCode#VALIDATION_FAILED} when it
 * is not, so the command can gate CI pipelines.</p>
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  private static final String MODE = "validate";
  private static final String SUMMARY_USAGE =
      "usage: validate project=PATH [strict=true|false] [standards=IEC62443,PURDUE,NIST_CSF,NERC_CIP|all] "
          + "[format=text|json] [out=PATH] [config=PATH] [--strict] [--json] [--verbose]";
  private static final String HELP_TEXT = """
      InduForm project validation

      Usage:
        validate project=./induform.yaml [options]

      Required:
        project=PATH             Project document (default ./induform.yaml)

      Optional:
        strict=true|false        Treat warnings as errors (default false); same as --strict
        standards=A,B|all        Report only findings tagged with these standards; 'all' disables
                                 filtering (default: the project's compliance_standards)
        format=text|json         Output format (default text); --json is shorthand for format=json
        out=PATH                 Write the report to a file instead of stdout
        config=PATH              YAML settings with 'common' and 'validate' sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 valid, 1 invalid, 2 bad arguments, 3 I/O error, 4 malformed project or config
      """;

  private ValidateCli() {}

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
   * Executes the validate command.
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
      log.debug("Verbose logging enabled for validate CLI");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(MODE, input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    ValidateConfig config;
    try {
      config = ValidateConfig.fromMap(resolution.options());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid validate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return CommandSupport.guard(MODE, log, () -> execute(config));
  }

  private static ExitCode execute(ValidateConfig config) throws IOException {
    try (CompositionRoot root = new CompositionRoot()) {
      Project project = root.projectReader().read(config.projectPath());
      AssessmentOptions options =
          new AssessmentOptions(config.strict(), config.standards().orElse(null), Map.of());
      ValidationReport report = root.assessmentUseCase().validate(project, options);

      String document = config.format() == OutputFormat.JSON
          ? root.jsonReportWriter().validationReport(report)
          : root.textReportWriter().validationReport(project.metadata().name(), report);
      CommandSupport.emit(document, config.outputPath(), config.allowOverwrite(), log);

      log.info(
          "Validated {}: valid={}, errors={}, warnings={}, info={}",
          config.projectPath(),
          report.valid(),
          report.errorCount(),
          report.warningCount(),
          report.infoCount());
      return report.valid() ? ExitCode.SUCCESS : ExitCode.VALIDATION_FAILED;
    }
  }
}
