package ca.gc.cra.induform.api;

import ca.gc.cra.induform.application.port.MetricsPort;
import ca.gc.cra.induform.config.CompositionRoot;
import ca.gc.cra.induform.config.InitConfig;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectMetadata;
import ca.gc.cra.induform.logging.LoggingConfigurator;
import ca.gc.cra.induform.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code init} subcommand, which writes a starter project document.
 */
public final class InitCli {
  private static final Logger log = LoggerFactory.getLogger(InitCli.class);
  private static final String MODE = "init";
  private static final String STARTER_DESCRIPTION = "Auto-generated InduForm project";
  private static final String SUMMARY_USAGE = "usage: init [name=NAME] [out=PATH] [--force] [--verbose]";
  private static final String HELP_TEXT = """
      InduForm project initialization

      Usage:
        init name="Plant A" out=./induform.yaml

      Optional:
        name=NAME                Project name (default "My OT Project")
        out=PATH                 Destination file (default ./induform.yaml)
        --force                  Overwrite an existing file
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private InitCli() {}

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
   * Executes the init command.
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
      log.debug("Verbose logging enabled for init CLI");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(MODE, input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    InitConfig config;
    Path target;
    try {
      config = InitConfig.fromMap(resolution.options());
      target = Paths.validateOutputFile(config.outputPath(), config.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid init arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return CommandSupport.guard(MODE, log, () -> execute(config, target));
  }

  static Project starterProject(String name) {
    ProjectMetadata metadata = new ProjectMetadata(
        name, STARTER_DESCRIPTION, ProjectMetadata.DEFAULT_STANDARDS, List.of(), null, null);
    return new Project(Project.SCHEMA_VERSION, metadata, List.of(), List.of());
  }

  private static ExitCode execute(InitConfig config, Path target) throws IOException {
    try (CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP)) {
      root.projectWriter().write(starterProject(config.projectName()), target);
    }
    log.info("Created {}", target);
    CliPrinter.printLines(
        "Created " + target,
        "",
        "Next steps:",
        "  1. Edit the file to add zones, assets and conduits",
        "  2. Run 'induform validate project=" + target.getFileName() + "' to check it",
        "  3. Run 'induform analyze project=" + target.getFileName() + "' for policies, risk and controls");
    return ExitCode.SUCCESS;
  }
}
