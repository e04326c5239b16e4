package ca.gc.cra.induform.api;

import ca.gc.cra.induform.application.vlan.VlanMapping;
import ca.gc.cra.induform.application.vlan.VlanMappingGenerator;
import ca.gc.cra.induform.config.CompositionRoot;
import ca.gc.cra.induform.config.VlanConfig;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.infrastructure.export.VlanExporter;
import ca.gc.cra.induform.logging.LoggingConfigurator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code vlan} subcommand, which assigns one VLAN per zone.
 */
public final class VlanCli {
  private static final Logger log = LoggerFactory.getLogger(VlanCli.class);
  private static final String MODE = "vlan";
  private static final String SUMMARY_USAGE =
      "usage: vlan project=PATH [format=json|csv|cisco] [startVlan=N] [out=PATH] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      InduForm VLAN mapping

      Usage:
        vlan project=./induform.yaml format=cisco out=./vlans.cfg [options]

      Required:
        project=PATH             Project document (default ./induform.yaml)

      Optional:
        format=json|csv|cisco    Output format (default json)
        startVlan=N              Assign consecutive VLANs from N (2-4094) instead of per-zone-type ranges
        out=PATH                 Write the mapping to a file instead of stdout
        config=PATH              YAML settings with 'common' and 'vlan' sections
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private VlanCli() {}

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
   * Executes the vlan command.
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
      log.debug("Verbose logging enabled for vlan CLI");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(MODE, input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    VlanConfig config;
    try {
      config = VlanConfig.fromMap(resolution.options());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid vlan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return CommandSupport.guard(MODE, log, () -> execute(config));
  }

  private static ExitCode execute(VlanConfig config) throws IOException {
    try (CompositionRoot root = new CompositionRoot()) {
      Project project = root.projectReader().read(config.projectPath());
      VlanMappingGenerator generator = root.vlanMappingGenerator();
      VlanMapping mapping = config.startVlan().isPresent()
          ? generator.generate(project, config.startVlan().get())
          : generator.generate(project);
      VlanExporter exporter = root.vlanExporter();
      String document = switch (config.format()) {
        case CSV -> exporter.exportCsv(mapping);
        case CISCO -> exporter.exportCisco(mapping);
        default -> root.jsonReportWriter().vlanMapping(mapping);
      };
      CommandSupport.emit(document, config.outputPath(), config.allowOverwrite(), log);
      log.info("Assigned {} VLAN(s) for {}", mapping.assignments().size(), config.projectPath());
      return ExitCode.SUCCESS;
    }
  }
}
