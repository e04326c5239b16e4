package ca.gc.cra.induform.api;

import ca.gc.cra.induform.application.firewall.FirewallRuleset;
import ca.gc.cra.induform.config.CompositionRoot;
import ca.gc.cra.induform.config.FirewallConfig;
import ca.gc.cra.induform.config.OutputFormat;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.logging.LoggingConfigurator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code firewall} subcommand, which derives zone-to-zone rules from conduit flows.
 */
public final class FirewallCli {
  private static final Logger log = LoggerFactory.getLogger(FirewallCli.class);
  private static final String MODE = "firewall";
  private static final String SUMMARY_USAGE =
      "usage: firewall project=PATH [format=json|iptables] [includeDeny=true|false] "
          + "[logAllowed=true|false] [logDenied=true|false] [out=PATH] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      InduForm firewall rule generation

      Usage:
        firewall project=./induform.yaml format=iptables out=./rules.v4 [options]

      Required:
        project=PATH             Project document (default ./induform.yaml)

      Optional:
        format=json|iptables     Output format (default json)
        includeDeny=true|false   Emit explicit deny rules between all zone pairs (default true)
        logAllowed=true|false    Log traffic matched by allow rules (default false)
        logDenied=true|false     Log traffic matched by deny rules (default true)
        out=PATH                 Write the ruleset to a file instead of stdout
        config=PATH              YAML settings with 'common' and 'firewall' sections
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private FirewallCli() {}

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
   * Executes the firewall command.
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
      log.debug("Verbose logging enabled for firewall CLI");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve(MODE, input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    FirewallConfig config;
    try {
      config = FirewallConfig.fromMap(resolution.options());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid firewall arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return CommandSupport.guard(MODE, log, () -> execute(config));
  }

  private static ExitCode execute(FirewallConfig config) throws IOException {
    try (CompositionRoot root = new CompositionRoot()) {
      Project project = root.projectReader().read(config.projectPath());
      FirewallRuleset ruleset = root.firewallRuleGenerator().generate(project, config.options());
      String document = config.format() == OutputFormat.IPTABLES
          ? root.iptablesExporter().export(ruleset)
          : root.jsonReportWriter().firewallRuleset(ruleset);
      CommandSupport.emit(document, config.outputPath(), config.allowOverwrite(), log);
      log.info("Generated {} firewall rules for {}", ruleset.rules().size(), config.projectPath());
      return ExitCode.SUCCESS;
    }
  }
}
