package ca.gc.cra.induform.api;

import ca.gc.cra.induform.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * InduForm command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: induform <validate|analyze|firewall|vlan|init> [options]";
  private static final String HELP_TEXT = """
      InduForm - IEC 62443 zone/conduit security for OT networks

      Usage:
        induform <command> [key=value ...] [flags]

      Commands:
        validate    Check a project against zone, conduit and standards rules
        analyze     Evaluate policies, score risk, resolve controls, trace attack paths, find gaps (JSON)
        firewall    Generate firewall rules from conduit flows (JSON or iptables)
        vlan        Assign a VLAN per zone (JSON, CSV or Cisco IOS)
        init        Write a starter project file

      Global flags:
        --help      Show this message (or '<command> --help' for command options)
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);

    return switch (command) {
      case "validate" -> ValidateCli.run(delegateArgs);
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "firewall" -> FirewallCli.run(delegateArgs);
      case "vlan" -> VlanCli.run(delegateArgs);
      case "init" -> InitCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
