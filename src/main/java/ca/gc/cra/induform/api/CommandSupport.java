package ca.gc.cra.induform.api;

import ca.gc.cra.induform.config.ConfigMerger;
import ca.gc.cra.induform.config.DefaultsForMode;
import ca.gc.cra.induform.config.YamlConfigLoader;
import ca.gc.cra.induform.logging.LoggingConfigurator;
import ca.gc.cra.induform.validation.Paths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps of every subcommand: option resolution, output writing and failure mapping.
 */
final class CommandSupport {

  private CommandSupport() {
    // Utility
  }

  /**
   * Outcome of option resolution; either merged options or the exit code to return.
   */
  record Resolution(Map<String, String> options, ExitCode failure) {
    boolean failed() {
      return failure != null;
    }

    static Resolution fail(ExitCode code) {
      return new Resolution(Map.of(), code);
    }
  }

  @FunctionalInterface
  interface Command {
    ExitCode execute() throws IOException;
  }

  /**
   * Merges defaults, an optional {@code config=PATH} YAML file, CLI options and shorthand flags, then applies
   * telemetry settings.
   *
   * @param mode subcommand name
   * @param input parsed CLI input
   * @param usage usage line printed on argument errors
   * @param log logger of the calling command
   * @return merged options with telemetry keys removed, or the failure exit code
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    List<String> unknown = input.unknownFlags();
    if (!unknown.isEmpty()) {
      log.error("Unknown flag: {}", unknown.get(0));
      CliPrinter.println(usage);
      return Resolution.fail(ExitCode.INVALID_ARGS);
    }

    Map<String, String> cli;
    try {
      cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.fail(ExitCode.INVALID_ARGS);
    }
    cli.putAll(input.flagOptions());

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(cli);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.fail(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolution.fail(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.fail(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> options;
    try {
      options = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn));
      if (!input.verbose() && Boolean.parseBoolean(options.getOrDefault("verbose", "false").trim())) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(options);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.fail(ExitCode.INVALID_ARGS);
    }
    return new Resolution(Map.copyOf(options), null);
  }

  /**
   * Runs a command body and maps its failures onto exit codes.
   *
   * @param mode subcommand name for log messages
   * @param log logger of the calling command
   * @param command body to run
   * @return exit code of the body, or the code matching its failure
   */
  static ExitCode guard(String mode, Logger log, Command command) {
    try {
      return command.execute();
    } catch (NoSuchFileException ex) {
      log.error("File not found: {}", ex.getFile());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("{} failed with an I/O error", mode, ex);
      return ExitCode.IO_ERROR;
    } catch (UncheckedIOException ex) {
      log.error("{} failed with an I/O error", mode, ex.getCause());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("{}: {}", mode, ex.getMessage());
      log.debug("{} configuration failure", mode, ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Writes a rendered document to {@code out}, or to stdout when no output file was requested.
   *
   * @throws IllegalArgumentException if the output path is unusable or exists without overwrite approval
   * @throws IOException if the file cannot be written
   */
  static void emit(String document, Optional<Path> out, boolean allowOverwrite, Logger log) throws IOException {
    if (out.isEmpty()) {
      CliPrinter.printDocument(document);
      return;
    }
    Path target = Paths.validateOutputFile(out.get(), allowOverwrite);
    String content = document.endsWith("\n") ? document : document + "\n";
    Files.writeString(target, content, StandardCharsets.UTF_8);
    log.info("Wrote {}", target);
  }

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }
}
