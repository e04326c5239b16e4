package ca.gc.cra.induform.config;

import ca.gc.cra.induform.application.firewall.FirewallOptions;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for the {@code firewall} command.
 *
 * @param projectPath project document to derive rules from
 * @param format {@link OutputFormat#JSON} or {@link OutputFormat#IPTABLES}
 * @param options rule generation knobs
 * @param outputPath optional ruleset file; stdout when empty
 * @param allowOverwrite whether an existing ruleset file may be replaced
 * @since 0.1.0
 */
public record FirewallConfig(
    Path projectPath,
    OutputFormat format,
    FirewallOptions options,
    Optional<Path> outputPath,
    boolean allowOverwrite) {

  public FirewallConfig {
    Objects.requireNonNull(projectPath, "projectPath");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(outputPath, "outputPath");
    if (format != OutputFormat.JSON && format != OutputFormat.IPTABLES) {
      throw new IllegalArgumentException("firewall supports format=json or format=iptables");
    }
  }

  /**
   * Builds a configuration from flattened {@code key=value} options.
   *
   * @param options merged options, usually from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException if any option is malformed
   */
  public static FirewallConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String project = ConfigValues.firstNonBlank(options, "project", "in");
    if (project == null) {
      throw new IllegalArgumentException("project is required");
    }
    FirewallOptions defaults = FirewallOptions.DEFAULTS;
    FirewallOptions generation = new FirewallOptions(
        ConfigValues.parseBoolean(options.get("includeDeny"), defaults.includeDenyRules()),
        ConfigValues.parseBoolean(options.get("logAllowed"), defaults.logAllowed()),
        ConfigValues.parseBoolean(options.get("logDenied"), defaults.logDenied()));
    return new FirewallConfig(
        ConfigValues.parsePath("project", project),
        OutputFormat.fromString(options.get("format"), OutputFormat.JSON),
        generation,
        ConfigValues.optionalPath("out", options.get("out")),
        ConfigValues.parseBoolean(options.get("allowOverwrite"), true));
  }
}
