package ca.gc.cra.induform.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for the {@code vlan} command.
 *
 * @param projectPath project document to assign VLANs for
 * @param format {@link OutputFormat#JSON}, {@link OutputFormat#CSV} or {@link OutputFormat#CISCO}
 * @param startVlan first id for sequential assignment; empty assigns from per-zone-type ranges
 * @param outputPath optional mapping file; stdout when empty
 * @param allowOverwrite whether an existing mapping file may be replaced
 * @since 0.1.0
 */
public record VlanConfig(
    Path projectPath,
    OutputFormat format,
    Optional<Integer> startVlan,
    Optional<Path> outputPath,
    boolean allowOverwrite) {

  public VlanConfig {
    Objects.requireNonNull(projectPath, "projectPath");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(startVlan, "startVlan");
    Objects.requireNonNull(outputPath, "outputPath");
    if (format != OutputFormat.JSON && format != OutputFormat.CSV && format != OutputFormat.CISCO) {
      throw new IllegalArgumentException("vlan supports format=json, format=csv or format=cisco");
    }
  }

  /**
   * Builds a configuration from flattened {@code key=value} options.
   *
   * @param options merged options, usually from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException if any option is malformed
   */
  public static VlanConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String project = ConfigValues.firstNonBlank(options, "project", "in");
    if (project == null) {
      throw new IllegalArgumentException("project is required");
    }
    return new VlanConfig(
        ConfigValues.parsePath("project", project),
        OutputFormat.fromString(options.get("format"), OutputFormat.JSON),
        ConfigValues.optionalInt("startVlan", options.get("startVlan")),
        ConfigValues.optionalPath("out", options.get("out")),
        ConfigValues.parseBoolean(options.get("allowOverwrite"), true));
  }
}
