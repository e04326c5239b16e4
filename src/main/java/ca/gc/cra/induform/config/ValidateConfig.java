package ca.gc.cra.induform.config;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration for the {@code validate} command.
 *
 * @param projectPath project document to validate
 * @param strict whether warnings make the project invalid
 * @param standards standards used to filter findings; empty uses the project's own standards and an empty set
 *     disables filtering
 * @param format {@link OutputFormat#TEXT} or {@link OutputFormat#JSON}
 * @param outputPath optional report file; stdout when empty
 * @param allowOverwrite whether an existing report file may be replaced
 * @since 0.1.0
 */
public record ValidateConfig(
    Path projectPath,
    boolean strict,
    Optional<Set<ComplianceStandard>> standards,
    OutputFormat format,
    Optional<Path> outputPath,
    boolean allowOverwrite) {

  public ValidateConfig {
    Objects.requireNonNull(projectPath, "projectPath");
    standards = Objects.requireNonNull(standards, "standards").map(Set::copyOf);
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(outputPath, "outputPath");
    if (format != OutputFormat.TEXT && format != OutputFormat.JSON) {
      throw new IllegalArgumentException("validate supports format=text or format=json");
    }
  }

  /**
   * Builds a configuration from flattened {@code key=value} options.
   *
   * @param options merged options, usually from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException if any option is malformed
   */
  public static ValidateConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String project = ConfigValues.firstNonBlank(options, "project", "in");
    if (project == null) {
      throw new IllegalArgumentException("project is required");
    }
    return new ValidateConfig(
        ConfigValues.parsePath("project", project),
        ConfigValues.parseBoolean(options.get("strict"), false),
        ConfigValues.parseStandards(options.get("standards")),
        OutputFormat.fromString(options.get("format"), OutputFormat.TEXT),
        ConfigValues.optionalPath("out", options.get("out")),
        ConfigValues.parseBoolean(options.get("allowOverwrite"), true));
  }
}
