package ca.gc.cra.induform.config;

import ca.gc.cra.induform.application.attackpath.AttackPathAnalyzer;
import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.validation.Numbers;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration for the {@code analyze} command.
 *
 * @param projectPath project document to analyze
 * @param analysis engines to run
 * @param strict whether validation warnings make the project invalid in combined output
 * @param standards standards used to filter findings; empty uses the project's own standards
 * @param vulnerabilitiesPath optional YAML document of vulnerabilities keyed by zone id
 * @param maxPaths attack paths reported by {@link AnalysisType#ATTACK_PATHS}, at least 1
 * @param outputPath optional JSON report file; stdout when empty
 * @param allowOverwrite whether an existing report file may be replaced
 * @since 0.1.0
 */
public record AnalyzeConfig(
    Path projectPath,
    AnalysisType analysis,
    boolean strict,
    Optional<Set<ComplianceStandard>> standards,
    Optional<Path> vulnerabilitiesPath,
    int maxPaths,
    Optional<Path> outputPath,
    boolean allowOverwrite) {

  public AnalyzeConfig {
    Objects.requireNonNull(projectPath, "projectPath");
    Objects.requireNonNull(analysis, "analysis");
    standards = Objects.requireNonNull(standards, "standards").map(Set::copyOf);
    Objects.requireNonNull(vulnerabilitiesPath, "vulnerabilitiesPath");
    Numbers.requireRange("maxPaths", maxPaths, 1, Integer.MAX_VALUE);
    Objects.requireNonNull(outputPath, "outputPath");
  }

  /**
   * Builds a configuration from flattened {@code key=value} options.
   *
   * @param options merged options, usually from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException if any option is malformed
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String project = ConfigValues.firstNonBlank(options, "project", "in");
    if (project == null) {
      throw new IllegalArgumentException("project is required");
    }
    return new AnalyzeConfig(
        ConfigValues.parsePath("project", project),
        AnalysisType.fromString(options.get("analysis")),
        ConfigValues.parseBoolean(options.get("strict"), false),
        ConfigValues.parseStandards(options.get("standards")),
        ConfigValues.optionalPath("vulnerabilities", ConfigValues.firstNonBlank(options, "vulnerabilities", "vulns")),
        ConfigValues.optionalInt("maxPaths", options.get("maxPaths")).orElse(AttackPathAnalyzer.DEFAULT_MAX_PATHS),
        ConfigValues.optionalPath("out", options.get("out")),
        ConfigValues.parseBoolean(options.get("allowOverwrite"), true));
  }
}
