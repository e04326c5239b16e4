package ca.gc.cra.induform.config;

import ca.gc.cra.induform.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for the {@code init} command.
 *
 * @param projectName name written into the starter project
 * @param outputPath destination of the starter project YAML
 * @param allowOverwrite whether an existing file may be replaced ({@code --force})
 * @since 0.1.0
 */
public record InitConfig(String projectName, Path outputPath, boolean allowOverwrite) {
  /** Project name used when none is supplied. */
  public static final String DEFAULT_NAME = "My OT Project";
  /** File name used when no output path is supplied. */
  public static final String DEFAULT_FILE = "induform.yaml";

  public InitConfig {
    projectName = Strings.requireNonBlank("name", projectName);
    Objects.requireNonNull(outputPath, "outputPath");
  }

  /**
   * Builds a configuration from flattened {@code key=value} options.
   *
   * @param options merged options, usually from {@link ConfigMerger}
   * @return validated configuration
   */
  public static InitConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String name = ConfigValues.optionalString(options.get("name")).orElse(DEFAULT_NAME);
    String out = ConfigValues.optionalString(options.get("out")).orElse(DEFAULT_FILE);
    return new InitConfig(
        name,
        ConfigValues.parsePath("out", out),
        ConfigValues.parseBoolean(options.get("allowOverwrite"), false));
  }
}
