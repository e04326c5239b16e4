package ca.gc.cra.induform.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final Map<String, Set<String>> FORMATS_BY_MODE = Map.of(
      "validate", Set.of("text", "json"),
      "analyze", Set.of("json"),
      "firewall", Set.of("json", "iptables"),
      "vlan", Set.of("json", "csv", "cisco"));

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // "in" is an alias of "project"; an explicit alias must not lose to a lower-precedence project value.
    if (cliCopy.containsKey("in") && !cliCopy.containsKey("project")) {
      merged.remove("project");
    }
    if (cliCopy.containsKey("vulns") && !cliCopy.containsKey("vulnerabilities")) {
      merged.remove("vulnerabilities");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Set<String> formats = FORMATS_BY_MODE.get(normalizedMode);
    String format = trim(effective.get("format")).toLowerCase(Locale.ROOT);
    if (formats != null && !format.isEmpty() && !formats.contains(format)) {
      throw new IllegalArgumentException(
          "format=" + format + " is not supported by " + normalizedMode + " (expected one of "
              + String.join(", ", formats.stream().sorted().toList()) + ")");
    }
    if ("analyze".equals(normalizedMode)) {
      AnalysisType.fromString(effective.get("analysis"));
    }
    if (!"init".equals(normalizedMode)
        && trim(effective.get("project")).isEmpty()
        && trim(effective.get("in")).isEmpty()) {
      throw new IllegalArgumentException("project is required for " + normalizedMode);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
