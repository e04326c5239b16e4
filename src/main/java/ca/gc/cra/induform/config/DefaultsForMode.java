package ca.gc.cra.induform.config;

import ca.gc.cra.induform.application.attackpath.AttackPathAnalyzer;
import ca.gc.cra.induform.application.firewall.FirewallOptions;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each InduForm CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI invocations.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command (validate, analyze, firewall, vlan, init)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "validate" -> buildValidateDefaults();
      case "analyze" -> buildAnalyzeDefaults();
      case "firewall" -> buildFirewallDefaults();
      case "vlan" -> buildVlanDefaults();
      case "init" -> buildInitDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    // Short-lived CLI runs export nothing unless asked to.
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildValidateDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("project", InitConfig.DEFAULT_FILE);
    map.put("strict", "false");
    map.put("standards", "");
    map.put("format", "text");
    map.put("out", "");
    map.put("allowOverwrite", "true");
    return map;
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("project", InitConfig.DEFAULT_FILE);
    map.put("analysis", "all");
    map.put("strict", "false");
    map.put("standards", "");
    map.put("vulnerabilities", "");
    map.put("maxPaths", Integer.toString(AttackPathAnalyzer.DEFAULT_MAX_PATHS));
    map.put("out", "");
    map.put("allowOverwrite", "true");
    return map;
  }

  private static Map<String, String> buildFirewallDefaults() {
    FirewallOptions defaults = FirewallOptions.DEFAULTS;
    Map<String, String> map = new LinkedHashMap<>();
    map.put("project", InitConfig.DEFAULT_FILE);
    map.put("format", "json");
    map.put("includeDeny", Boolean.toString(defaults.includeDenyRules()));
    map.put("logAllowed", Boolean.toString(defaults.logAllowed()));
    map.put("logDenied", Boolean.toString(defaults.logDenied()));
    map.put("out", "");
    map.put("allowOverwrite", "true");
    return map;
  }

  private static Map<String, String> buildVlanDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("project", InitConfig.DEFAULT_FILE);
    map.put("format", "json");
    // Blank start assigns from the per-zone-type ranges.
    map.put("startVlan", "");
    map.put("out", "");
    map.put("allowOverwrite", "true");
    return map;
  }

  private static Map<String, String> buildInitDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", InitConfig.DEFAULT_NAME);
    map.put("out", InitConfig.DEFAULT_FILE);
    map.put("allowOverwrite", "false");
    return map;
  }
}
