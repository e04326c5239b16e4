package ca.gc.cra.induform.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads InduForm CLI settings from a YAML document.
 *
 * <p>The document holds an optional {@code common} section plus one section per command. Section names are
 * matched case-insensitively and any other top-level key is rejected, so a misspelt section fails loudly instead
 * of being ignored. Values are flat: scalars become strings and lists of scalars become comma separated strings,
 * which lets {@code standards} be written either as {@code IEC62443,NERC_CIP} or as a YAML list.</p>
 */
public final class YamlConfigLoader {
  /** Section shared by every command. */
  static final String COMMON_SECTION = "common";

  /** Command sections in the order they appear in help text. */
  static final List<String> COMMAND_SECTIONS = List.of("validate", "analyze", "firewall", "vlan", "init");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and overlays the {@code command} section on the {@code common} section.
   *
   * @param path location of the YAML configuration
   * @param command command name such as {@code analyze}
   * @return flat settings for the command; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the command is unknown or the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    if (!COMMAND_SECTIONS.contains(section)) {
      throw new IllegalArgumentException("Unknown command: " + command);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Map<String, Map<String, String>> sections;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      sections = readSections(new Yaml().load(reader));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }

    Map<String, String> settings = new LinkedHashMap<>(sections.getOrDefault(COMMON_SECTION, Map.of()));
    settings.putAll(sections.getOrDefault(section, Map.of()));
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<String, String>> readSections(Object document) {
    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    if (document == null) {
      return sections;
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Config root must be a mapping of sections");
    }
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = sectionName(entry.getKey());
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Config section '" + name + "' is defined more than once");
      }
      sections.put(name, readSettings(name, entry.getValue()));
    }
    return sections;
  }

  private static String sectionName(Object key) {
    String name = key == null ? "" : key.toString().trim().toLowerCase(Locale.ROOT);
    if (!COMMON_SECTION.equals(name) && !COMMAND_SECTIONS.contains(name)) {
      throw new IllegalArgumentException("Unknown config section '" + key + "' (expected one of "
          + COMMON_SECTION + ", " + String.join(", ", COMMAND_SECTIONS) + ")");
    }
    return name;
  }

  private static Map<String, String> readSettings(String section, Object node) {
    if (node == null) {
      return Map.of();
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(section + " section must be a mapping");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(section + " section contains a blank or non-string key");
      }
      settings.put(key.trim(), settingValue(section + "." + key.trim(), entry.getValue()));
    }
    return settings;
  }

  private static String settingValue(String key, Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?>) {
      throw new IllegalArgumentException("Nested mappings are not supported for key " + key);
    }
    if (value instanceof Iterable<?> items) {
      StringJoiner joined = new StringJoiner(",");
      for (Object item : items) {
        if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
          throw new IllegalArgumentException("List for key " + key + " may only contain scalar values");
        }
        joined.add(item.toString().trim());
      }
      return joined.toString();
    }
    return value.toString();
  }
}
