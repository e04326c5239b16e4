package ca.gc.cra.induform.config;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsing helpers shared by the typed command configurations.
 */
final class ConfigValues {
  /** Value of {@code standards} that disables standards filtering. */
  static final String ALL_STANDARDS = "all";

  private ConfigValues() {
    // Utility
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected true or false but was '" + value + "'");
    };
  }

  static Optional<Integer> optionalInt(String name, String value) {
    Optional<String> raw = optionalString(value);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(raw.get()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer but was '" + value + "'", ex);
    }
  }

  static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }

  /**
   * Parses a comma separated standards list.
   *
   * @return empty when the project's own standards apply; an empty set when filtering is disabled
   */
  static Optional<Set<ComplianceStandard>> parseStandards(String value) {
    Optional<String> raw = optionalString(value);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    if (raw.get().equalsIgnoreCase(ALL_STANDARDS)) {
      return Optional.of(Set.of());
    }
    Set<ComplianceStandard> standards = EnumSet.noneOf(ComplianceStandard.class);
    for (String token : raw.get().split(",")) {
      if (!token.isBlank()) {
        standards.add(ComplianceStandard.fromId(token));
      }
    }
    if (standards.isEmpty()) {
      throw new IllegalArgumentException("standards must name at least one standard");
    }
    return Optional.of(Set.copyOf(standards));
  }
}
