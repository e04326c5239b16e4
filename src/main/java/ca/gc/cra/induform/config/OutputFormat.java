package ca.gc.cra.induform.config;

import java.util.Locale;

/**
 * Rendering format for command output.
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  /** Human readable lines for terminals. */
  TEXT,
  /** JSON documents with snake_case keys. */
  JSON,
  /** iptables-restore script; firewall command only. */
  IPTABLES,
  /** Comma separated values; vlan command only. */
  CSV,
  /** Cisco IOS configuration snippet; vlan command only. */
  CISCO;

  /**
   * Parses a format name case-insensitively.
   *
   * @param value textual format; blank values yield {@code fallback}
   * @param fallback format used when {@code value} is blank
   * @return parsed format
   * @throws IllegalArgumentException if the value is not a known format
   */
  public static OutputFormat fromString(String value, OutputFormat fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown format: " + value, ex);
    }
  }
}
