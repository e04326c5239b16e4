package ca.gc.cra.induform.config;

import java.util.Locale;

/**
 * Selects which engine the {@code analyze} command runs.
 *
 * @since 0.1.0
 */
public enum AnalysisType {
  /** Policy rule evaluation only. */
  POLICIES,
  /** Risk scoring only. */
  RISK,
  /** Security control resolution only. */
  CONTROLS,
  /** Cheapest attack paths from entry zones to high-value zones. */
  ATTACK_PATHS,
  /** IEC 62443-3-3 control gap analysis per zone. */
  GAPS,
  /** Validation, policies, risk and controls in one combined document. */
  ALL;

  /**
   * Parses an analysis name case-insensitively.
   *
   * @param value textual analysis type, hyphens read as underscores; blank values yield {@link #ALL}
   * @return parsed analysis type
   * @throws IllegalArgumentException if the value is not a known analysis type
   */
  public static AnalysisType fromString(String value) {
    if (value == null || value.isBlank()) {
      return ALL;
    }
    try {
      return AnalysisType.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown analysis: " + value, ex);
    }
  }
}
