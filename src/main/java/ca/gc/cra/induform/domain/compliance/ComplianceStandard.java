package ca.gc.cra.induform.domain.compliance;

import java.util.Locale;

/**
 * <strong>What:</strong> Compliance frameworks that validation checks and policy rules can be attributed to.
 * <p><strong>Why:</strong> Projects enable a subset of frameworks; diagnostics outside that subset are filtered.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ComplianceStandard {
  IEC62443("IEC 62443",
      "Industrial automation and control systems security standard. Defines security levels, zones, and conduits."),
  PURDUE("Purdue Model",
      "Reference architecture for industrial network segmentation with hierarchical levels from enterprise "
          + "to safety."),
  NIST_CSF("NIST CSF",
      "NIST Cybersecurity Framework for identifying, protecting, detecting, responding, and recovering from "
          + "cyber threats."),
  NERC_CIP("NERC CIP",
      "Critical Infrastructure Protection standards for bulk electric system cybersecurity.");

  private final String displayName;
  private final String description;

  ComplianceStandard(String displayName, String description) {
    this.displayName = displayName;
    this.description = description;
  }

  /**
   * Returns the human-readable framework name.
   *
   * @return display name such as {@code "NIST CSF"}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns a one-line description of the framework.
   *
   * @return description text
   */
  public String description() {
    return description;
  }

  /**
   * Resolves a standard from its identifier (case-insensitive, hyphens treated as underscores).
   *
   * @param raw identifier such as {@code "IEC62443"} or {@code "nist-csf"}; must not be {@code null}
   * @return matching standard
   * @throws IllegalArgumentException if no standard matches
   */
  public static ComplianceStandard fromId(String raw) {
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (ComplianceStandard standard : values()) {
      if (standard.name().equals(normalized)) {
        return standard;
      }
    }
    throw new IllegalArgumentException("Unknown compliance standard: " + raw);
  }
}
