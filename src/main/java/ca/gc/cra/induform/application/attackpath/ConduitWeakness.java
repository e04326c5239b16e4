package ca.gc.cra.induform.application.attackpath;

import java.util.Objects;

/**
 * One exploitable weakness found on a traversed conduit.
 *
 * @param type weakness category
 * @param description what makes the conduit weak
 * @param remediation suggested fix
 * @param severityContribution share of path risk attributed to the weakness, between 0 and 1
 * @since 0.1.0
 */
public record ConduitWeakness(WeaknessType type, String description, String remediation, double severityContribution) {
  public ConduitWeakness {
    type = Objects.requireNonNull(type, "type");
    description = Objects.requireNonNull(description, "description");
    remediation = Objects.requireNonNull(remediation, "remediation");
    if (severityContribution < 0.0 || severityContribution > 1.0) {
      throw new IllegalArgumentException(
          "weakness.severity_contribution must be between 0 and 1 (was " + severityContribution + ")");
    }
  }
}
