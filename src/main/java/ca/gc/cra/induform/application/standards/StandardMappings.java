package ca.gc.cra.induform.application.standards;

import static ca.gc.cra.induform.domain.compliance.ComplianceStandard.IEC62443;
import static ca.gc.cra.induform.domain.compliance.ComplianceStandard.NERC_CIP;
import static ca.gc.cra.induform.domain.compliance.ComplianceStandard.NIST_CSF;
import static ca.gc.cra.induform.domain.compliance.ComplianceStandard.PURDUE;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Static attribution of validation check codes and policy rule ids to compliance standards.
 * <p><strong>Why:</strong> Reports are filtered to the frameworks a project enables; the tagging never changes how
 * a check or rule evaluates.</p>
 * <p><strong>Thread-safety:</strong> Tables are immutable.</p>
 *
 * @since 0.1.0
 */
public final class StandardMappings {
  /** Validation check code to applicable standards. */
  public static final Map<String, Set<ComplianceStandard>> VALIDATION_CHECK_STANDARDS = Map.ofEntries(
      Map.entry("ZONE_CIRCULAR_REF", Set.of(IEC62443)),
      Map.entry("CONDUIT_SL_INSUFFICIENT", Set.of(IEC62443)),
      Map.entry("CONDUIT_INSPECTION_RECOMMENDED", Set.of(IEC62443)),
      Map.entry("PURDUE_NON_ADJACENT", Set.of(PURDUE)),
      Map.entry("DMZ_BYPASS", Set.of(IEC62443, PURDUE)),
      Map.entry("DMZ_MISSING", Set.of(IEC62443, PURDUE)),
      Map.entry("CELL_ISOLATION_VIOLATION", Set.of(IEC62443, PURDUE)),
      Map.entry("PROTOCOL_NOT_IN_ALLOWLIST", Set.of(IEC62443)),
      Map.entry("CRITICAL_ASSET_LOW_SL", Set.of(IEC62443, NIST_CSF, NERC_CIP)),
      Map.entry("ZONE_NO_CONDUITS", Set.of(IEC62443, PURDUE, NIST_CSF)),
      Map.entry("CONDUIT_NO_FLOWS", Set.of(IEC62443)),
      Map.entry("SAFETY_ZONE_NON_SAFETY_ASSET", Set.of(IEC62443)),
      Map.entry("NIST_ASSET_INVENTORY_GAP", Set.of(NIST_CSF)),
      Map.entry("CIP_ESP_MISSING", Set.of(NERC_CIP)));

  /** Policy rule id to applicable standards. */
  public static final Map<String, Set<ComplianceStandard>> POLICY_RULE_STANDARDS = Map.ofEntries(
      Map.entry("POL-001", Set.of(IEC62443)),
      Map.entry("POL-002", Set.of(IEC62443)),
      Map.entry("POL-003", Set.of(IEC62443)),
      Map.entry("POL-004", Set.of(IEC62443, PURDUE)),
      Map.entry("POL-005", Set.of(IEC62443, PURDUE)),
      Map.entry("POL-006", Set.of(IEC62443)),
      Map.entry("POL-007", Set.of(PURDUE)),
      Map.entry("NIST-001", Set.of(NIST_CSF)),
      Map.entry("CIP-001", Set.of(NERC_CIP)),
      Map.entry("CIP-002", Set.of(NERC_CIP)));

  private StandardMappings() {
    // Utility
  }

  /**
   * Returns the standards a validation check is attributed to.
   *
   * @param code check code
   * @return standards, or {@link ComplianceStandard#IEC62443} alone for unmapped codes
   */
  public static Set<ComplianceStandard> standardsForCheck(String code) {
    return VALIDATION_CHECK_STANDARDS.getOrDefault(code, Set.of(IEC62443));
  }

  /**
   * Returns the standards a policy rule is attributed to.
   *
   * @param ruleId rule id
   * @return standards, or {@link ComplianceStandard#IEC62443} alone for unmapped rules
   */
  public static Set<ComplianceStandard> standardsForRule(String ruleId) {
    return POLICY_RULE_STANDARDS.getOrDefault(ruleId, Set.of(IEC62443));
  }

  /**
   * Tests whether a set of standards overlaps the active standards.
   *
   * @param standards standards of a check or rule
   * @param active enabled standards; empty means everything applies
   * @return {@code true} when the finding should be reported
   */
  public static boolean appliesTo(Set<ComplianceStandard> standards, Collection<ComplianceStandard> active) {
    if (active == null || active.isEmpty()) {
      return true;
    }
    return !Collections.disjoint(standards, active);
  }
}
