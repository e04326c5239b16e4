package ca.gc.cra.induform.application.risk;

import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.security.SecurityLevels;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives mitigation advice from zone risks and optional vulnerability data.
 *
 * @since 0.1.0
 */
final class RiskRecommendations {
  private static final int SL1_CONNECTION_LIMIT = 3;

  private RiskRecommendations() {
    // Utility
  }

  static List<String> generate(
      Project project, List<ZoneRisk> zoneRisks, Map<String, List<VulnerabilityInfo>> vulnerabilities) {
    List<String> out = new ArrayList<>();

    List<String> critical = new ArrayList<>();
    List<String> high = new ArrayList<>();
    for (ZoneRisk risk : zoneRisks) {
      if (risk.level() == RiskLevel.CRITICAL) {
        critical.add(risk.zoneId());
      } else if (risk.level() == RiskLevel.HIGH) {
        high.add(risk.zoneId());
      }
    }
    if (!critical.isEmpty()) {
      out.add("URGENT: Zones with critical risk level require immediate attention: " + String.join(", ", critical));
    }
    if (!high.isEmpty()) {
      out.add("Zones with high risk level should be prioritized for security improvements: "
          + String.join(", ", high));
    }

    for (Zone zone : project.zones()) {
      int connections = project.conduitsForZone(zone.id()).size();
      if (zone.securityLevelTarget() == 1 && connections >= SL1_CONNECTION_LIMIT) {
        out.add("Zone '" + zone.id() + "' has SL-T=1 with " + connections + " connections. "
            + "Consider increasing the security level or reducing connectivity.");
      }
    }

    for (Conduit conduit : project.conduits()) {
      int gap = SecurityLevels.gap(
          project.requireZone(conduit.fromZone()).securityLevelTarget(),
          project.requireZone(conduit.toZone()).securityLevelTarget());
      if (gap >= SecurityLevels.INSPECTION_GAP) {
        out.add("Conduit '" + conduit.id() + "' connects zones with SL gap of " + gap + ". "
            + "Consider adding a DMZ or intermediate zone.");
      }
    }

    for (Zone zone : project.zones()) {
      if (zone.securityLevelCapability() == null) {
        out.add("Zone '" + zone.id() + "' has no SL-C defined. Assess and document the actual security capability.");
      }
    }

    if (!vulnerabilities.isEmpty()) {
      for (Zone zone : project.zones()) {
        List<VulnerabilityInfo> findings = vulnerabilities.get(zone.id());
        if (findings == null) {
          continue;
        }
        long openCritical = findings.stream()
            .filter(v -> "critical".equals(v.severity()) && VulnerabilityInfo.STATUS_OPEN.equals(v.status()))
            .count();
        if (openCritical > 0 && zone.securityLevelTarget() <= 2) {
          out.add("URGENT: Zone '" + zone.name() + "' (SL-" + zone.securityLevelTarget() + ") has " + openCritical
              + " open critical CVE(s). Patch or mitigate immediately.");
        }
      }
      for (Zone zone : project.zones()) {
        if (!vulnerabilities.containsKey(zone.id()) && !zone.assets().isEmpty()) {
          out.add("Zone '" + zone.name() + "' has assets but no vulnerability data. Consider running a CVE scan.");
        }
      }
    }

    double mean = zoneRisks.stream().mapToDouble(ZoneRisk::score).average().orElse(0.0);
    if (mean >= RiskEngine.DEFENCE_IN_DEPTH_THRESHOLD) {
      out.add("Consider implementing defense-in-depth strategies across all zones.");
      out.add("Review and restrict conduit flows to essential protocols only.");
    }
    return out;
  }
}
