package ca.gc.cra.induform.application.attackpath;

import ca.gc.cra.induform.application.risk.RiskLevel;
import java.util.List;
import java.util.Objects;

/**
 * Cheapest route from an entry zone to a high-value target.
 *
 * @param id stable identifier {@code <entry>-><target>}
 * @param entryZoneId zone the attacker starts from
 * @param entryZoneName display name of the entry zone
 * @param targetZoneId high-value zone reached
 * @param targetZoneName display name of the target zone
 * @param targetReason why the target is considered high value
 * @param steps conduit traversals in order
 * @param totalCost summed traversal cost, rounded to one decimal
 * @param riskScore 0-100 score derived from the average step cost, rounded to one decimal
 * @param riskLevel classification of {@code riskScore}
 * @param zoneIds zones visited, entry first
 * @param conduitIds conduits traversed in order
 * @since 0.1.0
 */
public record AttackPath(
    String id,
    String entryZoneId,
    String entryZoneName,
    String targetZoneId,
    String targetZoneName,
    String targetReason,
    List<AttackPathStep> steps,
    double totalCost,
    double riskScore,
    RiskLevel riskLevel,
    List<String> zoneIds,
    List<String> conduitIds) {

  public AttackPath {
    id = Objects.requireNonNull(id, "id");
    riskLevel = Objects.requireNonNull(riskLevel, "riskLevel");
    steps = List.copyOf(steps);
    zoneIds = List.copyOf(zoneIds);
    conduitIds = List.copyOf(conduitIds);
  }
}
