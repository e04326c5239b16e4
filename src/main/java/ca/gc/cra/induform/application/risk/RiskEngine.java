package ca.gc.cra.induform.application.risk;

import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.security.SecurityLevels;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Scores zones and projects on a 0-100 risk scale.
 * <p><strong>Why:</strong> Gives dashboards and CI gates a single comparable number per zone while keeping the
 * factor breakdown available for explanation.</p>
 * <p><strong>Role:</strong> Application service; pure function of the project and optional vulnerability data.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Combine security level, asset criticality, exposure, SL gap and vulnerability factors.</li>
 *   <li>Aggregate zone scores monotonically into a project score.</li>
 *   <li>Derive mitigation recommendations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 * <p><strong>Performance:</strong> O(zones &times; conduits) per assessment.</p>
 *
 * @since 0.1.0
 */
public final class RiskEngine {
  private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

  static final double FACTOR_CAP = 40.0;
  static final double EMPTY_ZONE_CRITICALITY_RISK = 10.0;
  static final double EXPOSURE_PER_CONDUIT = 8.0;
  static final double GAP_POINTS_PER_LEVEL = 10.0;
  static final double EXTRA_FINDING_POINTS = 2.0;
  static final double MAX_VOLUME_BOOST = 10.0;
  static final double DEFENCE_IN_DEPTH_THRESHOLD = 60.0;

  /**
   * Classifies a risk score.
   *
   * @param score score between 0 and 100
   * @return risk level
   */
  public static RiskLevel classifyRiskLevel(double score) {
    return RiskLevel.classify(score);
  }

  /**
   * Scores one zone without vulnerability data.
   *
   * @param project project containing the zone
   * @param zoneId zone to score
   * @return zone risk
   * @throws IllegalArgumentException if the zone does not exist
   */
  public ZoneRisk calculateZoneRisk(Project project, String zoneId) {
    return calculateZoneRisk(project, zoneId, List.of());
  }

  /**
   * Scores one zone.
   *
   * @param project project containing the zone
   * @param zoneId zone to score
   * @param vulnerabilities vulnerabilities affecting the zone; may be empty
   * @return zone risk
   * @throws IllegalArgumentException if the zone does not exist
   */
  public ZoneRisk calculateZoneRisk(Project project, String zoneId, List<VulnerabilityInfo> vulnerabilities) {
    Objects.requireNonNull(project, "project");
    Zone zone = project.zone(zoneId)
        .orElseThrow(() -> new IllegalArgumentException("Zone not found: " + zoneId));
    List<Conduit> attached = project.conduitsForZone(zone.id());

    RiskFactors factors = new RiskFactors(
        slBaseRisk(zone.securityLevelTarget()),
        assetCriticalityRisk(zone),
        Math.min(attached.size() * EXPOSURE_PER_CONDUIT, FACTOR_CAP),
        slGapRisk(project, zone, attached),
        vulnerabilityRisk(zone, vulnerabilities == null ? List.of() : vulnerabilities));
    return zoneRisk(zone.id(), factors.weightedScore(), factors);
  }

  /** Classifies the rounded score; the level always matches the reported value. */
  static ZoneRisk zoneRisk(String zoneId, double rawScore, RiskFactors factors) {
    double score = round2(clamp(rawScore));
    return new ZoneRisk(zoneId, score, classifyRiskLevel(score), factors);
  }

  /**
   * Assesses every zone of a project without vulnerability data.
   *
   * @param project project to assess
   * @return assessment
   */
  public RiskAssessment assess(Project project) {
    return assess(project, Map.of());
  }

  /**
   * Assesses every zone of a project.
   *
   * @param project project to assess
   * @param vulnerabilitiesByZone vulnerabilities keyed by zone id; an empty map means no scan data at all
   * @return assessment
   */
  public RiskAssessment assess(Project project, Map<String, List<VulnerabilityInfo>> vulnerabilitiesByZone) {
    Objects.requireNonNull(project, "project");
    Map<String, List<VulnerabilityInfo>> vulnerabilities =
        vulnerabilitiesByZone == null ? Map.of() : vulnerabilitiesByZone;

    List<ZoneRisk> zoneRisks = new ArrayList<>(project.zones().size());
    double max = 0.0;
    double weightedSum = 0.0;
    double totalWeight = 0.0;
    for (Zone zone : project.zones()) {
      ZoneRisk risk = calculateZoneRisk(project, zone.id(), vulnerabilities.getOrDefault(zone.id(), List.of()));
      zoneRisks.add(risk);
      max = Math.max(max, risk.score());
      double weight = zone.assets().isEmpty() ? 1.0 : totalCriticality(zone);
      weightedSum += risk.score() * weight;
      totalWeight += weight;
    }
    double weightedMean = totalWeight > 0 ? round2(clamp(weightedSum / totalWeight)) : 0.0;
    double score = round2(clamp(max));

    List<String> recommendations = RiskRecommendations.generate(project, zoneRisks, vulnerabilities);
    RiskAssessment assessment =
        new RiskAssessment(score, classifyRiskLevel(score), weightedMean, zoneRisks, recommendations);
    log.debug("Assessed risk for {}: score={} level={} weightedMean={}",
        project, assessment.score(), assessment.level().wireName(), assessment.weightedMeanScore());
    return assessment;
  }

  static double slBaseRisk(int securityLevelTarget) {
    return switch (securityLevelTarget) {
      case 2 -> 30.0;
      case 3 -> 20.0;
      case 4 -> 10.0;
      default -> 40.0;
    };
  }

  static double slMitigation(int securityLevelTarget) {
    return switch (securityLevelTarget) {
      case 2 -> 0.85;
      case 3 -> 0.65;
      case 4 -> 0.45;
      default -> 1.0;
    };
  }

  static double severityBaseScore(String severity) {
    return switch (severity) {
      case "critical" -> 9.5;
      case "high" -> 7.5;
      case "low" -> 2.5;
      default -> 5.0;
    };
  }

  static double statusDiscount(String status) {
    return switch (status) {
      case "accepted" -> 0.75;
      case "mitigated" -> 0.3;
      case "false_positive" -> 0.0;
      default -> 1.0;
    };
  }

  private static double assetCriticalityRisk(Zone zone) {
    if (zone.assets().isEmpty()) {
      return EMPTY_ZONE_CRITICALITY_RISK;
    }
    double meanScaled = totalCriticality(zone) * 2.0 / zone.assets().size();
    return Math.min(meanScaled * 4.0, FACTOR_CAP);
  }

  private static double slGapRisk(Project project, Zone zone, List<Conduit> attached) {
    if (attached.isEmpty()) {
      return 0.0;
    }
    int totalGap = 0;
    for (Conduit conduit : attached) {
      String neighbourId = conduit.fromZone().equals(zone.id()) ? conduit.toZone() : conduit.fromZone();
      Zone neighbour = project.requireZone(neighbourId);
      totalGap += SecurityLevels.gap(zone.securityLevelTarget(), neighbour.securityLevelTarget());
    }
    return Math.min((double) totalGap / attached.size() * GAP_POINTS_PER_LEVEL, FACTOR_CAP);
  }

  private static double vulnerabilityRisk(Zone zone, List<VulnerabilityInfo> vulnerabilities) {
    if (vulnerabilities.isEmpty()) {
      return 0.0;
    }
    double mitigation = slMitigation(zone.securityLevelTarget());
    double sum = 0.0;
    int active = 0;
    for (VulnerabilityInfo vulnerability : vulnerabilities) {
      double base = vulnerability.cvssScore() != null
          ? vulnerability.cvssScore()
          : severityBaseScore(vulnerability.severity());
      double effective = base * mitigation * statusDiscount(vulnerability.status());
      if (effective > 0) {
        sum += effective;
        active++;
      }
    }
    if (active == 0) {
      return 0.0;
    }
    double boost = Math.min((active - 1) * EXTRA_FINDING_POINTS, MAX_VOLUME_BOOST);
    return Math.min(sum / active * 4.0 + boost, FACTOR_CAP);
  }

  private static int totalCriticality(Zone zone) {
    int total = 0;
    for (Asset asset : zone.assets()) {
      total += asset.criticality();
    }
    return total;
  }

  private static double clamp(double score) {
    return Math.min(Math.max(score, 0.0), 100.0);
  }

  static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
