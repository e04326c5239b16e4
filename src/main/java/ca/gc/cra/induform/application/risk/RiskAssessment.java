package ca.gc.cra.induform.application.risk;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Project-level risk assessment.
 *
 * @param score project score: the highest zone score, 0 for a project without zones
 * @param level classification of {@code score}
 * @param weightedMeanScore zone scores averaged with total asset criticality as weight
 * @param zoneRisks zone risks in project order
 * @param recommendations mitigation advice in a stable order
 * @since 0.1.0
 */
public record RiskAssessment(
    double score,
    RiskLevel level,
    double weightedMeanScore,
    List<ZoneRisk> zoneRisks,
    List<String> recommendations) {

  public RiskAssessment {
    level = Objects.requireNonNull(level, "level");
    zoneRisks = List.copyOf(zoneRisks);
    recommendations = List.copyOf(recommendations);
  }

  public Optional<ZoneRisk> zoneRisk(String zoneId) {
    return zoneRisks.stream().filter(risk -> risk.zoneId().equals(zoneId)).findFirst();
  }
}
