package ca.gc.cra.induform.application.risk;

import java.util.Objects;

/**
 * Risk score of one zone.
 *
 * @param zoneId assessed zone
 * @param score score between 0 and 100, rounded to two decimals
 * @param level classification of the rounded {@code score}, so a consumer applying {@link RiskLevel} thresholds
 *     to the reported value gets the same level
 * @param factors factor breakdown
 * @since 0.1.0
 */
public record ZoneRisk(String zoneId, double score, RiskLevel level, RiskFactors factors) {
  public ZoneRisk {
    zoneId = Objects.requireNonNull(zoneId, "zoneId");
    level = Objects.requireNonNull(level, "level");
    factors = Objects.requireNonNull(factors, "factors");
  }
}
