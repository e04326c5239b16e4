package ca.gc.cra.induform.application.risk;

/**
 * Per-factor contributions to a zone risk score, each on a 0-40 scale before weighting.
 *
 * @param slBaseRisk risk implied by the zone's target security level
 * @param assetCriticalityRisk risk from the criticality of the zone's assets
 * @param exposureRisk risk from the number of attached conduits
 * @param slGapRisk risk from security level differences to neighbouring zones
 * @param vulnerabilityRisk risk from known vulnerabilities, mitigated by the zone's security level
 * @since 0.1.0
 */
public record RiskFactors(
    double slBaseRisk,
    double assetCriticalityRisk,
    double exposureRisk,
    double slGapRisk,
    double vulnerabilityRisk) {

  static final double SL_BASE_WEIGHT = 0.25;
  static final double ASSET_CRITICALITY_WEIGHT = 0.20;
  static final double EXPOSURE_WEIGHT = 0.15;
  static final double SL_GAP_WEIGHT = 0.20;
  static final double VULNERABILITY_WEIGHT = 0.20;

  /**
   * Combines factors with their fixed weights.
   *
   * @return weighted sum, unclamped
   */
  public double weightedScore() {
    return slBaseRisk * SL_BASE_WEIGHT
        + assetCriticalityRisk * ASSET_CRITICALITY_WEIGHT
        + exposureRisk * EXPOSURE_WEIGHT
        + slGapRisk * SL_GAP_WEIGHT
        + vulnerabilityRisk * VULNERABILITY_WEIGHT;
  }
}
