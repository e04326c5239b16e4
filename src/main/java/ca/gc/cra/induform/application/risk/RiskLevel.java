package ca.gc.cra.induform.application.risk;

/**
 * Risk classification bands shared by the engine and reporting.
 *
 * @since 0.1.0
 */
public enum RiskLevel {
  CRITICAL("critical", 80),
  HIGH("high", 60),
  MEDIUM("medium", 40),
  LOW("low", 20),
  MINIMAL("minimal", 0);

  private final String wireName;
  private final double threshold;

  RiskLevel(String wireName, double threshold) {
    this.wireName = wireName;
    this.threshold = threshold;
  }

  public String wireName() {
    return wireName;
  }

  /** Lowest score (inclusive) classified at this level. */
  public double threshold() {
    return threshold;
  }

  /**
   * Classifies a 0-100 score.
   *
   * @param score risk score
   * @return highest level whose threshold the score reaches
   */
  public static RiskLevel classify(double score) {
    for (RiskLevel level : values()) {
      if (score >= level.threshold) {
        return level;
      }
    }
    return MINIMAL;
  }
}
