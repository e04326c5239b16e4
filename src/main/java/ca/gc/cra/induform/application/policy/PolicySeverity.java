package ca.gc.cra.induform.application.policy;

/**
 * Severity of a policy violation, from most to least urgent.
 *
 * @since 0.1.0
 */
public enum PolicySeverity {
  CRITICAL("critical"),
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String wireName;

  PolicySeverity(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
