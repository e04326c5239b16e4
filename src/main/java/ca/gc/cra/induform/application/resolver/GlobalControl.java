package ca.gc.cra.induform.application.resolver;

/**
 * Project-wide control unlocked by the highest zone security level.
 *
 * @since 0.1.0
 */
public enum GlobalControl {
  NETWORK_SEGMENTATION("Network Segmentation",
      "Implement VLAN or physical network segmentation between zones", 1, 1),
  CENTRALIZED_LOGGING("Centralized Logging",
      "Deploy SIEM for security event collection and correlation", 2, 1),
  SECURITY_MONITORING("Security Monitoring",
      "Implement 24/7 security monitoring with alerting", 2, 2),
  INCIDENT_RESPONSE("Incident Response",
      "Establish OT-specific incident response procedures", 1, 3),
  VULNERABILITY_MANAGEMENT("Vulnerability Management",
      "Implement OT-aware vulnerability scanning and patching program", 2, 3),
  RED_TEAM_ASSESSMENT("Red Team Assessment",
      "Conduct regular red team exercises against OT environment", 2, 4),
  THREAT_INTELLIGENCE("Threat Intelligence",
      "Subscribe to ICS-CERT and vendor threat intelligence feeds", 2, 4);

  private final String control;
  private final String description;
  private final int priority;
  private final int minimumLevel;

  GlobalControl(String control, String description, int priority, int minimumLevel) {
    this.control = control;
    this.description = description;
    this.priority = priority;
    this.minimumLevel = minimumLevel;
  }

  public String control() {
    return control;
  }

  public String description() {
    return description;
  }

  public int priority() {
    return priority;
  }

  /** Lowest project security level at which the control is recommended. */
  public int minimumLevel() {
    return minimumLevel;
  }
}
