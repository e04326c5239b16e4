package ca.gc.cra.induform.domain.security;

/**
 * IEC 62443 security levels and the threat profile each one defends against.
 *
 * @since 0.1.0
 */
public enum SecurityLevel {
  SL1(1,
      "SL 1 - Basic",
      "Casual or coincidental violation",
      "No intentional attack, accidental misconfiguration",
      "None specific",
      "Protection against casual or coincidental violation. "
          + "Covers basic security hygiene and protection against unintentional errors."),
  SL2(2,
      "SL 2 - Enhanced",
      "Intentional violation using simple means",
      "Low motivation, general skills, low resources",
      "Generic tools, public exploits",
      "Protection against intentional violation using simple means and low resources. "
          + "Defends against opportunistic attackers with basic tools."),
  SL3(3,
      "SL 3 - Critical",
      "Sophisticated attack with moderate resources",
      "Moderate motivation, IACS-specific skills, moderate resources",
      "IACS-specific tools, possible insider knowledge",
      "Protection against sophisticated attack using moderate resources, "
          + "IACS-specific skills, and moderate motivation. Covers organized cybercrime."),
  SL4(4,
      "SL 4 - State-Critical",
      "State-sponsored or highly sophisticated attack",
      "High motivation, nation-state level skills, extensive resources",
      "Zero-days, custom tools, insider access, unlimited time",
      "Protection against state-sponsored attack using extensive resources, "
          + "IACS-specific skills, and high motivation. Maximum security posture.");

  private final int level;
  private final String title;
  private final String threat;
  private final String attacker;
  private final String resources;
  private final String description;

  SecurityLevel(int level, String title, String threat, String attacker, String resources, String description) {
    this.level = level;
    this.title = title;
    this.threat = threat;
    this.attacker = attacker;
    this.resources = resources;
    this.description = description;
  }

  /**
   * Resolves the enum constant for a numeric level.
   *
   * @param level numeric level
   * @return matching security level
   * @throws IllegalArgumentException if {@code level} is not 1-4
   */
  public static SecurityLevel of(int level) {
    for (SecurityLevel value : values()) {
      if (value.level == level) {
        return value;
      }
    }
    throw new IllegalArgumentException("Invalid security level: " + level + ". Must be 1-4.");
  }

  public int level() {
    return level;
  }

  public String title() {
    return title;
  }

  public String threat() {
    return threat;
  }

  public String attacker() {
    return attacker;
  }

  public String resources() {
    return resources;
  }

  public String description() {
    return description;
  }
}
