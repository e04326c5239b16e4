package ca.gc.cra.induform.domain.security;

/**
 * IEC 62443-3-3 foundational requirement categories.
 *
 * @since 0.1.0
 */
public enum FoundationalRequirement {
  FR1("FR 1", "Identification and Authentication Control (IAC)"),
  FR2("FR 2", "Use Control (UC)"),
  FR3("FR 3", "System Integrity (SI)"),
  FR4("FR 4", "Data Confidentiality (DC)"),
  FR5("FR 5", "Restricted Data Flow (RDF)"),
  FR6("FR 6", "Timely Response to Events (TRE)"),
  FR7("FR 7", "Resource Availability (RA)");

  private final String id;
  private final String displayName;

  FoundationalRequirement(String id, String displayName) {
    this.id = id;
    this.displayName = displayName;
  }

  /** Identifier as written in the standard, such as {@code FR 5}. */
  public String id() {
    return id;
  }

  /** Category name with its abbreviation, such as {@code Restricted Data Flow (RDF)}. */
  public String displayName() {
    return displayName;
  }
}
