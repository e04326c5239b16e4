package ca.gc.cra.induform.application.validation;

/**
 * Severity of a validation finding.
 *
 * @since 0.1.0
 */
public enum ValidationSeverity {
  ERROR("error"),
  WARNING("warning"),
  INFO("info");

  private final String wireName;

  ValidationSeverity(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
