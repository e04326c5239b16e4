package ca.gc.cra.induform.application.gap;

/**
 * Outcome of assessing one system requirement against a zone.
 *
 * @since 0.1.0
 */
public enum ControlStatus {
  MET("met"),
  PARTIAL("partial"),
  UNMET("unmet"),
  NOT_APPLICABLE("not_applicable");

  private final String wireName;

  ControlStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
