package ca.gc.cra.induform.application.attackpath;

/**
 * Conduit properties an attacker can exploit while moving between zones.
 *
 * @since 0.1.0
 */
public enum WeaknessType {
  NO_INSPECTION("no_inspection"),
  SL_GAP("sl_gap"),
  NO_FLOWS_DEFINED("no_flows_defined"),
  UNENCRYPTED_PROTOCOL("unencrypted_protocol"),
  EXCESSIVE_PROTOCOLS("excessive_protocols");

  private final String wireName;

  WeaknessType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
