package ca.gc.cra.induform.application.firewall;

/**
 * Action taken by a firewall rule.
 *
 * @since 0.1.0
 */
public enum FirewallAction {
  ALLOW("allow"),
  DENY("deny"),
  DROP("drop"),
  LOG("log");

  private final String wireName;

  FirewallAction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
