package ca.gc.cra.induform.application.firewall;

/**
 * Knobs for {@link FirewallRuleGenerator}.
 *
 * @param includeDenyRules emit an explicit deny rule for every ordered zone pair
 * @param logAllowed log traffic matched by allow rules
 * @param logDenied log traffic matched by deny rules
 * @since 0.1.0
 */
public record FirewallOptions(boolean includeDenyRules, boolean logAllowed, boolean logDenied) {
  /** Explicit deny rules, denied traffic logged, allowed traffic not logged. */
  public static final FirewallOptions DEFAULTS = new FirewallOptions(true, false, true);
}
