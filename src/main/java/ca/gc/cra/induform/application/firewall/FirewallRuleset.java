package ca.gc.cra.induform.application.firewall;

import java.util.List;
import java.util.Objects;

/**
 * Complete generated ruleset.
 *
 * @param name ruleset name
 * @param description ruleset description
 * @param defaultAction action applied when no rule matches
 * @param rules rules in generation order
 * @since 0.1.0
 */
public record FirewallRuleset(String name, String description, FirewallAction defaultAction, List<FirewallRule> rules) {
  public FirewallRuleset {
    name = Objects.requireNonNull(name, "name");
    defaultAction = Objects.requireNonNull(defaultAction, "defaultAction");
    rules = List.copyOf(rules);
  }
}
