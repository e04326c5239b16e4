package ca.gc.cra.induform.infrastructure.export;

import ca.gc.cra.induform.application.firewall.FirewallAction;
import ca.gc.cra.induform.application.firewall.FirewallRule;
import ca.gc.cra.induform.application.firewall.FirewallRuleset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a {@link FirewallRuleset} as an {@code iptables-restore} script on the FORWARD chain.
 *
 * <p>INPUT and FORWARD default to DROP, OUTPUT to ACCEPT. Only the first source and destination address of a
 * rule is emitted; {@code any} addresses are omitted. Logged rules get a LOG line prefixed with the rule id
 * ahead of the verdict line.</p>
 *
 * @since 0.1.0
 */
public final class IptablesExporter {
  private static final Set<String> UDP_PROTOCOLS = Set.of("snmp", "ntp", "syslog");

  /**
   * Renders the ruleset; rules are emitted by ascending order.
   *
   * @param ruleset ruleset to render
   * @return script text ending with {@code COMMIT} and a newline
   */
  public String export(FirewallRuleset ruleset) {
    Objects.requireNonNull(ruleset, "ruleset");
    List<String> lines = new ArrayList<>();
    lines.add("# Auto-generated iptables rules");
    lines.add("# Ruleset: " + ruleset.name());
    lines.add("");
    lines.add("*filter");
    lines.add(":INPUT DROP [0:0]");
    lines.add(":FORWARD DROP [0:0]");
    lines.add(":OUTPUT ACCEPT [0:0]");
    lines.add("");

    List<FirewallRule> ordered = new ArrayList<>(ruleset.rules());
    ordered.sort(Comparator.comparingInt(FirewallRule::order));
    for (FirewallRule rule : ordered) {
      String match = match(rule);
      if (rule.log()) {
        lines.add(match + " -j LOG --log-prefix \"" + rule.id() + ": \"");
      }
      if (rule.comment() != null && !rule.comment().isBlank()) {
        lines.add("# " + rule.comment());
      }
      lines.add(match + " -j " + verdict(rule.action()));
      lines.add("");
    }
    lines.add("COMMIT");
    return String.join("\n", lines) + "\n";
  }

  static String transportFor(String protocol) {
    String normalized = protocol.toLowerCase(Locale.ROOT);
    if (UDP_PROTOCOLS.contains(normalized)) {
      return "udp";
    }
    if (normalized.equals("icmp")) {
      return "icmp";
    }
    return "tcp";
  }

  private static String match(FirewallRule rule) {
    StringBuilder sb = new StringBuilder("-A FORWARD");
    firstAddress(rule.sourceAddresses()).ifPresent(addr -> sb.append(" -s ").append(addr));
    firstAddress(rule.destinationAddresses()).ifPresent(addr -> sb.append(" -d ").append(addr));
    if (!FirewallRule.ANY.equalsIgnoreCase(rule.protocol())) {
      sb.append(" -p ").append(transportFor(rule.protocol()));
    }
    if (rule.port() != null) {
      sb.append(" --dport ").append(rule.port());
    }
    return sb.toString();
  }

  private static Optional<String> firstAddress(List<String> addresses) {
    if (addresses.isEmpty() || FirewallRule.ANY.equals(addresses.get(0))) {
      return Optional.empty();
    }
    return Optional.of(addresses.get(0));
  }

  private static String verdict(FirewallAction action) {
    return action == FirewallAction.ALLOW ? "ACCEPT" : "DROP";
  }
}
