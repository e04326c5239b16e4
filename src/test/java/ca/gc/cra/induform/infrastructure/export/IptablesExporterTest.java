package ca.gc.cra.induform.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.application.firewall.FirewallAction;
import ca.gc.cra.induform.application.firewall.FirewallOptions;
import ca.gc.cra.induform.application.firewall.FirewallRule;
import ca.gc.cra.induform.application.firewall.FirewallRuleGenerator;
import ca.gc.cra.induform.application.firewall.FirewallRuleset;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class IptablesExporterTest {
  private final IptablesExporter exporter = new IptablesExporter();

  @Test
  void scriptHasFilterTableHeaderAndCommit() {
    String script = exporter.export(new FirewallRuleset("Empty", null, FirewallAction.DENY, List.of()));

    assertEquals(String.join("\n",
        "# Auto-generated iptables rules",
        "# Ruleset: Empty",
        "",
        "*filter",
        ":INPUT DROP [0:0]",
        ":FORWARD DROP [0:0]",
        ":OUTPUT ACCEPT [0:0]",
        "",
        "COMMIT",
        ""), script);
  }

  @Test
  void allowRulesMatchAddressesProtocolAndPort() {
    FirewallRuleset ruleset = new FirewallRuleGenerator()
        .generate(ProjectFixtures.referencePlant(), new FirewallOptions(false, false, true));

    String script = exporter.export(ruleset);

    assertTrue(script.contains("# Allow https from Enterprise Network to Industrial DMZ\n"
        + "-A FORWARD -s 10.0.0.10 -d 10.1.0.20 -p tcp --dport 443 -j ACCEPT\n"));
    assertTrue(script.contains("-A FORWARD -s 10.2.0.30 -d 10.3.0.40 -p tcp --dport 502 -j ACCEPT"));
  }

  @Test
  void loggedDenyRulesEmitLogLineFirst() {
    FirewallRule deny = new FirewallRule("rule-0009", "deny-a-to-b", "a", "b", List.of(), List.of(),
        FirewallRule.ANY, null, FirewallAction.DENY, true, null, 9009);
    FirewallRule allow = new FirewallRule("rule-0001", "a-ntp-out", "a", "b", List.of("any"), List.of("10.0.0.1"),
        "ntp", 123, FirewallAction.ALLOW, false, "", 10);

    String script = exporter.export(new FirewallRuleset("Mixed", null, FirewallAction.DENY, List.of(deny, allow)));

    int allowAt = script.indexOf("-A FORWARD -d 10.0.0.1 -p udp --dport 123 -j ACCEPT");
    int logAt = script.indexOf("-A FORWARD -j LOG --log-prefix \"rule-0009: \"\n-A FORWARD -j DROP");
    assertTrue(allowAt > 0);
    assertTrue(logAt > allowAt, "rules are emitted in ascending order");
  }

  @Test
  void transportDependsOnProtocol() {
    assertEquals("udp", IptablesExporter.transportFor("SNMP"));
    assertEquals("icmp", IptablesExporter.transportFor("icmp"));
    assertEquals("tcp", IptablesExporter.transportFor("opcua"));
  }
}
