package ca.gc.cra.induform.application.firewall;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.FlowDirection;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import java.util.List;
import org.junit.jupiter.api.Test;

class FirewallRuleGeneratorTest {
  private final FirewallRuleGenerator generator = new FirewallRuleGenerator();

  @Test
  void bidirectionalFlowsProduceRulesInBothDirections() {
    FirewallRuleset ruleset = generator.generate(ProjectFixtures.referencePlant());

    assertEquals("Reference Plant Firewall Rules", ruleset.name());
    assertEquals(FirewallAction.DENY, ruleset.defaultAction());
    FirewallRule out = ruleset.rules().get(0);
    assertEquals("rule-0001", out.id());
    assertEquals("enterprise_to_dmz-https-out", out.name());
    assertEquals(List.of("10.0.0.10"), out.sourceAddresses());
    assertEquals(List.of("10.1.0.20"), out.destinationAddresses());
    assertEquals(443, out.port());
    assertEquals(FirewallAction.ALLOW, out.action());
    assertFalse(out.log());
    assertEquals(10, out.order());
    assertEquals("Allow https from Enterprise Network to Industrial DMZ", out.comment());

    FirewallRule in = ruleset.rules().get(1);
    assertEquals("enterprise_to_dmz-https-in", in.name());
    assertEquals("dmz", in.sourceZone());
    assertEquals("enterprise", in.destinationZone());
    assertEquals(20, in.order());
  }

  @Test
  void denyRulesCoverEveryOrderedZonePair() {
    FirewallRuleset ruleset = generator.generate(ProjectFixtures.referencePlant());

    List<FirewallRule> denies = ruleset.rules().stream()
        .filter(rule -> rule.action() == FirewallAction.DENY)
        .toList();
    assertEquals(6, ruleset.rules().size() - denies.size());
    assertEquals(12, denies.size());
    FirewallRule first = denies.get(0);
    assertEquals("rule-0007", first.id());
    assertEquals("deny-enterprise-to-dmz", first.name());
    assertEquals(FirewallRule.ANY, first.protocol());
    assertNull(first.port());
    assertTrue(first.log());
    assertEquals(9007, first.order());
    assertTrue(denies.stream().allMatch(rule -> rule.order() > 9000));
  }

  @Test
  void optionsControlDenyRulesAndLogging() {
    FirewallRuleset ruleset =
        generator.generate(ProjectFixtures.referencePlant(), new FirewallOptions(false, true, false));

    assertEquals(6, ruleset.rules().size());
    assertTrue(ruleset.rules().stream().allMatch(FirewallRule::log));
    assertTrue(ruleset.rules().stream().allMatch(rule -> rule.action() == FirewallAction.ALLOW));
  }

  @Test
  void directionalFlowsProduceOneRule() {
    Project project = ProjectFixtures.project(
        List.of(Zone.of("site", "Site", ZoneType.SITE, 2), Zone.of("cell", "Cell", ZoneType.CELL, 2)),
        List.of(Conduit.of("sc", "site", "cell", List.of(
            new ProtocolFlow("modbus_tcp", 502, FlowDirection.OUTBOUND, null),
            new ProtocolFlow("syslog", 514, FlowDirection.INBOUND, null)))));

    List<FirewallRule> rules = generator.generate(project, new FirewallOptions(false, false, true)).rules();

    assertEquals(2, rules.size());
    assertEquals("sc-modbus_tcp-out", rules.get(0).name());
    assertEquals("site", rules.get(0).sourceZone());
    assertEquals("sc-syslog-in", rules.get(1).name());
    assertEquals("cell", rules.get(1).sourceZone());
    assertEquals(List.of(FirewallRule.ANY), rules.get(1).sourceAddresses());
  }
}
