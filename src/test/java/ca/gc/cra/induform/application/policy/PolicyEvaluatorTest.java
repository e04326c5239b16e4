package ca.gc.cra.induform.application.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.AssetType;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import ca.gc.cra.induform.domain.model.ProjectMetadata;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PolicyEvaluatorTest {
  private final PolicyEvaluator evaluator = new PolicyEvaluator();

  @Test
  void referencePlantHasNoViolationsForItsStandards() {
    Project project = ProjectFixtures.referencePlant();

    List<PolicyViolation> violations = evaluator.evaluate(project, project.metadata().enabledStandards());

    assertEquals(List.of("POL-007"), ids(violations));
    assertEquals(PolicySeverity.LOW, violations.get(0).severity());
    assertTrue(violations.get(0).message().contains("(skips 1 Purdue model level)"));
  }

  @Test
  void dmzBypassTriggersBoundaryAndHierarchyRules() {
    List<PolicyViolation> violations = evaluator.evaluate(ProjectFixtures.dmzBypass());

    assertEquals(List.of("POL-002", "POL-005", "POL-007", "NIST-001", "NIST-001", "CIP-002"), ids(violations));
    PolicyViolation dmz = violations.get(1);
    assertEquals(PolicySeverity.CRITICAL, dmz.severity());
    assertEquals("DMZ Requirement", dmz.ruleName());
    assertEquals(List.of("direct_link", "enterprise", "plc_cell"), dmz.affectedEntities());
  }

  @Test
  void standardsFilterRestrictsRules() {
    List<PolicyViolation> violations =
        evaluator.evaluate(ProjectFixtures.dmzBypass(), Set.of(ComplianceStandard.IEC62443));

    assertEquals(List.of("POL-002", "POL-005"), ids(violations));
  }

  @Test
  void conduitWithoutFlowsViolatesDefaultDeny() {
    Project project = ProjectFixtures.project(
        List.of(Zone.of("site", "Site Ops", ZoneType.SITE, 2), Zone.of("area", "Area 1", ZoneType.AREA, 2)),
        List.of(Conduit.of("idle", "site", "area", List.of())));

    List<PolicyViolation> violations = evaluator.evaluate(project, Set.of(ComplianceStandard.IEC62443));

    assertEquals(1, violations.size());
    PolicyViolation violation = violations.get(0);
    assertEquals("POL-001", violation.ruleId());
    assertEquals(PolicySeverity.HIGH, violation.severity());
    assertEquals(List.of("idle", "site", "area"), violation.affectedEntities());
    assertTrue(violation.message().contains("between 'Site Ops' and 'Area 1'"));
  }

  @Test
  void protocolAllowlistHonoursProjectOverrides() {
    List<Zone> zones = List.of(Zone.of("site", "Site", ZoneType.SITE, 2), Zone.of("area", "Area", ZoneType.AREA, 2));
    List<Conduit> conduits = List.of(Conduit.of("c1", "site", "area", List.of(ProtocolFlow.of("telnet", 23))));
    Project strictProject = ProjectFixtures.project(zones, conduits);
    Project relaxedProject = new Project(
        new ProjectMetadata("Relaxed", null, null, List.of("telnet"), null, null), zones, conduits);

    List<PolicyViolation> strict = evaluator.evaluate(strictProject, Set.of(ComplianceStandard.IEC62443));

    assertEquals(List.of("POL-003"), ids(strict));
    assertEquals(List.of("c1"), strict.get(0).affectedEntities());
    assertTrue(evaluator.evaluate(relaxedProject, Set.of(ComplianceStandard.IEC62443)).isEmpty());
  }

  @Test
  void safetyZoneNeedsHighLevelAndFewConduits() {
    Project project = ProjectFixtures.project(
        List.of(
            Zone.of("sis", "SIS", ZoneType.SAFETY, 2),
            Zone.of("cell_a", "Cell A", ZoneType.CELL, 2),
            Zone.of("cell_b", "Cell B", ZoneType.CELL, 2),
            Zone.of("cell_c", "Cell C", ZoneType.CELL, 2)),
        List.of(
            Conduit.of("a", "cell_a", "sis", List.of(ProtocolFlow.of("modbus_tcp", 502))),
            Conduit.of("b", "cell_b", "sis", List.of(ProtocolFlow.of("modbus_tcp", 502))),
            Conduit.of("c", "cell_c", "sis", List.of(ProtocolFlow.of("modbus_tcp", 502)))));

    List<PolicyViolation> safety = evaluator.evaluate(project, Set.of(ComplianceStandard.IEC62443)).stream()
        .filter(violation -> violation.ruleId().equals("POL-006"))
        .toList();

    assertEquals(2, safety.size());
    assertEquals(PolicySeverity.CRITICAL, safety.get(0).severity());
    assertEquals(PolicySeverity.HIGH, safety.get(1).severity());
    assertTrue(safety.get(1).message().contains("has 3 conduits"));
  }

  @Test
  void cellToCellLinkViolatesIsolation() {
    Project project = ProjectFixtures.project(
        List.of(Zone.of("cell_a", "Cell A", ZoneType.CELL, 2), Zone.of("cell_b", "Cell B", ZoneType.CELL, 2)),
        List.of(Conduit.of("peer", "cell_a", "cell_b", List.of(ProtocolFlow.of("profinet", null)))));

    assertEquals(List.of("POL-004"), ids(evaluator.evaluate(project, Set.of(ComplianceStandard.PURDUE))));
  }

  @Test
  void nercCipRulesCoverEspAndClassification() {
    Zone substation = Zone.of("substation", "Substation", ZoneType.CELL, 3).withAssets(List.of(
        Asset.of("relay_1", "Protection Relay", AssetType.IED),
        Asset.of("rtu_1", "Substation RTU", AssetType.RTU).withCriticality(5)));
    Project project = ProjectFixtures.project(List.of(ComplianceStandard.NERC_CIP), List.of(substation), List.of());

    List<PolicyViolation> violations = evaluator.evaluate(project, project.metadata().enabledStandards());

    assertEquals(List.of("CIP-001", "CIP-002"), ids(violations));
    assertEquals(List.of("substation"), violations.get(0).affectedEntities());
    assertEquals(List.of("substation", "relay_1"), violations.get(1).affectedEntities());
  }

  @Test
  void rulesAreListedInEvaluationOrder() {
    List<PolicyRule> rules = evaluator.rules();

    assertEquals(10, rules.size());
    assertEquals(PolicyRule.DEFAULT_DENY, rules.get(0));
    assertEquals(PolicyRule.BES_ASSET_CLASSIFICATION, PolicyRule.fromId("CIP-002"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> PolicyRule.fromId("POL-999"));
    assertEquals("Unknown policy rule: POL-999", ex.getMessage());
  }

  private static List<String> ids(List<PolicyViolation> violations) {
    return violations.stream().map(PolicyViolation::ruleId).toList();
  }
}
