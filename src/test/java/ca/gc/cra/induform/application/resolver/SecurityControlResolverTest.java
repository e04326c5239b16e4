package ca.gc.cra.induform.application.resolver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import ca.gc.cra.induform.domain.security.FoundationalRequirement;
import java.util.List;
import org.junit.jupiter.api.Test;

class SecurityControlResolverTest {
  private final SecurityControlResolver resolver = new SecurityControlResolver();

  @Test
  void zoneProfilesListRequirementsForTheirLevel() {
    ResolvedControls controls = resolver.resolve(ProjectFixtures.referencePlant());

    ZoneSecurityProfile enterprise = controls.zoneProfiles().get(0);
    assertEquals("enterprise", enterprise.zoneId());
    assertEquals(12, enterprise.applicableRequirements().size());
    assertFalse(enterprise.applicableRequirements().contains("SR 2.2"));

    ZoneSecurityProfile cell = controls.zoneProfiles().get(3);
    assertEquals(15, cell.applicableRequirements().size());
    SecurityControl auth = cell.recommendedControls().get(0);
    assertEquals("SR 1.1", auth.requirementId());
    assertEquals("Multi-factor authentication required", auth.controlDescription());
    assertEquals(List.of("cell_line1"), auth.appliesTo());
    assertEquals(2, auth.priority());
  }

  @Test
  void conduitProfileEscalatesWithSecurityGap() {
    ResolvedControls controls = resolver.resolve(ProjectFixtures.referencePlant());

    ConduitSecurityProfile perimeter = controls.conduitProfiles().get(0);
    assertEquals("enterprise_to_dmz", perimeter.conduitId());
    assertEquals(3, perimeter.requiredSecurityLevel());
    assertTrue(perimeter.requiresInspection());
    assertTrue(perimeter.requiresEncryption());
    assertEquals(List.of("https"), perimeter.allowedProtocols());
    assertEquals(List.of(
        SecurityControlResolver.DEEP_INSPECTION,
        SecurityControlResolver.ENCRYPTION,
        SecurityControlResolver.STATEFUL_FIREWALL,
        SecurityControlResolver.PROTOCOL_AWARE_IDS), perimeter.recommendedControls());

    ConduitSecurityProfile supervisory = controls.conduitProfiles().get(1);
    assertTrue(supervisory.requiresInspection(), "declared inspection is carried into the profile");
    assertFalse(supervisory.recommendedControls().contains(SecurityControlResolver.DEEP_INSPECTION));
  }

  @Test
  void lowLevelConduitWithoutFlowsOnlyAsksForFlows() {
    Project project = ProjectFixtures.project(
        List.of(Zone.of("a", "A", ZoneType.AREA, 1), Zone.of("b", "B", ZoneType.AREA, 1)),
        List.of(Conduit.of("ab", "a", "b", List.of())));

    ConduitSecurityProfile profile = resolver.resolve(project).conduitProfiles().get(0);

    assertEquals(1, profile.requiredSecurityLevel());
    assertFalse(profile.requiresInspection());
    assertFalse(profile.requiresEncryption());
    assertEquals(List.of(SecurityControlResolver.DEFINE_FLOWS), profile.recommendedControls());
  }

  @Test
  void globalControlsGrowMonotonicallyWithLevel() {
    for (int level = 1; level < 4; level++) {
      List<GlobalControl> lower = SecurityControlResolver.globalControls(level);
      List<GlobalControl> higher = SecurityControlResolver.globalControls(level + 1);
      assertTrue(higher.containsAll(lower));
      assertTrue(higher.size() > lower.size());
    }
    assertEquals(List.of(GlobalControl.NETWORK_SEGMENTATION, GlobalControl.CENTRALIZED_LOGGING),
        SecurityControlResolver.globalControls(1));
    assertEquals(GlobalControl.values().length, SecurityControlResolver.globalControls(4).size());
  }

  @Test
  void emptyProjectResolvesToLevelOneBaseline() {
    ResolvedControls controls = resolver.resolve(ProjectFixtures.project(List.of(), List.of()));

    assertEquals(1, controls.maxSecurityLevel());
    assertTrue(controls.zoneProfiles().isEmpty());
    assertEquals(SecurityControlResolver.globalControls(1), controls.globalControls());
  }

  @Test
  void referencePlantUnlocksLevelThreeControls() {
    ResolvedControls controls = resolver.resolve(ProjectFixtures.referencePlant());

    assertEquals(3, controls.maxSecurityLevel());
    assertTrue(controls.globalControls().contains(GlobalControl.INCIDENT_RESPONSE));
    assertFalse(controls.globalControls().contains(GlobalControl.RED_TEAM_ASSESSMENT));
  }

  @Test
  void prioritiesFollowFoundationalRequirement() {
    assertEquals(1, SecurityControlResolver.priorityFor(FoundationalRequirement.FR5));
    assertEquals(2, SecurityControlResolver.priorityFor(FoundationalRequirement.FR2));
    assertEquals(3, SecurityControlResolver.priorityFor(FoundationalRequirement.FR6));
    assertEquals(4, SecurityControlResolver.priorityFor(FoundationalRequirement.FR7));
  }
}
