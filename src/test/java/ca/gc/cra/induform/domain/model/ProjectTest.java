package ca.gc.cra.induform.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProjectTest {

  @Test
  void duplicateZoneIdsAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ProjectFixtures.project(
        List.of(Zone.of("cell", "Cell A", ZoneType.CELL, 2), Zone.of("cell", "Cell B", ZoneType.CELL, 2)),
        List.of()));
    assertEquals("Duplicate zone id 'cell'", ex.getMessage());
  }

  @Test
  void duplicateConduitIdsAreRejected() {
    List<Zone> zones = List.of(Zone.of("site", "Site", ZoneType.SITE, 2), Zone.of("cell", "Cell", ZoneType.CELL, 2));
    assertThrows(IllegalArgumentException.class, () -> ProjectFixtures.project(zones, List.of(
        Conduit.of("c1", "site", "cell", List.of()),
        Conduit.of("c1", "cell", "site", List.of()))));
  }

  @Test
  void unknownParentZoneIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ProjectFixtures.project(
        List.of(Zone.of("cell", "Cell", ZoneType.CELL, 2).withParentZone("site")), List.of()));
    assertEquals("Zone 'cell' references unknown parent_zone 'site'", ex.getMessage());
  }

  @Test
  void conduitToUnknownZoneIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ProjectFixtures.project(
        List.of(Zone.of("site", "Site", ZoneType.SITE, 2)),
        List.of(Conduit.of("to_nowhere", "site", "missing_zone", List.of()))));
    assertEquals("Conduit 'to_nowhere' references unknown to_zone 'missing_zone'", ex.getMessage());
  }

  @Test
  void lookupsFollowDeclarationOrder() {
    Project project = ProjectFixtures.referencePlant();

    assertEquals(Project.SCHEMA_VERSION, project.version());
    assertEquals(List.of("dmz_to_site", "site_to_cell"),
        project.conduitsForZone("site_ops").stream().map(Conduit::id).toList());
    assertTrue(project.hasZoneOfType(ZoneType.DMZ));
    assertFalse(project.hasZoneOfType(ZoneType.SAFETY));
    assertTrue(project.zone("missing").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> project.requireZone("missing"));
  }

  @Test
  void metadataDefaultsToIec62443AndDeduplicatesStandards() {
    ProjectMetadata defaults = ProjectMetadata.named("Plant");
    ProjectMetadata repeated = new ProjectMetadata("Plant", null,
        List.of(ComplianceStandard.NIST_CSF, ComplianceStandard.NIST_CSF), null, null, null);

    assertEquals(List.of(ComplianceStandard.IEC62443), defaults.complianceStandards());
    assertEquals(List.of(ComplianceStandard.NIST_CSF), repeated.complianceStandards());
  }

  @Test
  void purdueAdjacencyFollowsHierarchy() {
    assertTrue(ZoneType.ENTERPRISE.isPurdueAdjacentTo(ZoneType.DMZ));
    assertTrue(ZoneType.CELL.isPurdueAdjacentTo(ZoneType.SAFETY));
    assertFalse(ZoneType.SITE.isPurdueAdjacentTo(ZoneType.CELL));
    assertEquals(ZoneType.DMZ, ZoneType.fromWireName(" DMZ "));
  }
}
