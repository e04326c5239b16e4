package ca.gc.cra.induform.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.application.pipeline.AssessmentOptions;
import ca.gc.cra.induform.application.pipeline.ProjectAssessmentUseCase;
import ca.gc.cra.induform.application.port.MetricsPort;
import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.AssetType;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.FlowDirection;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import ca.gc.cra.induform.domain.model.ProjectMetadata;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import ca.gc.cra.induform.infrastructure.export.JsonReportWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectYamlWriterTest {
  @TempDir Path tempDir;

  private final ProjectYamlWriter writer = new ProjectYamlWriter();
  private final ProjectYamlReader reader = new ProjectYamlReader();

  @Test
  void writtenProjectReadsBackEqual() throws Exception {
    Zone cell = new Zone("cell", "Cell", ZoneType.CELL, 3, 4, "Packaging line", List.of(
        new Asset("plc", "PLC", AssetType.PLC, "10.3.0.40", "00:1b:1b:00:00:01", "Siemens", "S7-1500", "2.9.4",
            null, 5, Map.of("vlan", "110", "end_of_life", "2031-12-31"))),
        "site", "VLAN 110", 120.5, 80.0);
    Project project = new Project(
        new ProjectMetadata("Round Trip", "All fields", List.of(), List.of("telnet"), "2.1", "ot-team"),
        List.of(Zone.of("site", "Site", ZoneType.SITE, 2), cell),
        List.of(new Conduit("site_cell", "Site to cell", "site", "cell",
            List.of(new ProtocolFlow("modbus_tcp", 502, FlowDirection.OUTBOUND, "Polling")), 3, true, null)));

    Path file = tempDir.resolve("nested/project.yaml");
    writer.write(project, file);

    assertTrue(Files.exists(file));
    assertEquals(project, reader.read(file));
  }

  @Test
  void omitsAbsentOptionalAttributes() {
    String yaml = writer.toYaml(ProjectFixtures.dmzBypass());

    assertTrue(yaml.contains("- IEC62443"));
    assertTrue(yaml.contains("requires_inspection: false"));
    assertFalse(yaml.contains("parent_zone"));
    assertFalse(yaml.contains("null"));
    assertEquals(ProjectFixtures.dmzBypass(), reader.parse(yaml));
  }

  @Test
  void engineOutputIsUnchangedByYamlRoundTrip() throws Exception {
    ProjectAssessmentUseCase useCase = new ProjectAssessmentUseCase(MetricsPort.NO_OP);
    JsonReportWriter json = new JsonReportWriter();

    for (Project original : List.of(ProjectFixtures.referencePlant(), ProjectFixtures.dmzBypass())) {
      Path file = tempDir.resolve(original.metadata().name().replace(' ', '-') + ".yaml");
      writer.write(original, file);
      Project reloaded = reader.read(file);

      assertEquals(
          json.assessment(useCase.assess(original, AssessmentOptions.defaults())),
          json.assessment(useCase.assess(reloaded, AssessmentOptions.defaults())),
          original.metadata().name());
      assertEquals(json.attackPaths(useCase.findAttackPaths(original, 10)),
          json.attackPaths(useCase.findAttackPaths(reloaded, 10)));
    }
  }
}
