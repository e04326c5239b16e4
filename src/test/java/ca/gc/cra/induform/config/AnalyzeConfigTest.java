package ca.gc.cra.induform.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.application.attackpath.AttackPathAnalyzer;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalyzeConfigTest {

  @Test
  void vulnsAliasSetsVulnerabilityPath() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(Map.of(
        "in", "plant.yaml",
        "analysis", "Risk",
        "vulns", "scan/cves.yaml"));

    assertEquals(AnalysisType.RISK, config.analysis());
    assertEquals("plant.yaml", config.projectPath().getFileName().toString());
    assertTrue(config.vulnerabilitiesPath().orElseThrow().endsWith("scan/cves.yaml"));
  }

  @Test
  void blankAnalysisRunsEverything() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(Map.of("project", "plant.yaml", "analysis", " "));

    assertEquals(AnalysisType.ALL, config.analysis());
    assertTrue(config.vulnerabilitiesPath().isEmpty());
    assertTrue(config.standards().isEmpty());
  }

  @Test
  void unknownAnalysisNamesTheValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("project", "plant.yaml", "analysis", "topology")));
    assertEquals("Unknown analysis: topology", ex.getMessage());
  }

  @Test
  void attackPathAnalysisAcceptsHyphensAndPathLimit() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(Map.of(
        "project", "plant.yaml",
        "analysis", "attack-paths",
        "maxPaths", "3"));

    assertEquals(AnalysisType.ATTACK_PATHS, config.analysis());
    assertEquals(3, config.maxPaths());
  }

  @Test
  void maxPathsDefaultsAndMustBePositive() {
    assertEquals(AttackPathAnalyzer.DEFAULT_MAX_PATHS,
        AnalyzeConfig.fromMap(Map.of("project", "plant.yaml", "analysis", "gaps")).maxPaths());
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("project", "plant.yaml", "maxPaths", "0")));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(Map.of("project", "plant.yaml", "maxPaths", "many")));
    assertEquals("maxPaths must be an integer but was 'many'", ex.getMessage());
  }
}
