package ca.gc.cra.induform.application.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RiskEngineTest {
  private static final double EPSILON = 1e-9;

  private final RiskEngine engine = new RiskEngine();

  @Test
  void zoneFactorsFollowSecurityLevelAssetsAndTopology() {
    ZoneRisk cell = engine.calculateZoneRisk(ProjectFixtures.referencePlant(), "cell_line1");

    RiskFactors factors = cell.factors();
    assertEquals(20.0, factors.slBaseRisk(), EPSILON);
    assertEquals(40.0, factors.assetCriticalityRisk(), EPSILON);
    assertEquals(8.0, factors.exposureRisk(), EPSILON);
    assertEquals(10.0, factors.slGapRisk(), EPSILON);
    assertEquals(0.0, factors.vulnerabilityRisk(), EPSILON);
    assertEquals(16.2, cell.score(), EPSILON);
    assertEquals(RiskLevel.MINIMAL, cell.level());
  }

  @Test
  void gapRiskAveragesAcrossAttachedConduits() {
    ZoneRisk dmz = engine.calculateZoneRisk(ProjectFixtures.referencePlant(), "dmz");

    assertEquals(16.0, dmz.factors().exposureRisk(), EPSILON);
    assertEquals(15.0, dmz.factors().slGapRisk(), EPSILON);
    assertEquals(15.2, dmz.score(), EPSILON);
  }

  @Test
  void isolatedEmptyZoneUsesDefaultCriticality() {
    Project project = ProjectFixtures.project(List.of(Zone.of("spare", "Spare", ZoneType.AREA, 4)), List.of());

    ZoneRisk risk = engine.calculateZoneRisk(project, "spare");

    assertEquals(10.0, risk.factors().slBaseRisk(), EPSILON);
    assertEquals(10.0, risk.factors().assetCriticalityRisk(), EPSILON);
    assertEquals(0.0, risk.factors().exposureRisk(), EPSILON);
    assertEquals(0.0, risk.factors().slGapRisk(), EPSILON);
    assertEquals(4.5, risk.score(), EPSILON);
  }

  @Test
  void levelIsClassifiedFromTheReportedScore() {
    RiskFactors factors = new RiskFactors(40.0, 40.0, 40.0, 40.0, 40.0);

    ZoneRisk belowBand = RiskEngine.zoneRisk("edge", 39.996, factors);
    ZoneRisk justBelow = RiskEngine.zoneRisk("edge", 39.994, factors);

    assertEquals(40.0, belowBand.score(), EPSILON);
    assertEquals(RiskLevel.MEDIUM, belowBand.level());
    assertEquals(39.99, justBelow.score(), EPSILON);
    assertEquals(RiskLevel.LOW, justBelow.level());
    assertEquals(RiskLevel.HIGH, RiskEngine.zoneRisk("edge", 79.994, factors).level());
    assertEquals(RiskLevel.CRITICAL, RiskEngine.zoneRisk("edge", 79.996, factors).level());
  }

  @Test
  void unknownZoneIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> engine.calculateZoneRisk(ProjectFixtures.referencePlant(), "missing"));
    assertEquals("Zone not found: missing", ex.getMessage());
  }

  @Test
  void projectScoreIsTheWorstZone() {
    RiskAssessment assessment = engine.assess(ProjectFixtures.referencePlant());

    assertEquals(4, assessment.zoneRisks().size());
    assertEquals(20.0, assessment.score(), EPSILON);
    assertEquals(RiskLevel.LOW, assessment.level());
    assertEquals(17.32, assessment.weightedMeanScore(), EPSILON);
    double worst = assessment.zoneRisks().stream().mapToDouble(ZoneRisk::score).max().orElseThrow();
    assertEquals(worst, assessment.score(), EPSILON);
  }

  @Test
  void vulnerabilitiesAreMitigatedByLevelAndStatus() {
    Map<String, List<VulnerabilityInfo>> vulnerabilities = Map.of(
        "cell_line1", List.of(
            VulnerabilityInfo.open("CVE-2022-38465", "critical", 9.3),
            new VulnerabilityInfo("CVE-2021-44228", "high", null, "mitigated")),
        "site_ops", List.of(VulnerabilityInfo.open("CVE-2023-0001", "medium", null)));

    RiskAssessment assessment = engine.assess(ProjectFixtures.referencePlant(), vulnerabilities);

    ZoneRisk cell = assessment.zoneRisk("cell_line1").orElseThrow();
    assertEquals(17.015, cell.factors().vulnerabilityRisk(), 1e-6);
    assertEquals(19.6, cell.score(), EPSILON);
    ZoneRisk site = assessment.zoneRisk("site_ops").orElseThrow();
    assertEquals(17.0, site.factors().vulnerabilityRisk(), 1e-6);
    assertEquals(21.7, site.score(), EPSILON);
    assertEquals(21.7, assessment.score(), EPSILON);
  }

  @Test
  void falsePositivesContributeNothing() {
    Project project = ProjectFixtures.referencePlant();

    ZoneRisk risk = engine.calculateZoneRisk(project, "cell_line1",
        List.of(new VulnerabilityInfo("CVE-2020-0001", "critical", 10.0, "false_positive")));

    assertEquals(0.0, risk.factors().vulnerabilityRisk(), EPSILON);
  }

  @Test
  void emptyProjectScoresZero() {
    RiskAssessment assessment = engine.assess(ProjectFixtures.project(List.of(), List.of()));

    assertEquals(0.0, assessment.score(), EPSILON);
    assertEquals(0.0, assessment.weightedMeanScore(), EPSILON);
    assertEquals(RiskLevel.MINIMAL, assessment.level());
    assertTrue(assessment.zoneRisks().isEmpty());
    assertTrue(assessment.recommendations().isEmpty());
  }

  @Test
  void recommendationsCoverGapsAndMissingCapability() {
    RiskAssessment assessment = engine.assess(ProjectFixtures.referencePlant());

    List<String> recommendations = assessment.recommendations();
    assertEquals(5, recommendations.size());
    assertEquals("Conduit 'enterprise_to_dmz' connects zones with SL gap of 2. "
        + "Consider adding a DMZ or intermediate zone.", recommendations.get(0));
    assertTrue(recommendations.get(1).startsWith("Zone 'enterprise' has no SL-C defined."));
  }

  @Test
  void scanDataHighlightsUnscannedZones() {
    Map<String, List<VulnerabilityInfo>> vulnerabilities =
        Map.of("cell_line1", List.of(VulnerabilityInfo.open("CVE-2022-38465", "critical", 9.3)));

    List<String> recommendations =
        engine.assess(ProjectFixtures.referencePlant(), vulnerabilities).recommendations();

    assertTrue(recommendations.contains(
        "Zone 'Enterprise Network' has assets but no vulnerability data. Consider running a CVE scan."));
    assertTrue(recommendations.contains(
        "Zone 'Site Operations' has assets but no vulnerability data. Consider running a CVE scan."));
  }

  @Test
  void levelBandsUseInclusiveLowerBounds() {
    assertEquals(RiskLevel.CRITICAL, RiskEngine.classifyRiskLevel(80.0));
    assertEquals(RiskLevel.HIGH, RiskEngine.classifyRiskLevel(79.99));
    assertEquals(RiskLevel.MEDIUM, RiskEngine.classifyRiskLevel(40.0));
    assertEquals(RiskLevel.LOW, RiskEngine.classifyRiskLevel(20.0));
    assertEquals(RiskLevel.MINIMAL, RiskEngine.classifyRiskLevel(19.99));
  }

  @Test
  void vulnerabilityScoreMustBeWithinCvssRange() {
    assertThrows(IllegalArgumentException.class, () -> VulnerabilityInfo.open("CVE-1", "high", 11.0));
    assertEquals("open", new VulnerabilityInfo("CVE-1", "HIGH", null, " ").status());
    assertEquals("high", new VulnerabilityInfo("CVE-1", "HIGH", null, null).severity());
  }
}
