package ca.gc.cra.induform.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.application.policy.PolicyViolation;
import ca.gc.cra.induform.application.risk.RiskAssessment;
import ca.gc.cra.induform.application.risk.VulnerabilityInfo;
import ca.gc.cra.induform.application.validation.ValidationReport;
import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.domain.model.ProjectFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ProjectAssessmentUseCaseTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private RecordingMetricsPort metrics;
  private ProjectAssessmentUseCase useCase;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ProjectAssessmentUseCase.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    metrics = new RecordingMetricsPort();
    useCase = new ProjectAssessmentUseCase(metrics);
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
  }

  @Test
  void assessRunsEveryStageAndRecordsMetrics() {
    ProjectAssessment assessment = useCase.assess(ProjectFixtures.dmzBypass(), AssessmentOptions.defaults());

    assertEquals("DMZ Bypass", assessment.projectName());
    assertFalse(assessment.validation().valid());
    assertEquals(List.of("POL-002", "POL-005"),
        assessment.policyViolations().stream().map(PolicyViolation::ruleId).toList());
    assertEquals(3, assessment.risk().zoneRisks().size());
    assertEquals(3, assessment.controls().maxSecurityLevel());

    for (String stage : List.of("engine.validate", "engine.policy", "engine.risk", "engine.resolve")) {
      assertEquals(1, metrics.count(stage + ".success"), stage);
      assertTrue(metrics.hasObservation(stage + ".latencyNanos"), stage);
      assertFalse(metrics.hasCounter(stage + ".failure"), stage);
    }
    assertEquals(List.of(1L), metrics.observed("engine.validate.errors"));
    assertEquals(List.of(2L), metrics.observed("engine.policy.violations"));
    assertEquals(1, metrics.count("engine.validate.invalid"));

    boolean summaryLogged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.INFO
            && event.getFormattedMessage().contains("Assessed project 'DMZ Bypass': valid=false errors=1"));
    assertTrue(summaryLogged, "assessment summary should be logged");
  }

  @Test
  void attackPathAndGapStagesAreTimedSeparately() {
    assertEquals(1, useCase.findAttackPaths(ProjectFixtures.dmzBypass(), 5).paths().size());
    assertEquals("DMZ Bypass", useCase.analyzeGaps(ProjectFixtures.dmzBypass()).projectName());

    for (String stage : List.of("engine.attackpath", "engine.gap")) {
      assertEquals(1, metrics.count(stage + ".success"), stage);
      assertTrue(metrics.hasObservation(stage + ".latencyNanos"), stage);
    }
    assertEquals(List.of(1L), metrics.observed("engine.attackpath.paths"));
    assertFalse(metrics.hasCounter("engine.validate.valid"));
  }

  @Test
  void invalidPathLimitCountsAsFailure() {
    assertThrows(IllegalArgumentException.class, () -> useCase.findAttackPaths(ProjectFixtures.dmzBypass(), 0));

    assertEquals(1, metrics.count("engine.attackpath.failure"));
  }

  @Test
  void projectStandardsApplyWhenOptionsLeaveThemUnset() {
    ValidationReport report = useCase.validate(ProjectFixtures.referencePlant(), AssessmentOptions.defaults());

    assertTrue(report.valid());
    assertEquals(1, report.infoCount());
    assertEquals(1, metrics.count("engine.validate.valid"));
  }

  @Test
  void explicitEmptyStandardsDisableFiltering() {
    AssessmentOptions options = AssessmentOptions.defaults().withStandards(Set.of());

    ValidationReport report = useCase.validate(ProjectFixtures.dmzBypass(), options);
    List<PolicyViolation> violations = useCase.evaluatePolicies(ProjectFixtures.dmzBypass(), options);

    assertEquals(3, report.warningCount());
    assertEquals(6, violations.size());
  }

  @Test
  void explicitStandardsOverrideProjectStandards() {
    AssessmentOptions options = AssessmentOptions.defaults().withStandards(Set.of(ComplianceStandard.NIST_CSF));

    List<PolicyViolation> violations = useCase.evaluatePolicies(ProjectFixtures.dmzBypass(), options);

    assertEquals(List.of("NIST-001", "NIST-001"), violations.stream().map(PolicyViolation::ruleId).toList());
  }

  @Test
  void strictOptionTurnsWarningsIntoFailure() {
    AssessmentOptions options = AssessmentOptions.defaults()
        .withStandards(Set.of(ComplianceStandard.NIST_CSF))
        .withStrict(true);

    ValidationReport report = useCase.validate(ProjectFixtures.dmzBypass(), options);

    assertEquals(0, report.errorCount());
    assertFalse(report.valid());
  }

  @Test
  void vulnerabilitiesFlowIntoRisk() {
    AssessmentOptions options = new AssessmentOptions(false, null,
        Map.of("plc_cell", List.of(VulnerabilityInfo.open("CVE-2022-38465", "critical", 9.3))));

    RiskAssessment withScan = useCase.assessRisk(ProjectFixtures.dmzBypass(), options);
    RiskAssessment withoutScan = useCase.assessRisk(ProjectFixtures.dmzBypass(), AssessmentOptions.defaults());

    double cellWith = withScan.zoneRisk("plc_cell").orElseThrow().score();
    double cellWithout = withoutScan.zoneRisk("plc_cell").orElseThrow().score();
    assertTrue(cellWith > cellWithout);
    assertEquals(2, metrics.count("engine.risk.success"));
  }
}
