package ca.gc.cra.induform.application.gap;

import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.security.SecurityRequirement;
import ca.gc.cra.induform.domain.security.SecurityRequirementCatalog;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assesses every zone against the IEC 62443-3-3 system requirements and reports which
 * controls are met, partially met or missing.
 * <p><strong>Why:</strong> Owners need a per-SR to-do list, not only a risk score, to plan remediation.</p>
 * <p><strong>Role:</strong> Application service; the injected clock only stamps the report.</p>
 * <p><strong>Thread-safety:</strong> Immutable and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class GapAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(GapAnalyzer.class);

  static final int MAX_PRIORITY_REMEDIATIONS = 10;

  private final Clock clock;

  public GapAnalyzer() {
    this(Clock.systemUTC());
  }

  public GapAnalyzer(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs the gap analysis.
   *
   * @param project project to analyze
   * @return report with one entry per zone in project order
   */
  public GapAnalysisReport analyze(Project project) {
    Objects.requireNonNull(project, "project");
    List<ZoneGapAnalysis> zones = new ArrayList<>();
    for (Zone zone : project.zones()) {
      zones.add(analyzeZone(zone, project));
    }

    int met = 0;
    int partial = 0;
    int applicable = 0;
    Map<String, Integer> remediationCounts = new LinkedHashMap<>();
    for (ZoneGapAnalysis zone : zones) {
      met += zone.count(ControlStatus.MET);
      partial += zone.count(ControlStatus.PARTIAL);
      applicable += zone.applicableControls();
      for (ControlAssessment control : zone.controls()) {
        boolean open = control.status() == ControlStatus.PARTIAL || control.status() == ControlStatus.UNMET;
        if (open && control.remediation() != null) {
          remediationCounts.merge(control.remediation(), 1, Integer::sum);
        }
      }
    }

    List<String> priorities = new ArrayList<>(remediationCounts.keySet());
    priorities.sort(Comparator.comparing(remediationCounts::get, Comparator.reverseOrder()));
    if (priorities.size() > MAX_PRIORITY_REMEDIATIONS) {
      priorities = priorities.subList(0, MAX_PRIORITY_REMEDIATIONS);
    }

    GapAnalysisReport report = new GapAnalysisReport(
        project.metadata().name(),
        clock.instant(),
        compliance(met, partial, applicable),
        zones,
        priorities);
    log.debug("Gap analysis of {}: {}% overall, {} unmet control(s)",
        project, report.overallCompliance(), report.count(ControlStatus.UNMET));
    return report;
  }

  private static ZoneGapAnalysis analyzeZone(Zone zone, Project project) {
    List<ControlAssessment> controls = new ArrayList<>();
    int met = 0;
    int partial = 0;
    int applicable = 0;
    for (RequirementCheck check : RequirementCheck.values()) {
      SecurityRequirement requirement = SecurityRequirementCatalog.requirement(check.requirementId())
          .orElseThrow(() -> new IllegalStateException("Requirement missing from catalog: "
              + check.requirementId()));
      if (!requirement.appliesAt(zone.securityLevelTarget())) {
        controls.add(new ControlAssessment(requirement.id(), requirement.name(),
            requirement.foundationalRequirement(), ControlStatus.NOT_APPLICABLE,
            "Only required for SL-T >= " + requirement.minimumLevel() + ".", null));
        continue;
      }
      RequirementCheck.Finding finding = check.assess(zone, project);
      controls.add(new ControlAssessment(requirement.id(), requirement.name(),
          requirement.foundationalRequirement(), finding.status(), finding.details(), finding.remediation()));
      applicable++;
      if (finding.status() == ControlStatus.MET) {
        met++;
      } else if (finding.status() == ControlStatus.PARTIAL) {
        partial++;
      }
    }
    return new ZoneGapAnalysis(zone.id(), zone.name(), zone.type(), zone.securityLevelTarget(),
        compliance(met, partial, applicable), controls);
  }

  /** Met counts 100, partial 50; nothing applicable is fully compliant. */
  static double compliance(int met, int partial, int applicable) {
    if (applicable == 0) {
      return 100.0;
    }
    return Math.round((met * 100.0 + partial * 50.0) / applicable * 10.0) / 10.0;
  }
}
