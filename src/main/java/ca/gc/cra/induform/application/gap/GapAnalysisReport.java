package ca.gc.cra.induform.application.gap;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Project-wide IEC 62443-3-3 gap analysis.
 *
 * @param projectName project display name
 * @param analysisDate time the analysis ran
 * @param overallCompliance compliance across every applicable control of every zone
 * @param zones per-zone analyses in project order
 * @param priorityRemediations most frequent remediations for partial or unmet controls, at most ten
 * @since 0.1.0
 */
public record GapAnalysisReport(
    String projectName,
    Instant analysisDate,
    double overallCompliance,
    List<ZoneGapAnalysis> zones,
    List<String> priorityRemediations) {

  public GapAnalysisReport {
    projectName = Objects.requireNonNull(projectName, "projectName");
    analysisDate = Objects.requireNonNull(analysisDate, "analysisDate");
    zones = List.copyOf(zones);
    priorityRemediations = List.copyOf(priorityRemediations);
  }

  /**
   * Counts controls with one status across all zones.
   *
   * @param status status to count
   * @return total count
   */
  public int count(ControlStatus status) {
    int count = 0;
    for (ZoneGapAnalysis zone : zones) {
      count += zone.count(status);
    }
    return count;
  }
}
