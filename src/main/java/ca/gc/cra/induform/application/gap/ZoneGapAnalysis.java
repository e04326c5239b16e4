package ca.gc.cra.induform.application.gap;

import ca.gc.cra.induform.domain.model.ZoneType;
import java.util.List;
import java.util.Objects;

/**
 * Gap analysis of one zone.
 *
 * @param zoneId zone identifier
 * @param zoneName zone display name
 * @param zoneType zone classification
 * @param securityLevelTarget zone SL-T
 * @param compliancePercentage met counts 100, partial counts 50, averaged over applicable controls
 * @param controls one assessment per catalog requirement, in catalog order
 * @since 0.1.0
 */
public record ZoneGapAnalysis(
    String zoneId,
    String zoneName,
    ZoneType zoneType,
    int securityLevelTarget,
    double compliancePercentage,
    List<ControlAssessment> controls) {

  public ZoneGapAnalysis {
    zoneId = Objects.requireNonNull(zoneId, "zoneId");
    zoneType = Objects.requireNonNull(zoneType, "zoneType");
    controls = List.copyOf(controls);
  }

  /**
   * Counts controls with one status.
   *
   * @param status status to count
   * @return number of controls in {@code status}
   */
  public int count(ControlStatus status) {
    int count = 0;
    for (ControlAssessment control : controls) {
      if (control.status() == status) {
        count++;
      }
    }
    return count;
  }

  /** Controls that apply at the zone's SL-T. */
  public int applicableControls() {
    return controls.size() - count(ControlStatus.NOT_APPLICABLE);
  }
}
