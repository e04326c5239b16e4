package ca.gc.cra.induform.application.gap;

import ca.gc.cra.induform.domain.security.FoundationalRequirement;
import java.util.Objects;

/**
 * Assessment of a single IEC 62443-3-3 system requirement for one zone.
 *
 * @param requirementId system requirement id such as {@code SR 5.1}
 * @param requirementName system requirement name
 * @param foundationalRequirement parent category
 * @param status assessment outcome
 * @param details what was observed in the zone
 * @param remediation suggested action, or {@code null} when nothing is required
 * @since 0.1.0
 */
public record ControlAssessment(
    String requirementId,
    String requirementName,
    FoundationalRequirement foundationalRequirement,
    ControlStatus status,
    String details,
    String remediation) {

  public ControlAssessment {
    requirementId = Objects.requireNonNull(requirementId, "requirementId");
    requirementName = Objects.requireNonNull(requirementName, "requirementName");
    foundationalRequirement = Objects.requireNonNull(foundationalRequirement, "foundationalRequirement");
    status = Objects.requireNonNull(status, "status");
    details = Objects.requireNonNull(details, "details");
  }
}
