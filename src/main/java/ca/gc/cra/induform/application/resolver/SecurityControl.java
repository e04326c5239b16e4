package ca.gc.cra.induform.application.resolver;

import java.util.List;
import java.util.Objects;

/**
 * Concrete control derived from an IEC 62443-3-3 system requirement.
 *
 * @param requirementId system requirement id such as {@code SR 5.1}
 * @param requirementName system requirement name
 * @param controlDescription control text for the zone's security level
 * @param appliesTo zone or conduit ids the control applies to
 * @param priority implementation priority, 1 highest
 * @since 0.1.0
 */
public record SecurityControl(
    String requirementId,
    String requirementName,
    String controlDescription,
    List<String> appliesTo,
    int priority) {

  public SecurityControl {
    requirementId = Objects.requireNonNull(requirementId, "requirementId");
    requirementName = Objects.requireNonNull(requirementName, "requirementName");
    controlDescription = Objects.requireNonNull(controlDescription, "controlDescription");
    appliesTo = List.copyOf(appliesTo);
  }
}
