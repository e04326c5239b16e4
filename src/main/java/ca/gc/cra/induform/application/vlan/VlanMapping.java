package ca.gc.cra.induform.application.vlan;

import java.util.List;
import java.util.Objects;

/**
 * VLAN plan for a project.
 *
 * @param projectName project display name
 * @param assignments one assignment per zone in project order
 * @param reservedVlans ids that must not be assigned
 * @since 0.1.0
 */
public record VlanMapping(String projectName, List<VlanAssignment> assignments, List<Integer> reservedVlans) {
  public VlanMapping {
    projectName = Objects.requireNonNull(projectName, "projectName");
    assignments = List.copyOf(assignments);
    reservedVlans = List.copyOf(reservedVlans);
  }
}
