package ca.gc.cra.induform.application.vlan;

import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import ca.gc.cra.induform.validation.Numbers;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assigns one VLAN per zone, either from a per-type range or sequentially from a start id.
 * <p><strong>Why:</strong> A zone is a broadcast domain; giving each zone its own VLAN is the first step in
 * enforcing the zone model on switches.</p>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class VlanMappingGenerator {
  private static final Logger log = LoggerFactory.getLogger(VlanMappingGenerator.class);

  /** Default VLAN 1 and the 802.1Q reserved id 4095. */
  public static final List<Integer> RESERVED_VLANS = List.of(1, 4095);

  static final int MIN_VLAN = 2;
  static final int MAX_VLAN = 4094;
  static final int MAX_NAME_ID_LENGTH = 27;

  private static final Map<ZoneType, int[]> RANGES = ranges();

  /**
   * Assigns VLANs from the range of each zone type, in project order.
   *
   * @param project source project
   * @return mapping with one assignment per zone
   * @throws IllegalArgumentException if a zone type has more zones than its range holds
   */
  public VlanMapping generate(Project project) {
    Objects.requireNonNull(project, "project");
    Map<ZoneType, Integer> used = new EnumMap<>(ZoneType.class);
    List<VlanAssignment> assignments = new ArrayList<>();
    for (Zone zone : project.zones()) {
      int[] range = range(zone.type());
      int offset = used.getOrDefault(zone.type(), 0);
      used.put(zone.type(), offset + 1);
      int vlanId = range[0] + offset;
      if (vlanId > range[1]) {
        throw new IllegalArgumentException("Exceeded VLAN range for zone type " + zone.type().wireName()
            + ": " + range[0] + "-" + range[1]);
      }
      assignments.add(assignment(zone, vlanId));
    }
    return mapping(project, assignments);
  }

  /**
   * Assigns consecutive VLANs starting at {@code startVlan}, in project order.
   *
   * @param project source project
   * @param startVlan first VLAN id, between 2 and 4094
   * @return mapping with one assignment per zone
   * @throws IllegalArgumentException if the start id is out of range or the zones run past 4094
   */
  public VlanMapping generate(Project project, int startVlan) {
    Objects.requireNonNull(project, "project");
    Numbers.requireRange("start_vlan", startVlan, MIN_VLAN, MAX_VLAN);
    List<VlanAssignment> assignments = new ArrayList<>();
    int vlanId = startVlan;
    for (Zone zone : project.zones()) {
      if (vlanId > MAX_VLAN) {
        throw new IllegalArgumentException("Sequential VLAN assignment from " + startVlan
            + " runs past " + MAX_VLAN + " at zone '" + zone.id() + "'");
      }
      assignments.add(assignment(zone, vlanId++));
    }
    return mapping(project, assignments);
  }

  /**
   * Returns the VLAN range used for a zone type.
   *
   * @param type zone type
   * @return inclusive {@code [first, last]} pair
   */
  static int[] range(ZoneType type) {
    return RANGES.get(type).clone();
  }

  private static VlanAssignment assignment(Zone zone, int vlanId) {
    String id = zone.id().length() > MAX_NAME_ID_LENGTH ? zone.id().substring(0, MAX_NAME_ID_LENGTH) : zone.id();
    return new VlanAssignment(zone.id(), zone.name(), zone.type(), vlanId, "VLAN_" + id,
        zone.networkSegment(), zone.securityLevelTarget(), zone.description());
  }

  private static VlanMapping mapping(Project project, List<VlanAssignment> assignments) {
    log.debug("Assigned {} VLAN(s) for {}", assignments.size(), project);
    return new VlanMapping(project.metadata().name(), assignments, RESERVED_VLANS);
  }

  private static Map<ZoneType, int[]> ranges() {
    Map<ZoneType, int[]> ranges = new EnumMap<>(ZoneType.class);
    ranges.put(ZoneType.ENTERPRISE, new int[] {100, 199});
    ranges.put(ZoneType.SITE, new int[] {200, 299});
    ranges.put(ZoneType.DMZ, new int[] {300, 399});
    ranges.put(ZoneType.AREA, new int[] {400, 499});
    ranges.put(ZoneType.CELL, new int[] {500, 699});
    ranges.put(ZoneType.SAFETY, new int[] {700, 799});
    return ranges;
  }
}
