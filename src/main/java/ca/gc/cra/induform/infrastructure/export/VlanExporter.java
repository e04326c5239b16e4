package ca.gc.cra.induform.infrastructure.export;

import ca.gc.cra.induform.application.vlan.VlanAssignment;
import ca.gc.cra.induform.application.vlan.VlanMapping;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link VlanMapping} as CSV or as a Cisco IOS VLAN database snippet.
 *
 * @since 0.1.0
 */
public final class VlanExporter {
  static final String CSV_HEADER = "vlan_id,vlan_name,zone_id,zone_name,zone_type,security_level,network_segment";
  static final int MAX_DESCRIPTION_LENGTH = 80;

  /**
   * Renders one CSV row per assignment; zone names are quoted.
   *
   * @param mapping mapping to render
   * @return CSV text ending with a newline
   */
  public String exportCsv(VlanMapping mapping) {
    Objects.requireNonNull(mapping, "mapping");
    List<String> lines = new ArrayList<>();
    lines.add(CSV_HEADER);
    for (VlanAssignment assignment : mapping.assignments()) {
      lines.add(assignment.vlanId()
          + "," + assignment.vlanName()
          + "," + assignment.zoneId()
          + "," + quote(assignment.zoneName())
          + "," + assignment.zoneType().wireName()
          + "," + assignment.securityLevel()
          + "," + (assignment.networkSegment() == null ? "" : assignment.networkSegment()));
    }
    return String.join("\n", lines) + "\n";
  }

  /**
   * Renders {@code vlan}/{@code name} stanzas inside a {@code configure terminal} block.
   *
   * @param mapping mapping to render
   * @return configuration text ending with {@code end} and a newline
   */
  public String exportCisco(VlanMapping mapping) {
    Objects.requireNonNull(mapping, "mapping");
    List<String> lines = new ArrayList<>();
    lines.add("! Auto-generated VLAN configuration");
    lines.add("! Project: " + mapping.projectName());
    lines.add("!");
    lines.add("configure terminal");
    lines.add("!");
    for (VlanAssignment assignment : mapping.assignments()) {
      lines.add("vlan " + assignment.vlanId());
      lines.add(" name " + assignment.vlanName());
      String description = assignment.description();
      if (description != null && !description.isBlank()) {
        lines.add(" ! " + (description.length() > MAX_DESCRIPTION_LENGTH
            ? description.substring(0, MAX_DESCRIPTION_LENGTH) : description));
      }
      lines.add("!");
    }
    lines.add("end");
    return String.join("\n", lines) + "\n";
  }

  // Embedded quotes are doubled so names stay one CSV field.
  private static String quote(String value) {
    return "\"" + value.replace("\"", "\"\"") + "\"";
  }
}
