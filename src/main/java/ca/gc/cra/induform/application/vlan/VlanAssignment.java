package ca.gc.cra.induform.application.vlan;

import ca.gc.cra.induform.domain.model.ZoneType;
import java.util.Objects;

/**
 * VLAN assigned to one zone.
 *
 * @param zoneId zone identifier
 * @param zoneName zone display name
 * @param zoneType zone classification
 * @param vlanId 802.1Q VLAN id
 * @param vlanName switch-safe VLAN name, at most 32 characters
 * @param networkSegment zone network segment, or {@code null}
 * @param securityLevel zone SL-T
 * @param description zone description, or {@code null}
 * @since 0.1.0
 */
public record VlanAssignment(
    String zoneId,
    String zoneName,
    ZoneType zoneType,
    int vlanId,
    String vlanName,
    String networkSegment,
    int securityLevel,
    String description) {

  public VlanAssignment {
    zoneId = Objects.requireNonNull(zoneId, "zoneId");
    zoneType = Objects.requireNonNull(zoneType, "zoneType");
    vlanName = Objects.requireNonNull(vlanName, "vlanName");
  }
}
