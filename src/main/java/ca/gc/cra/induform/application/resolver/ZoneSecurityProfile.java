package ca.gc.cra.induform.application.resolver;

import java.util.List;

/**
 * Controls resolved for one zone.
 *
 * @param zoneId zone id
 * @param zoneName zone name
 * @param securityLevelTarget zone SL-T
 * @param applicableRequirements ids of the system requirements in force at the SL-T
 * @param recommendedControls one control per applicable requirement, in catalog order
 * @since 0.1.0
 */
public record ZoneSecurityProfile(
    String zoneId,
    String zoneName,
    int securityLevelTarget,
    List<String> applicableRequirements,
    List<SecurityControl> recommendedControls) {

  public ZoneSecurityProfile {
    applicableRequirements = List.copyOf(applicableRequirements);
    recommendedControls = List.copyOf(recommendedControls);
  }
}
