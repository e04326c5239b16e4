package ca.gc.cra.induform.application.resolver;

import java.util.List;

/**
 * Output of {@link SecurityControlResolver#resolve}.
 *
 * @param zoneProfiles zone profiles in project order
 * @param conduitProfiles conduit profiles in project order
 * @param globalControls project-wide controls in escalation order
 * @param maxSecurityLevel highest zone SL-T, 1 when the project has no zones
 * @since 0.1.0
 */
public record ResolvedControls(
    List<ZoneSecurityProfile> zoneProfiles,
    List<ConduitSecurityProfile> conduitProfiles,
    List<GlobalControl> globalControls,
    int maxSecurityLevel) {

  public ResolvedControls {
    zoneProfiles = List.copyOf(zoneProfiles);
    conduitProfiles = List.copyOf(conduitProfiles);
    globalControls = List.copyOf(globalControls);
  }
}
