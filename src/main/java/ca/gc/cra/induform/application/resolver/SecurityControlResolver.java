package ca.gc.cra.induform.application.resolver;

import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.security.FoundationalRequirement;
import ca.gc.cra.induform.domain.security.SecurityLevels;
import ca.gc.cra.induform.domain.security.SecurityRequirement;
import ca.gc.cra.induform.domain.security.SecurityRequirementCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns zone and conduit security levels into concrete control recommendations.
 * <p><strong>Why:</strong> Operators need an actionable control list per zone and conduit rather than abstract
 * target levels.</p>
 * <p><strong>Role:</strong> Application service backed by {@link SecurityRequirementCatalog}.</p>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class SecurityControlResolver {
  private static final Logger log = LoggerFactory.getLogger(SecurityControlResolver.class);

  static final String DEEP_INSPECTION = "Deploy application-layer firewall with deep packet inspection";
  static final String ENCRYPTION = "Encrypt all traffic using TLS 1.3 or IPsec";
  static final String STATEFUL_FIREWALL = "Enable stateful firewall with protocol validation";
  static final String PROTOCOL_AWARE_IDS = "Deploy industrial protocol-aware IDS/IPS";
  static final String DEFINE_FLOWS = "Define explicit protocol flows (default deny)";

  /**
   * Resolves controls for every zone and conduit plus the project-wide baseline.
   *
   * @param project project to resolve
   * @return resolved controls
   */
  public ResolvedControls resolve(Project project) {
    Objects.requireNonNull(project, "project");
    List<ZoneSecurityProfile> zoneProfiles = new ArrayList<>();
    int maxLevel = 1;
    for (Zone zone : project.zones()) {
      zoneProfiles.add(resolveZone(zone));
      maxLevel = Math.max(maxLevel, zone.securityLevelTarget());
    }
    List<ConduitSecurityProfile> conduitProfiles = new ArrayList<>();
    for (Conduit conduit : project.conduits()) {
      conduitProfiles.add(resolveConduit(conduit,
          project.requireZone(conduit.fromZone()), project.requireZone(conduit.toZone())));
    }
    List<GlobalControl> globals = globalControls(maxLevel);
    log.debug("Resolved controls for {}: maxSecurityLevel={} globalControls={}", project, maxLevel, globals.size());
    return new ResolvedControls(zoneProfiles, conduitProfiles, globals, maxLevel);
  }

  /**
   * Returns the project-wide controls for a maximum security level.
   *
   * @param maxSecurityLevel highest zone SL-T
   * @return controls in escalation order; each level's set contains the previous level's
   */
  public static List<GlobalControl> globalControls(int maxSecurityLevel) {
    List<GlobalControl> controls = new ArrayList<>();
    for (GlobalControl control : GlobalControl.values()) {
      if (maxSecurityLevel >= control.minimumLevel()) {
        controls.add(control);
      }
    }
    return List.copyOf(controls);
  }

  /**
   * Maps a foundational requirement to an implementation priority.
   *
   * @param category foundational requirement
   * @return 1 for restricted data flow, 2 for identification and use control, 3 for integrity and response,
   *     4 otherwise
   */
  static int priorityFor(FoundationalRequirement category) {
    return switch (category) {
      case FR5 -> 1;
      case FR1, FR2 -> 2;
      case FR3, FR6 -> 3;
      default -> 4;
    };
  }

  private static ZoneSecurityProfile resolveZone(Zone zone) {
    int level = zone.securityLevelTarget();
    List<SecurityRequirement> requirements = SecurityRequirementCatalog.requirementsForLevel(level);
    List<String> ids = new ArrayList<>(requirements.size());
    List<SecurityControl> controls = new ArrayList<>(requirements.size());
    for (SecurityRequirement requirement : requirements) {
      ids.add(requirement.id());
      controls.add(new SecurityControl(
          requirement.id(),
          requirement.name(),
          requirement.detailFor(level),
          List.of(zone.id()),
          priorityFor(requirement.foundationalRequirement())));
    }
    return new ZoneSecurityProfile(zone.id(), zone.name(), level, ids, controls);
  }

  private static ConduitSecurityProfile resolveConduit(Conduit conduit, Zone from, Zone to) {
    int required = SecurityLevels.conduitSecurityLevel(from.securityLevelTarget(), to.securityLevelTarget());
    boolean inspection = SecurityLevels.requiresInspection(from.securityLevelTarget(), to.securityLevelTarget());
    boolean encryption = required >= 3;

    List<String> recommendations = new ArrayList<>();
    if (inspection) {
      recommendations.add(DEEP_INSPECTION);
    }
    if (encryption) {
      recommendations.add(ENCRYPTION);
    }
    if (required >= 2) {
      recommendations.add(STATEFUL_FIREWALL);
    }
    if (required >= 3) {
      recommendations.add(PROTOCOL_AWARE_IDS);
    }
    if (conduit.flows().isEmpty()) {
      recommendations.add(DEFINE_FLOWS);
    }

    List<String> protocols = new ArrayList<>(conduit.flows().size());
    for (ProtocolFlow flow : conduit.flows()) {
      protocols.add(flow.protocol());
    }
    return new ConduitSecurityProfile(conduit.id(), from.id(), to.id(), required,
        inspection || conduit.requiresInspection(), encryption, protocols, recommendations);
  }
}
