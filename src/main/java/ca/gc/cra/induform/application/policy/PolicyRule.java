package ca.gc.cra.induform.application.policy;

import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import ca.gc.cra.induform.domain.protocol.IndustrialProtocols;
import ca.gc.cra.induform.domain.security.SecurityLevels;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Named policy predicates over a project, one constant per rule id.
 * <p><strong>Why:</strong> Policies express organisational expectations on top of the structural validator; each
 * rule has a fixed default severity and documented intent.</p>
 * <p><strong>Role:</strong> Rule table executed in declaration order by {@link PolicyEvaluator}.</p>
 * <p><strong>Thread-safety:</strong> Constants are stateless.</p>
 *
 * @since 0.1.0
 */
public enum PolicyRule {
  DEFAULT_DENY("POL-001", "Default Deny", "All traffic must be explicitly allowed via conduits",
      PolicySeverity.HIGH) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Conduit conduit : project.conduits()) {
        if (!conduit.flows().isEmpty()) {
          continue;
        }
        out.add(violation(
            "Conduit '" + conduit.id() + "' between '" + project.requireZone(conduit.fromZone()).name()
                + "' and '" + project.requireZone(conduit.toZone()).name() + "' has no protocol flows defined. "
                + "Traffic is implicitly undefined rather than explicitly denied",
            List.of(conduit.id(), conduit.fromZone(), conduit.toZone()),
            "Define explicit protocol flows on this conduit to enforce default-deny. Only explicitly allowed "
                + "traffic should traverse zone boundaries."));
      }
    }
  },

  SL_BOUNDARY_PROTECTION("POL-002", "SL Boundary Protection",
      "Conduits spanning SL difference >= 2 require inspection", PolicySeverity.HIGH) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Conduit conduit : project.conduits()) {
        Zone from = project.requireZone(conduit.fromZone());
        Zone to = project.requireZone(conduit.toZone());
        if (SecurityLevels.requiresInspection(from.securityLevelTarget(), to.securityLevelTarget())
            && !conduit.requiresInspection()) {
          out.add(violation(
              "Conduit '" + conduit.id() + "' spans SL difference of "
                  + SecurityLevels.gap(from.securityLevelTarget(), to.securityLevelTarget())
                  + " without inspection enabled",
              List.of(conduit.id(), from.id(), to.id()),
              "Enable requires_inspection on the conduit or deploy a deep packet inspection firewall"));
        }
      }
    }
  },

  PROTOCOL_ALLOWLIST("POL-003", "Protocol Allowlist", "Only approved industrial protocols are permitted",
      PolicySeverity.MEDIUM) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      Set<String> allowlist = IndustrialProtocols.effectiveAllowlist(project.metadata());
      for (Conduit conduit : project.conduits()) {
        for (ProtocolFlow flow : conduit.flows()) {
          if (IndustrialProtocols.isAllowed(allowlist, flow.protocol())) {
            continue;
          }
          out.add(violation(
              "Protocol '" + flow.protocol() + "' in conduit '" + conduit.id()
                  + "' is not in the approved industrial protocol allowlist",
              List.of(conduit.id()),
              "Replace '" + flow.protocol() + "' with an approved industrial protocol or add it to the "
                  + "project's allowed protocols list if justified"));
        }
      }
    }
  },

  CELL_ZONE_ISOLATION("POL-004", "Cell Zone Isolation",
      "Cell zones must not have direct connectivity to each other", PolicySeverity.MEDIUM) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Conduit conduit : project.conduits()) {
        if (typeOf(project, conduit.fromZone()) == ZoneType.CELL
            && typeOf(project, conduit.toZone()) == ZoneType.CELL) {
          out.add(violation(
              "Direct cell-to-cell communication via conduit '" + conduit.id() + "' between '"
                  + conduit.fromZone() + "' and '" + conduit.toZone() + "'",
              List.of(conduit.id(), conduit.fromZone(), conduit.toZone()),
              "Route cell-to-cell traffic through a supervisory zone or DMZ"));
        }
      }
    }
  },

  DMZ_REQUIREMENT("POL-005", "DMZ Requirement", "Enterprise to cell communication must traverse DMZ",
      PolicySeverity.CRITICAL) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Conduit conduit : project.conduits()) {
        ZoneType from = typeOf(project, conduit.fromZone());
        ZoneType to = typeOf(project, conduit.toZone());
        if ((from == ZoneType.ENTERPRISE && to == ZoneType.CELL)
            || (from == ZoneType.CELL && to == ZoneType.ENTERPRISE)) {
          out.add(violation(
              "Conduit '" + conduit.id() + "' directly connects enterprise and cell zones without traversing DMZ",
              List.of(conduit.id(), conduit.fromZone(), conduit.toZone()),
              "Create a DMZ zone and route enterprise-cell traffic through it"));
        }
      }
    }
  },

  SAFETY_ZONE_PROTECTION("POL-006", "Safety Zone Protection",
      "Safety zones require SL-T >= 3 and limited connectivity", PolicySeverity.CRITICAL) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Zone zone : project.zones()) {
        if (zone.type() != ZoneType.SAFETY) {
          continue;
        }
        if (zone.securityLevelTarget() < 3) {
          out.add(violation(
              "Safety zone '" + zone.id() + "' has SL-T=" + zone.securityLevelTarget()
                  + ", but safety zones require SL-T >= 3",
              List.of(zone.id()),
              "Increase security_level_target to at least 3"));
        }
        int conduitCount = project.conduitsForZone(zone.id()).size();
        if (conduitCount > MAX_SAFETY_CONDUITS) {
          out.add(new PolicyViolation(id(), displayName(), PolicySeverity.HIGH,
              "Safety zone '" + zone.id() + "' has " + conduitCount
                  + " conduits. Safety zones should have minimal connectivity.",
              List.of(zone.id()),
              "Reduce the number of conduits to safety zones"));
        }
      }
    }
  },

  PURDUE_HIERARCHY("POL-007", "Purdue Model Hierarchy", "Conduits should connect adjacent Purdue model levels",
      PolicySeverity.LOW) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Conduit conduit : project.conduits()) {
        Zone from = project.requireZone(conduit.fromZone());
        Zone to = project.requireZone(conduit.toZone());
        if (from.type() == to.type() || from.type().isPurdueAdjacentTo(to.type())) {
          continue;
        }
        int skipped = Math.abs(from.type().purdueLevel() - to.type().purdueLevel()) - 1;
        out.add(violation(
            "Conduit '" + conduit.id() + "' connects " + from.type().wireName() + " zone '" + from.name()
                + "' directly to " + to.type().wireName() + " zone '" + to.name() + "' (skips " + skipped
                + " Purdue model level" + (skipped == 1 ? "" : "s") + ")",
            List.of(conduit.id(), from.id(), to.id()),
            "Route traffic through intermediate zones at each Purdue level. Direct connections should only "
                + "span one level in the hierarchy: Enterprise <-> DMZ <-> Site <-> Area <-> Cell <-> Safety"));
      }
    }
  },

  ASSET_IDENTIFICATION("NIST-001", "Asset Identification",
      "All zones should have assets registered for complete inventory", PolicySeverity.MEDIUM) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Zone zone : project.zones()) {
        if (zone.assets().isEmpty()) {
          out.add(violation(
              "Zone '" + zone.name() + "' (" + zone.id() + ") has no assets registered. "
                  + "NIST CSF requires complete asset identification.",
              List.of(zone.id()),
              "Add assets to this zone to maintain a complete inventory"));
        }
      }
    }
  },

  ESP_BOUNDARY("CIP-001", "ESP Boundary", "Critical zones require a DMZ as Electronic Security Perimeter",
      PolicySeverity.HIGH) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      List<Zone> critical = criticalZones(project);
      if (critical.isEmpty() || project.hasZoneOfType(ZoneType.DMZ)) {
        return;
      }
      List<String> ids = new ArrayList<>();
      for (Zone zone : critical) {
        ids.add(zone.id());
      }
      out.add(violation(
          "Critical zones exist but no DMZ zone provides an Electronic Security Perimeter (ESP) boundary",
          ids,
          "Add a DMZ zone to establish an ESP boundary per NERC CIP-005"));
    }
  },

  BES_ASSET_CLASSIFICATION("CIP-002", "BES Asset Classification",
      "Assets in critical zones must have a criticality classification", PolicySeverity.MEDIUM) {
    @Override
    void evaluate(Project project, List<PolicyViolation> out) {
      for (Zone zone : criticalZones(project)) {
        for (Asset asset : zone.assets()) {
          if (asset.criticality() != Asset.DEFAULT_CRITICALITY) {
            continue;
          }
          out.add(violation(
              "Asset '" + asset.name() + "' in critical zone '" + zone.name() + "' has default criticality. "
                  + "NERC CIP-002 requires explicit BES Cyber Asset classification.",
              List.of(zone.id(), asset.id()),
              "Set an explicit criticality level (1-5) for this asset based on its impact on reliable "
                  + "BES operation"));
        }
      }
    }
  };

  /** Conduit count above which a safety zone is considered over-connected. */
  static final int MAX_SAFETY_CONDUITS = 2;

  private final String id;
  private final String displayName;
  private final String description;
  private final PolicySeverity severity;

  PolicyRule(String id, String displayName, String description, PolicySeverity severity) {
    this.id = id;
    this.displayName = displayName;
    this.description = description;
    this.severity = severity;
  }

  /** Rule identifier such as {@code POL-001}. */
  public String id() {
    return id;
  }

  /** Rule display name such as {@code Default Deny}. */
  public String displayName() {
    return displayName;
  }

  public String description() {
    return description;
  }

  /** Default severity of violations emitted by this rule. */
  public PolicySeverity severity() {
    return severity;
  }

  /**
   * Appends this rule's violations for {@code project} to {@code out}.
   *
   * @param project project under evaluation
   * @param out accumulator preserving emission order
   */
  abstract void evaluate(Project project, List<PolicyViolation> out);

  PolicyViolation violation(String message, List<String> affected, String remediation) {
    return new PolicyViolation(id, displayName, severity, message, affected, remediation);
  }

  /**
   * Finds a rule by id.
   *
   * @param ruleId rule identifier
   * @return matching rule
   * @throws IllegalArgumentException if no rule has that id
   */
  public static PolicyRule fromId(String ruleId) {
    for (PolicyRule rule : values()) {
      if (rule.id.equals(ruleId)) {
        return rule;
      }
    }
    throw new IllegalArgumentException("Unknown policy rule: " + ruleId);
  }

  private static ZoneType typeOf(Project project, String zoneId) {
    return project.requireZone(zoneId).type();
  }

  private static List<Zone> criticalZones(Project project) {
    List<Zone> critical = new ArrayList<>();
    for (Zone zone : project.zones()) {
      if ((zone.type() == ZoneType.CELL || zone.type() == ZoneType.SAFETY) && zone.securityLevelTarget() >= 3) {
        critical.add(zone);
      }
    }
    return critical;
  }
}
