package ca.gc.cra.induform.application.validation;

import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.AssetType;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.ProtocolFlow;
import ca.gc.cra.induform.domain.model.Zone;
import ca.gc.cra.induform.domain.model.ZoneType;
import ca.gc.cra.induform.domain.protocol.IndustrialProtocols;
import ca.gc.cra.induform.domain.security.SecurityLevels;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Ordered battery of project validation checks, one constant per finding code.
 * <p><strong>Why:</strong> Each code has a fixed severity and an independent predicate; declaration order is the
 * order findings appear in a {@link ValidationReport}.</p>
 * <p><strong>Role:</strong> Rule table executed by {@link ProjectValidator}.</p>
 * <p><strong>Thread-safety:</strong> Constants are stateless; checks only read the project.</p>
 *
 * @since 0.1.0
 */
public enum ValidationCheck {
  ZONE_CIRCULAR_REF(ValidationSeverity.ERROR) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      Set<Set<String>> reported = new HashSet<>();
      for (Zone start : project.zones()) {
        List<String> path = new ArrayList<>();
        String current = start.id();
        while (current != null) {
          int seen = path.indexOf(current);
          if (seen >= 0) {
            List<String> cycle = path.subList(seen, path.size());
            if (reported.add(new TreeSet<>(cycle))) {
              String anchor = firstInProjectOrder(project, cycle);
              out.add(result(
                  "Circular parent reference detected for zone '" + anchor + "' ("
                      + String.join(" -> ", cycle) + " -> " + cycle.get(0) + ")",
                  "zones[" + anchor + "].parent_zone",
                  "Remove the circular reference in zone hierarchy"));
            }
            break;
          }
          path.add(current);
          current = project.zone(current).map(Zone::parentZone).orElse(null);
        }
      }
    }
  },

  CONDUIT_SL_INSUFFICIENT(ValidationSeverity.ERROR) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Conduit conduit : project.conduits()) {
        Integer explicit = conduit.securityLevelRequired();
        if (explicit == null) {
          continue;
        }
        Zone from = project.requireZone(conduit.fromZone());
        Zone to = project.requireZone(conduit.toZone());
        int required = SecurityLevels.conduitSecurityLevel(from.securityLevelTarget(), to.securityLevelTarget());
        if (explicit < required) {
          out.add(result(
              "Conduit '" + conduit.id() + "' has security_level_required=" + explicit
                  + " but connects zones with SL-T " + from.securityLevelTarget() + " and "
                  + to.securityLevelTarget() + " (requires at least " + required + ")",
              "conduits[" + conduit.id() + "].security_level_required",
              "Set security_level_required to at least " + required));
        }
      }
    }
  },

  CONDUIT_INSPECTION_RECOMMENDED(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Conduit conduit : project.conduits()) {
        Zone from = project.requireZone(conduit.fromZone());
        Zone to = project.requireZone(conduit.toZone());
        if (SecurityLevels.requiresInspection(from.securityLevelTarget(), to.securityLevelTarget())
            && !conduit.requiresInspection()) {
          int gap = SecurityLevels.gap(from.securityLevelTarget(), to.securityLevelTarget());
          out.add(result(
              "Conduit '" + conduit.id() + "' spans SL difference of " + gap + " (SL-T "
                  + from.securityLevelTarget() + " to " + to.securityLevelTarget()
                  + "). Deep packet inspection is recommended.",
              "conduits[" + conduit.id() + "].requires_inspection",
              "Set requires_inspection: true or add inspection device"));
        }
      }
    }
  },

  PURDUE_NON_ADJACENT(ValidationSeverity.INFO) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Conduit conduit : project.conduits()) {
        Zone from = project.requireZone(conduit.fromZone());
        Zone to = project.requireZone(conduit.toZone());
        if (from.type() == to.type() || from.type().isPurdueAdjacentTo(to.type())) {
          continue;
        }
        int skipped = Math.abs(from.type().purdueLevel() - to.type().purdueLevel()) - 1;
        out.add(result(
            "Conduit '" + conduit.id() + "' connects " + from.type().wireName() + " zone '" + from.name()
                + "' to " + to.type().wireName() + " zone '" + to.name() + "', skipping " + skipped
                + " Purdue model level" + (skipped == 1 ? "" : "s") + ".",
            "conduits[" + conduit.id() + "]",
            "Consider adding intermediate zones or document the business justification for this "
                + "cross-level connection."));
      }
    }
  },

  DMZ_BYPASS(ValidationSeverity.ERROR) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      if (!project.hasZoneOfType(ZoneType.DMZ)) {
        return;
      }
      for (Conduit conduit : project.conduits()) {
        String enterprise = enterpriseSideOfCellLink(project, conduit);
        if (enterprise != null) {
          String cell = enterprise.equals(conduit.fromZone()) ? conduit.toZone() : conduit.fromZone();
          out.add(result(
              "Conduit '" + conduit.id() + "' directly connects enterprise zone '" + enterprise
                  + "' to cell zone '" + cell + "' bypassing the DMZ",
              "conduits[" + conduit.id() + "]",
              "Route traffic through DMZ zone for proper security boundary"));
        }
      }
    }
  },

  DMZ_MISSING(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      if (project.hasZoneOfType(ZoneType.DMZ)) {
        return;
      }
      for (Conduit conduit : project.conduits()) {
        if (enterpriseSideOfCellLink(project, conduit) != null) {
          out.add(result(
              "Conduit '" + conduit.id() + "' connects enterprise to cell zone but no DMZ zone exists "
                  + "in the project",
              "conduits[" + conduit.id() + "]",
              "Add a DMZ zone between enterprise and cell zones"));
        }
      }
    }
  },

  CELL_ISOLATION_VIOLATION(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Conduit conduit : project.conduits()) {
        if (project.requireZone(conduit.fromZone()).type() == ZoneType.CELL
            && project.requireZone(conduit.toZone()).type() == ZoneType.CELL) {
          out.add(result(
              "Conduit '" + conduit.id() + "' allows direct communication between cell zones '"
                  + conduit.fromZone() + "' and '" + conduit.toZone()
                  + "'. Cell zones should typically be isolated.",
              "conduits[" + conduit.id() + "]",
              "Consider routing through a supervisory zone or DMZ, or document the business "
                  + "justification for this connection"));
        }
      }
    }
  },

  PROTOCOL_NOT_IN_ALLOWLIST(ValidationSeverity.INFO) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      Set<String> allowlist = IndustrialProtocols.effectiveAllowlist(project.metadata());
      for (Conduit conduit : project.conduits()) {
        for (ProtocolFlow flow : conduit.flows()) {
          if (!IndustrialProtocols.isAllowed(allowlist, flow.protocol())) {
            out.add(result(
                "Protocol '" + flow.protocol() + "' in conduit '" + conduit.id()
                    + "' is not in the standard industrial protocol allowlist",
                "conduits[" + conduit.id() + "].flows[].protocol",
                "Verify this protocol is required and appropriate for OT networks"));
          }
        }
      }
    }
  },

  CRITICAL_ASSET_LOW_SL(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Zone zone : project.zones()) {
        if (zone.securityLevelTarget() > 1) {
          continue;
        }
        for (Asset asset : zone.assets()) {
          if (CRITICAL_ASSET_TYPES.contains(asset.type())) {
            out.add(result(
                "Critical asset '" + asset.name() + "' (" + asset.type().wireName() + ") is in zone '"
                    + zone.id() + "' with SL-T=" + zone.securityLevelTarget()
                    + ". Consider a higher security level.",
                "zones[" + zone.id() + "].assets[" + asset.id() + "]",
                "Place critical assets in zones with SL-T >= 2"));
          }
        }
      }
    }
  },

  ZONE_NO_CONDUITS(ValidationSeverity.INFO) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Zone zone : project.zones()) {
        if (project.conduitsForZone(zone.id()).isEmpty()) {
          out.add(result(
              "Zone '" + zone.name() + "' (" + zone.id() + ") has no conduits. "
                  + "It may be isolated unintentionally.",
              "zones[" + zone.id() + "]",
              "Add a conduit to connect this zone or remove it if unused"));
        }
      }
    }
  },

  CONDUIT_NO_FLOWS(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Conduit conduit : project.conduits()) {
        if (conduit.flows().isEmpty()) {
          out.add(result(
              "Conduit '" + conduit.id() + "' has no protocol flows defined. Traffic is implicitly undefined.",
              "conduits[" + conduit.id() + "]",
              "Define explicit protocol flows for this conduit"));
        }
      }
    }
  },

  SAFETY_ZONE_NON_SAFETY_ASSET(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Zone zone : project.zones()) {
        if (zone.type() != ZoneType.SAFETY) {
          continue;
        }
        for (Asset asset : zone.assets()) {
          if (!SAFETY_ASSET_TYPES.contains(asset.type())) {
            out.add(result(
                "Asset '" + asset.name() + "' (" + asset.type().wireName() + ") in safety zone '"
                    + zone.name() + "' is not a typical safety zone asset type",
                "zones[" + zone.id() + "].assets[" + asset.id() + "]",
                "Safety zones should primarily contain safety-related assets (PLCs, IEDs, RTUs, DCS). "
                    + "Consider moving this asset to another zone."));
          }
        }
      }
    }
  },

  NIST_ASSET_INVENTORY_GAP(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      for (Zone zone : project.zones()) {
        if (zone.assets().isEmpty()) {
          out.add(result(
              "Zone '" + zone.name() + "' (" + zone.id() + ") has no assets registered. "
                  + "NIST CSF requires a complete asset inventory.",
              "zones[" + zone.id() + "]",
              "Add assets to this zone to maintain a complete inventory"));
        }
      }
    }
  },

  CIP_ESP_MISSING(ValidationSeverity.WARNING) {
    @Override
    void run(Project project, List<ValidationResult> out) {
      if (project.hasZoneOfType(ZoneType.DMZ)) {
        return;
      }
      List<Zone> critical = criticalZones(project);
      if (critical.isEmpty()) {
        return;
      }
      String names = critical.stream()
          .limit(3)
          .map(zone -> "'" + zone.name() + "'")
          .collect(Collectors.joining(", "));
      out.add(result(
          "Critical zones (" + names + ") exist but no DMZ zone is defined. "
              + "NERC CIP requires an Electronic Security Perimeter (ESP).",
          "project",
          "Add a DMZ zone to establish an Electronic Security Perimeter boundary"));
    }
  };

  /** Asset types that should never sit in an SL-T 1 zone. */
  static final Set<AssetType> CRITICAL_ASSET_TYPES =
      EnumSet.of(AssetType.PLC, AssetType.RTU, AssetType.IED, AssetType.DCS, AssetType.SCADA);

  /** Asset types expected inside safety zones. */
  static final Set<AssetType> SAFETY_ASSET_TYPES = EnumSet.of(
      AssetType.PLC, AssetType.IED, AssetType.RTU, AssetType.DCS, AssetType.FIREWALL, AssetType.SWITCH);

  private final ValidationSeverity severity;

  ValidationCheck(ValidationSeverity severity) {
    this.severity = severity;
  }

  /**
   * Returns the stable finding code.
   *
   * @return code, identical to the constant name
   */
  public String code() {
    return name();
  }

  /**
   * Returns the fixed severity of findings emitted by this check.
   *
   * @return severity
   */
  public ValidationSeverity severity() {
    return severity;
  }

  /**
   * Appends this check's findings for {@code project} to {@code out}.
   *
   * @param project project under validation
   * @param out accumulator preserving emission order
   */
  abstract void run(Project project, List<ValidationResult> out);

  ValidationResult result(String message, String location, String recommendation) {
    return new ValidationResult(severity, code(), message, location, recommendation);
  }

  /**
   * Returns cell and safety zones with SL-T of at least 3, in project order.
   *
   * @param project project
   * @return critical zones
   */
  static List<Zone> criticalZones(Project project) {
    List<Zone> critical = new ArrayList<>();
    for (Zone zone : project.zones()) {
      if ((zone.type() == ZoneType.CELL || zone.type() == ZoneType.SAFETY) && zone.securityLevelTarget() >= 3) {
        critical.add(zone);
      }
    }
    return critical;
  }

  private static String enterpriseSideOfCellLink(Project project, Conduit conduit) {
    ZoneType from = project.requireZone(conduit.fromZone()).type();
    ZoneType to = project.requireZone(conduit.toZone()).type();
    if (from == ZoneType.ENTERPRISE && to == ZoneType.CELL) {
      return conduit.fromZone();
    }
    if (from == ZoneType.CELL && to == ZoneType.ENTERPRISE) {
      return conduit.toZone();
    }
    return null;
  }

  private static String firstInProjectOrder(Project project, List<String> zoneIds) {
    for (Zone zone : project.zones()) {
      if (zoneIds.contains(zone.id())) {
        return zone.id();
      }
    }
    return zoneIds.get(0);
  }
}
