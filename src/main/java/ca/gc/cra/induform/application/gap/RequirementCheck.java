package ca.gc.cra.induform.application.gap;

import ca.gc.cra.induform.domain.model.Asset;
import ca.gc.cra.induform.domain.model.AssetType;
import ca.gc.cra.induform.domain.model.Conduit;
import ca.gc.cra.induform.domain.model.Project;
import ca.gc.cra.induform.domain.model.Zone;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Evidence rules for the system requirements covered by gap analysis, one constant per SR.
 * <p><strong>Why:</strong> Control presence is inferred from zone assets, conduit inspection and flows, and the
 * zone's network segment; each SR weighs that evidence differently.</p>
 * <p><strong>Role:</strong> Rule table executed by {@link GapAnalyzer}; requirement names and minimum levels come
 * from the security requirement catalog.</p>
 * <p><strong>Thread-safety:</strong> Constants are stateless.</p>
 *
 * @since 0.1.0
 */
enum RequirementCheck {
  SR_1_1("SR 1.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      boolean auth = hasAny(zone, AUTH_TYPES);
      boolean devices = hasAny(zone, DEVICE_TYPES);
      if (auth && devices) {
        return Finding.met("Zone has authentication infrastructure co-located with controllable devices.");
      }
      if (devices) {
        return Finding.partial("Zone has controllable devices but no dedicated authentication infrastructure.",
            "Add a jump host or engineering workstation for authenticated device access.");
      }
      if (zone.assets().isEmpty()) {
        return Finding.unmet("Zone has no assets; cannot verify auth controls.",
            "Register assets and deploy auth infrastructure.");
      }
      return Finding.partial("Zone has assets but auth coverage cannot be verified.",
          "Ensure all human user access paths include identification and authentication.");
    }
  },

  SR_1_2("SR 1.2") {
    @Override
    Finding assess(Zone zone, Project project) {
      boolean devices = hasAny(zone, DEVICE_TYPES);
      if (devices && hasAny(zone, NETWORK_SECURITY_TYPES)) {
        return Finding.met("Zone has devices and network infrastructure for device authentication.");
      }
      if (devices) {
        return Finding.partial("Zone has devices but no network auth infrastructure.",
            "Deploy switches or firewalls with 802.1X or certificate-based device auth.");
      }
      return new Finding(zone.assets().isEmpty() ? ControlStatus.UNMET : ControlStatus.PARTIAL,
          "No controllable devices; device auth not assessable.",
          "Register devices and deploy auth infrastructure.");
    }
  },

  SR_1_3("SR 1.3") {
    @Override
    Finding assess(Zone zone, Project project) {
      if (hasAny(zone, AUTH_TYPES)) {
        return Finding.met("Zone has management infrastructure for accounts.");
      }
      if (!zone.assets().isEmpty()) {
        return Finding.partial("Zone has assets but no management server.",
            "Deploy a management server or integrate with centralized directory service.");
      }
      return Finding.unmet("No assets in zone; account management not assessable.",
          "Register assets and implement account management.");
    }
  },

  SR_2_1("SR 2.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      boolean auth = hasAny(zone, AUTH_TYPES);
      boolean firewall = hasFirewall(zone);
      if (auth && firewall) {
        return Finding.met("Zone has firewall and auth infrastructure for authorization enforcement.");
      }
      if (auth || firewall) {
        String present = firewall ? "firewall" : "auth infrastructure";
        String missing = firewall ? "auth infrastructure" : "firewall";
        return Finding.partial("Partial authorization: " + present + " present but " + missing + " missing.",
            "Deploy both firewall and auth infrastructure for complete authorization.");
      }
      return Finding.unmet("No authorization enforcement infrastructure.",
          "Deploy firewall and access control systems.");
    }
  },

  SR_2_2("SR 2.2") {
    @Override
    Finding assess(Zone zone, Project project) {
      if (hasFirewall(zone)) {
        return Finding.partial(
            "Zone has firewall for wireless restriction but dedicated wireless control not confirmed.",
            "Deploy WPA3/RADIUS for wireless auth; consider wireless IDS.");
      }
      return Finding.unmet("No wireless access control infrastructure detected.",
          "Implement WPA2/WPA3 with RADIUS auth; add wireless IDS for SL-3+.");
    }
  },

  SR_3_1("SR 3.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      List<Conduit> conduits = project.conduitsForZone(zone.id());
      if (conduits.isEmpty()) {
        if (!zone.assets().isEmpty()) {
          return Finding.partial("Zone has assets but no conduits defined.",
              "Define conduits and enable integrity protection.");
        }
        return Finding.unmet("No conduits or assets; integrity not assessable.",
            "Define assets and conduits, enable integrity.");
      }
      int inspected = inspected(conduits);
      int withFlows = withFlows(conduits);
      int total = conduits.size();
      if (inspected == total && withFlows == total) {
        return Finding.met("All conduits have inspection and defined flows.");
      }
      if (inspected > 0 || withFlows > 0) {
        return Finding.partial(
            inspected + "/" + total + " conduits inspected; " + withFlows + "/" + total + " have defined flows.",
            "Enable inspection and flows on all conduits.");
      }
      return Finding.unmet("No conduits have inspection or defined flows.",
          "Enable deep packet inspection and define explicit protocol flows on all conduits.");
    }
  },

  SR_3_2("SR 3.2") {
    @Override
    Finding assess(Zone zone, Project project) {
      boolean servers = hasAny(zone, ENDPOINT_TYPES);
      boolean firewall = hasFirewall(zone);
      if (servers && firewall) {
        return Finding.met("Zone has servers and firewall for malware protection.");
      }
      if (firewall) {
        return Finding.partial("Zone has firewall but no server for endpoint protection.",
            "Deploy endpoint protection on zone devices.");
      }
      if (servers) {
        return Finding.partial("Zone has servers but no firewall at boundary.",
            "Deploy a firewall for network-level protection.");
      }
      return Finding.unmet("No malicious code protection infrastructure.",
          "Deploy firewall and endpoint protection.");
    }
  },

  SR_4_1("SR 4.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      List<Conduit> conduits = project.conduitsForZone(zone.id());
      boolean firewall = hasFirewall(zone);
      if (conduits.isEmpty() && zone.assets().isEmpty()) {
        return Finding.unmet("No assets or conduits; confidentiality not assessable.",
            "Register assets, define conduits, add encryption.");
      }
      int inspected = inspected(conduits);
      if (firewall && !conduits.isEmpty() && inspected == conduits.size()) {
        return Finding.met("Firewall and conduit inspection enforce confidentiality.");
      }
      if (firewall || inspected > 0) {
        return Finding.partial("Partial confidentiality controls present.",
            "Ensure all conduits have encryption/inspection; deploy firewall if missing.");
      }
      return Finding.unmet("No confidentiality controls detected.",
          "Deploy firewall, enable conduit inspection, implement TLS/encryption.");
    }
  },

  SR_5_1("SR 5.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      String segment = zone.networkSegment();
      boolean firewall = hasFirewall(zone);
      if (segment != null && firewall) {
        return Finding.met("Zone has segment '" + segment + "' and firewall.");
      }
      if (segment != null) {
        return Finding.partial("Zone has segment '" + segment + "' but no firewall.",
            "Deploy firewall to enforce segmentation.");
      }
      if (firewall) {
        return Finding.partial("Zone has firewall but no VLAN/segment defined.",
            "Define a network segment (VLAN) for this zone.");
      }
      return Finding.unmet("No network segmentation (no VLAN, no firewall).",
          "Assign a VLAN and deploy a boundary firewall.");
    }
  },

  SR_5_2("SR 5.2") {
    @Override
    Finding assess(Zone zone, Project project) {
      List<Conduit> conduits = project.conduitsForZone(zone.id());
      boolean firewall = hasFirewall(zone);
      if (conduits.isEmpty()) {
        return new Finding(firewall ? ControlStatus.PARTIAL : ControlStatus.UNMET,
            "No conduits; boundary protection not fully assessed.",
            "Define conduits and protect with firewalls.");
      }
      int withFlows = withFlows(conduits);
      int total = conduits.size();
      if (firewall && withFlows == total) {
        return Finding.met("Firewall and all conduits have defined flows.");
      }
      if (firewall || withFlows > 0) {
        List<String> missing = new ArrayList<>();
        if (!firewall) {
          missing.add("firewall");
        }
        if (withFlows < total) {
          missing.add("flows on " + (total - withFlows) + " conduit(s)");
        }
        return Finding.partial("Partial; missing: " + String.join(", ", missing) + ".",
            "Deploy firewall and define flows on all conduits.");
      }
      return Finding.unmet("No firewall and no conduit flows defined.",
          "Deploy a stateful firewall and define explicit protocol flows.");
    }
  },

  SR_5_3("SR 5.3") {
    @Override
    Finding assess(Zone zone, Project project) {
      List<Conduit> conduits = project.conduitsForZone(zone.id());
      boolean firewall = hasFirewall(zone);
      int withFlows = withFlows(conduits);
      if (firewall && !conduits.isEmpty() && withFlows == conduits.size()) {
        return Finding.met("Firewall and flows restrict communications.");
      }
      if (firewall || withFlows > 0) {
        return Finding.partial("Partial restriction on communications.",
            "Block email/web at boundaries; define explicit protocol allowlists.");
      }
      return Finding.unmet("No communication restrictions configured.",
          "Deploy firewall with email/web filtering; block person-to-person protocols.");
    }
  },

  SR_6_1("SR 6.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      if (hasAny(zone, LOGGING_TYPES)) {
        return Finding.met("Zone has server/historian for storing and providing audit logs.");
      }
      if (!zone.assets().isEmpty()) {
        return Finding.partial("Assets present but no server/historian for logs.",
            "Deploy log server or forward to centralized SIEM.");
      }
      return Finding.unmet("No assets; audit logging not assessable.",
          "Register assets and deploy logging infrastructure.");
    }
  },

  SR_6_2("SR 6.2") {
    @Override
    Finding assess(Zone zone, Project project) {
      boolean monitoring = hasAny(zone, LOGGING_TYPES);
      boolean firewall = hasFirewall(zone);
      if (monitoring && firewall) {
        return Finding.met("Monitoring infrastructure and firewall present.");
      }
      if (monitoring || firewall) {
        return Finding.partial("Partial monitoring infrastructure present.",
            "Deploy monitoring server/SIEM and firewall with alerting.");
      }
      return Finding.unmet("No continuous monitoring infrastructure.",
          "Deploy SIEM or monitoring with real-time alerting.");
    }
  },

  SR_7_1("SR 7.1") {
    @Override
    Finding assess(Zone zone, Project project) {
      boolean firewall = hasFirewall(zone);
      if (firewall && inspected(project.conduitsForZone(zone.id())) > 0) {
        return Finding.met("Firewall and conduit inspection for DoS protection.");
      }
      if (firewall || hasAny(zone, NETWORK_SECURITY_TYPES)) {
        return Finding.partial("Network infra present but inspection not on all conduits.",
            "Enable rate limiting and DPI on boundary conduits.");
      }
      return Finding.unmet("No DoS protection infrastructure detected.",
          "Deploy firewall with rate limiting; enable inspection.");
    }
  },

  SR_7_2("SR 7.2") {
    @Override
    Finding assess(Zone zone, Project project) {
      if (hasAny(zone, RESOURCE_MANAGEMENT_TYPES)) {
        return Finding.met("Management infrastructure for resource monitoring.");
      }
      if (!zone.assets().isEmpty()) {
        return Finding.partial("Assets present but no management server.",
            "Deploy resource monitoring tools (SNMP, agent-based).");
      }
      return Finding.unmet("No assets; resource management not assessable.",
          "Register assets and implement resource monitoring.");
    }
  };

  static final Set<AssetType> AUTH_TYPES =
      EnumSet.of(AssetType.JUMP_HOST, AssetType.SERVER, AssetType.ENGINEERING_WORKSTATION);
  static final Set<AssetType> NETWORK_SECURITY_TYPES =
      EnumSet.of(AssetType.FIREWALL, AssetType.SWITCH, AssetType.ROUTER);
  static final Set<AssetType> DEVICE_TYPES = EnumSet.of(
      AssetType.PLC, AssetType.RTU, AssetType.IED, AssetType.DCS, AssetType.HMI, AssetType.SCADA);
  private static final Set<AssetType> ENDPOINT_TYPES = EnumSet.of(
      AssetType.SERVER, AssetType.ENGINEERING_WORKSTATION, AssetType.HISTORIAN, AssetType.SCADA);
  private static final Set<AssetType> LOGGING_TYPES =
      EnumSet.of(AssetType.SERVER, AssetType.HISTORIAN, AssetType.SCADA);
  private static final Set<AssetType> RESOURCE_MANAGEMENT_TYPES =
      EnumSet.of(AssetType.SERVER, AssetType.SCADA, AssetType.DCS);

  private final String requirementId;

  RequirementCheck(String requirementId) {
    this.requirementId = requirementId;
  }

  /** Catalog id of the requirement, such as {@code SR 5.1}. */
  String requirementId() {
    return requirementId;
  }

  /**
   * Weighs the zone's evidence for this requirement.
   *
   * @param zone zone being assessed; its SL-T is at or above the requirement's minimum level
   * @param project owning project, for conduit lookups
   * @return status with details and, unless met, a remediation
   */
  abstract Finding assess(Zone zone, Project project);

  private static boolean hasAny(Zone zone, Set<AssetType> types) {
    for (Asset asset : zone.assets()) {
      if (types.contains(asset.type())) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasFirewall(Zone zone) {
    return hasAny(zone, EnumSet.of(AssetType.FIREWALL));
  }

  private static int inspected(List<Conduit> conduits) {
    int count = 0;
    for (Conduit conduit : conduits) {
      if (conduit.requiresInspection()) {
        count++;
      }
    }
    return count;
  }

  private static int withFlows(List<Conduit> conduits) {
    int count = 0;
    for (Conduit conduit : conduits) {
      if (!conduit.flows().isEmpty()) {
        count++;
      }
    }
    return count;
  }

  record Finding(ControlStatus status, String details, String remediation) {
    static Finding met(String details) {
      return new Finding(ControlStatus.MET, details, null);
    }

    static Finding partial(String details, String remediation) {
      return new Finding(ControlStatus.PARTIAL, details, remediation);
    }

    static Finding unmet(String details, String remediation) {
      return new Finding(ControlStatus.UNMET, details, remediation);
    }
  }
}
