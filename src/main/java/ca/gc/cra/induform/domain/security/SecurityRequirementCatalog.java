package ca.gc.cra.induform.domain.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of the IEC 62443-3-3 system requirements used for control resolution.
 *
 * <p>Iteration order follows requirement numbering (SR 1.1 through SR 7.2).</p>
 *
 * @since 0.1.0
 */
public final class SecurityRequirementCatalog {
  private static final Map<String, SecurityRequirement> REQUIREMENTS = build();

  private SecurityRequirementCatalog() {}

  /**
   * Returns every requirement in catalog order.
   *
   * @return immutable list of requirements
   */
  public static List<SecurityRequirement> all() {
    return List.copyOf(REQUIREMENTS.values());
  }

  /**
   * Returns the requirements whose minimum level is at or below {@code level}.
   *
   * @param level security level target (1-4)
   * @return applicable requirements in catalog order
   */
  public static List<SecurityRequirement> requirementsForLevel(int level) {
    List<SecurityRequirement> result = new ArrayList<>();
    for (SecurityRequirement requirement : REQUIREMENTS.values()) {
      if (requirement.appliesAt(level)) {
        result.add(requirement);
      }
    }
    return List.copyOf(result);
  }

  /**
   * Looks up a requirement by id.
   *
   * @param id requirement id such as {@code SR 1.1}
   * @return requirement when present
   */
  public static Optional<SecurityRequirement> requirement(String id) {
    return Optional.ofNullable(id == null ? null : REQUIREMENTS.get(id));
  }

  /**
   * Returns the requirements under one foundational requirement.
   *
   * @param category foundational requirement
   * @return requirements in catalog order
   */
  public static List<SecurityRequirement> requirementsFor(FoundationalRequirement category) {
    List<SecurityRequirement> result = new ArrayList<>();
    for (SecurityRequirement requirement : REQUIREMENTS.values()) {
      if (requirement.foundationalRequirement() == category) {
        result.add(requirement);
      }
    }
    return List.copyOf(result);
  }

  private static Map<String, SecurityRequirement> build() {
    Map<String, SecurityRequirement> map = new LinkedHashMap<>();
    add(map, "SR 1.1", "Human user identification and authentication",
        "The control system shall provide the capability to identify and authenticate all human users.",
        FoundationalRequirement.FR1, 1,
        "Unique identification for all users",
        "Strong authentication (multi-factor for critical functions)",
        "Multi-factor authentication required",
        "Hardware-based authentication tokens");
    add(map, "SR 1.2", "Software process and device identification and authentication",
        "The control system shall provide the capability to identify and authenticate all software "
            + "processes and devices.",
        FoundationalRequirement.FR1, 1,
        "Device identification",
        "Device authentication with credentials",
        "Certificate-based device authentication",
        "Hardware security module (HSM) based authentication");
    add(map, "SR 1.3", "Account management",
        "The control system shall provide the capability to manage user accounts.",
        FoundationalRequirement.FR1, 1,
        "Basic account management",
        "Role-based access with account lifecycle management",
        "Automated account provisioning/deprovisioning",
        "Privileged access management (PAM) integration");
    add(map, "SR 2.1", "Authorization enforcement",
        "The control system shall provide the capability to enforce authorizations assigned to all "
            + "human users.",
        FoundationalRequirement.FR2, 1,
        "Basic permission enforcement",
        "Role-based access control (RBAC)",
        "Attribute-based access control (ABAC)",
        "Real-time authorization with context awareness");
    add(map, "SR 2.2", "Wireless use control",
        "The control system shall provide the capability to identify and authenticate all users "
            + "accessing via wireless.",
        FoundationalRequirement.FR2, 2,
        null,
        "WPA2/WPA3 with RADIUS authentication",
        "Wireless IDS/IPS, rogue AP detection",
        "Isolated wireless networks with continuous monitoring");
    add(map, "SR 3.1", "Communication integrity",
        "The control system shall provide the capability to protect the integrity of transmitted "
            + "information.",
        FoundationalRequirement.FR3, 1,
        "Basic integrity checks (checksums)",
        "Cryptographic integrity (HMAC)",
        "Full encryption with integrity (TLS 1.3)",
        "Quantum-resistant cryptographic protocols");
    add(map, "SR 3.2", "Malicious code protection",
        "The control system shall provide the capability to protect against malicious code.",
        FoundationalRequirement.FR3, 1,
        "Antivirus on applicable systems",
        "Application whitelisting",
        "Behavioral analysis and EDR",
        "Air-gapped update verification, memory protection");
    add(map, "SR 4.1", "Information confidentiality",
        "The control system shall provide the capability to protect the confidentiality of information.",
        FoundationalRequirement.FR4, 1,
        "Access controls on sensitive data",
        "Encryption at rest for sensitive data",
        "Full disk encryption, encrypted backups",
        "Hardware-encrypted storage, key management HSM");
    add(map, "SR 5.1", "Network segmentation",
        "The control system shall provide the capability to logically segment networks.",
        FoundationalRequirement.FR5, 1,
        "VLAN segmentation",
        "Firewall-enforced segmentation",
        "Microsegmentation with zone-based policies",
        "Physical network separation for critical zones");
    add(map, "SR 5.2", "Zone boundary protection",
        "The control system shall provide the capability to monitor and control communications at "
            + "zone boundaries.",
        FoundationalRequirement.FR5, 1,
        "Stateful firewalls at boundaries",
        "Application-layer firewalls",
        "Deep packet inspection for industrial protocols",
        "Protocol-aware proxies with full traffic analysis");
    add(map, "SR 5.3", "General purpose person-to-person communication restrictions",
        "The control system shall provide the capability to restrict person-to-person communication.",
        FoundationalRequirement.FR5, 2,
        null,
        "Email/web filtering at boundaries",
        "Blocked or proxied communications",
        "No direct person-to-person communication allowed");
    add(map, "SR 6.1", "Audit log accessibility",
        "The control system shall provide the capability to access audit logs for authorized personnel.",
        FoundationalRequirement.FR6, 1,
        "Local audit log storage",
        "Centralized log management (SIEM)",
        "Real-time alerting and correlation",
        "Immutable audit logs with forensic capabilities");
    add(map, "SR 6.2", "Continuous monitoring",
        "The control system shall provide the capability for continuous monitoring of "
            + "security-relevant events.",
        FoundationalRequirement.FR6, 2,
        null,
        "Periodic security monitoring",
        "24/7 security monitoring with SOC",
        "Automated response with human oversight");
    add(map, "SR 7.1", "Denial of service protection",
        "The control system shall provide the capability to protect against denial of service attacks.",
        FoundationalRequirement.FR7, 1,
        "Basic rate limiting",
        "Network-level DoS protection",
        "Application-aware DoS protection",
        "Redundant systems with automatic failover");
    add(map, "SR 7.2", "Resource management",
        "The control system shall provide the capability to manage resources to support essential "
            + "functions.",
        FoundationalRequirement.FR7, 1,
        "Resource monitoring",
        "Resource quotas and limits",
        "Automatic resource scaling",
        "Isolated resource pools for critical functions");
    return Collections.unmodifiableMap(map);
  }

  private static void add(
      Map<String, SecurityRequirement> map,
      String id,
      String name,
      String description,
      FoundationalRequirement category,
      int minimumLevel,
      String sl1,
      String sl2,
      String sl3,
      String sl4) {
    Map<Integer, String> details = new LinkedHashMap<>();
    String[] texts = {sl1, sl2, sl3, sl4};
    for (int i = 0; i < texts.length; i++) {
      if (texts[i] != null) {
        details.put(i + 1, texts[i]);
      }
    }
    map.put(id, new SecurityRequirement(id, name, description, category, minimumLevel, details));
  }
}
