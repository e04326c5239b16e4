package ca.gc.cra.induform.domain.protocol;

import ca.gc.cra.induform.domain.model.ProjectMetadata;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Built-in allowlist of protocols considered appropriate for OT networks.
 *
 * <p>Comparisons are case-insensitive; project metadata may extend the list.</p>
 *
 * @since 0.1.0
 */
public final class IndustrialProtocols {
  /** Lowercase protocol names accepted without a project-level override. */
  public static final Set<String> BUILT_IN = Set.of(
      "modbus_tcp", "modbus_rtu", "opcua", "opc_da", "dnp3", "iec61850", "iec104",
      "bacnet", "profinet", "ethercat", "ethernet_ip", "cip", "s7comm", "mqtt", "amqp",
      "https", "http", "ssh", "sftp", "ntp", "snmp", "syslog", "ldap", "ldaps",
      "radius", "kerberos", "rdp", "vnc", "icmp");

  private IndustrialProtocols() {}

  /**
   * Builds the effective allowlist for a project: built-ins plus the project's approved protocols.
   *
   * @param metadata project metadata supplying additional protocols
   * @return immutable lowercase allowlist
   */
  public static Set<String> effectiveAllowlist(ProjectMetadata metadata) {
    Set<String> allowlist = new HashSet<>(BUILT_IN);
    for (String protocol : metadata.allowedProtocols()) {
      allowlist.add(protocol.toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(allowlist);
  }

  /**
   * Tests a protocol name against an allowlist produced by {@link #effectiveAllowlist(ProjectMetadata)}.
   *
   * @param allowlist lowercase allowlist
   * @param protocol protocol name in any case
   * @return {@code true} when the protocol is allowed
   */
  public static boolean isAllowed(Set<String> allowlist, String protocol) {
    return allowlist.contains(protocol.toLowerCase(Locale.ROOT));
  }
}
