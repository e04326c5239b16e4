package ca.gc.cra.induform.application.firewall;

import java.util.List;
import java.util.Objects;

/**
 * Vendor-neutral firewall rule between two zones.
 *
 * @param id rule id such as {@code rule-0001}
 * @param name descriptive name
 * @param sourceZone source zone id
 * @param destinationZone destination zone id
 * @param sourceAddresses source addresses, {@code any} when the zone has no addressed assets
 * @param destinationAddresses destination addresses, {@code any} when the zone has no addressed assets
 * @param protocol protocol name or {@code any}
 * @param port destination port; {@code null} for any port
 * @param action rule action
 * @param log whether matches are logged
 * @param comment human-readable comment
 * @param order evaluation order, ascending
 * @since 0.1.0
 */
public record FirewallRule(
    String id,
    String name,
    String sourceZone,
    String destinationZone,
    List<String> sourceAddresses,
    List<String> destinationAddresses,
    String protocol,
    Integer port,
    FirewallAction action,
    boolean log,
    String comment,
    int order) {

  /** Wildcard used for unspecified addresses and protocols. */
  public static final String ANY = "any";

  public FirewallRule {
    id = Objects.requireNonNull(id, "id");
    sourceZone = Objects.requireNonNull(sourceZone, "sourceZone");
    destinationZone = Objects.requireNonNull(destinationZone, "destinationZone");
    sourceAddresses = List.copyOf(Objects.requireNonNullElse(sourceAddresses, List.of()));
    destinationAddresses = List.copyOf(Objects.requireNonNullElse(destinationAddresses, List.of()));
    protocol = Objects.requireNonNull(protocol, "protocol");
    action = Objects.requireNonNull(action, "action");
  }
}
