package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.validation.Numbers;
import ca.gc.cra.induform.validation.Strings;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Controlled communication channel between two zones.
 * <p><strong>Why:</strong> Conduits are the unit of boundary protection; their flows, explicit security level and
 * inspection flag are evaluated by the validator, policy rules, resolver and firewall generator.</p>
 * <p><strong>Thread-safety:</strong> Immutable; flows are defensively copied.</p>
 *
 * @param id conduit identifier unique within the project
 * @param name optional display name
 * @param fromZone source zone id
 * @param toZone destination zone id; must differ from {@code fromZone}
 * @param flows ordered protocol flows; empty means nothing is explicitly allowed
 * @param securityLevelRequired optional explicit security level override between 1 and 4
 * @param requiresInspection whether deep packet inspection is deployed on this conduit
 * @param description optional description
 * @since 0.1.0
 */
public record Conduit(
    String id,
    String name,
    String fromZone,
    String toZone,
    List<ProtocolFlow> flows,
    Integer securityLevelRequired,
    boolean requiresInspection,
    String description) {

  /**
   * Validates identifiers, zone distinctness and the optional security level.
   *
   * @throws IllegalArgumentException if {@code fromZone} equals {@code toZone} or a field is invalid
   */
  public Conduit {
    id = Strings.requireIdentifier("conduit.id", id);
    name = Strings.optional("conduit.name", name);
    fromZone = Strings.requireIdentifier("conduit.from_zone", fromZone);
    toZone = Strings.requireIdentifier("conduit.to_zone", toZone);
    if (fromZone.equals(toZone)) {
      throw new IllegalArgumentException(
          "Conduit '" + id + "' must connect two different zones (both were '" + fromZone + "')");
    }
    flows = List.copyOf(Objects.requireNonNullElse(flows, List.of()));
    Numbers.requireOptionalRange("conduit.security_level_required", securityLevelRequired, 1, 4);
    description = Strings.optional("conduit.description", description);
  }

  /**
   * Creates a conduit with no explicit security level and inspection disabled.
   *
   * @param id conduit identifier
   * @param fromZone source zone id
   * @param toZone destination zone id
   * @param flows protocol flows
   * @return new conduit
   */
  public static Conduit of(String id, String fromZone, String toZone, List<ProtocolFlow> flows) {
    return new Conduit(id, null, fromZone, toZone, flows, null, false, null);
  }

  /**
   * Indicates whether the conduit touches the given zone on either side.
   *
   * @param zoneId zone identifier
   * @return {@code true} when {@code zoneId} is the source or destination
   */
  public boolean connects(String zoneId) {
    return fromZone.equals(zoneId) || toZone.equals(zoneId);
  }

  /**
   * Returns a copy with an explicit security level override.
   *
   * @param level security level between 1 and 4, or {@code null} to clear
   * @return updated conduit
   */
  public Conduit withSecurityLevelRequired(Integer level) {
    return new Conduit(id, name, fromZone, toZone, flows, level, requiresInspection, description);
  }

  /**
   * Returns a copy with the inspection flag set.
   *
   * @param inspection whether inspection is deployed
   * @return updated conduit
   */
  public Conduit withRequiresInspection(boolean inspection) {
    return new Conduit(id, name, fromZone, toZone, flows, securityLevelRequired, inspection, description);
  }
}
