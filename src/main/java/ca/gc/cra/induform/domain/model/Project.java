package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Root aggregate of an IEC 62443 network security model.
 * <p><strong>Why:</strong> Every engine component consumes a {@code Project}; rejecting dangling references at
 * construction lets them resolve zones without null checks.</p>
 * <p><strong>Role:</strong> Domain aggregate root produced by the project reader and consumed read-only by the
 * validator, policy evaluator, risk engine, resolver and firewall generator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve declaration order of zones and conduits for deterministic output.</li>
 *   <li>Reject duplicate zone and conduit ids and unknown zone references.</li>
 *   <li>Provide id lookups and per-zone conduit queries.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Lookups are O(1) via prebuilt indexes; {@link #conduitsForZone(String)} is O(conduits).</p>
 *
 * @since 0.1.0
 */
public final class Project {
  /** Schema version written by this release. */
  public static final String SCHEMA_VERSION = "1.0";

  private final String version;
  private final ProjectMetadata metadata;
  private final List<Zone> zones;
  private final List<Conduit> conduits;
  private final Map<String, Zone> zonesById;
  private final Map<String, Conduit> conduitsById;

  /**
   * Creates a project and validates its internal references.
   *
   * @param version schema version; {@code null} defaults to {@value #SCHEMA_VERSION}
   * @param metadata project metadata; must not be {@code null}
   * @param zones zones in declaration order; {@code null} treated as empty
   * @param conduits conduits in declaration order; {@code null} treated as empty
   * @throws NullPointerException if {@code metadata} is {@code null}
   * @throws IllegalArgumentException if ids repeat or a parent/conduit zone reference is unknown
   */
  public Project(String version, ProjectMetadata metadata, List<Zone> zones, List<Conduit> conduits) {
    this.version = version == null ? SCHEMA_VERSION : Strings.requireNonBlank("version", version);
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.zones = List.copyOf(Objects.requireNonNullElse(zones, List.of()));
    this.conduits = List.copyOf(Objects.requireNonNullElse(conduits, List.of()));

    Map<String, Zone> zoneIndex = new LinkedHashMap<>();
    for (Zone zone : this.zones) {
      if (zoneIndex.putIfAbsent(zone.id(), zone) != null) {
        throw new IllegalArgumentException("Duplicate zone id '" + zone.id() + "'");
      }
    }
    for (Zone zone : this.zones) {
      if (zone.parentZone() != null && !zoneIndex.containsKey(zone.parentZone())) {
        throw new IllegalArgumentException(
            "Zone '" + zone.id() + "' references unknown parent_zone '" + zone.parentZone() + "'");
      }
    }

    Map<String, Conduit> conduitIndex = new LinkedHashMap<>();
    for (Conduit conduit : this.conduits) {
      if (conduitIndex.putIfAbsent(conduit.id(), conduit) != null) {
        throw new IllegalArgumentException("Duplicate conduit id '" + conduit.id() + "'");
      }
      if (!zoneIndex.containsKey(conduit.fromZone())) {
        throw new IllegalArgumentException(
            "Conduit '" + conduit.id() + "' references unknown from_zone '" + conduit.fromZone() + "'");
      }
      if (!zoneIndex.containsKey(conduit.toZone())) {
        throw new IllegalArgumentException(
            "Conduit '" + conduit.id() + "' references unknown to_zone '" + conduit.toZone() + "'");
      }
    }
    this.zonesById = Map.copyOf(zoneIndex);
    this.conduitsById = Map.copyOf(conduitIndex);
  }

  /**
   * Creates a project with the current schema version.
   *
   * @param metadata project metadata
   * @param zones zones in declaration order
   * @param conduits conduits in declaration order
   */
  public Project(ProjectMetadata metadata, List<Zone> zones, List<Conduit> conduits) {
    this(SCHEMA_VERSION, metadata, zones, conduits);
  }

  public String version() {
    return version;
  }

  public ProjectMetadata metadata() {
    return metadata;
  }

  public List<Zone> zones() {
    return zones;
  }

  public List<Conduit> conduits() {
    return conduits;
  }

  /**
   * Looks up a zone by id.
   *
   * @param zoneId zone identifier
   * @return zone when present
   */
  public Optional<Zone> zone(String zoneId) {
    return Optional.ofNullable(zoneId == null ? null : zonesById.get(zoneId));
  }

  /**
   * Looks up a conduit by id.
   *
   * @param conduitId conduit identifier
   * @return conduit when present
   */
  public Optional<Conduit> conduit(String conduitId) {
    return Optional.ofNullable(conduitId == null ? null : conduitsById.get(conduitId));
  }

  /**
   * Returns a zone that is known to exist, such as the endpoint of a validated conduit.
   *
   * @param zoneId zone identifier
   * @return zone
   * @throws IllegalArgumentException if the zone does not exist
   */
  public Zone requireZone(String zoneId) {
    Zone zone = zoneId == null ? null : zonesById.get(zoneId);
    if (zone == null) {
      throw new IllegalArgumentException("Unknown zone '" + zoneId + "'");
    }
    return zone;
  }

  /**
   * Returns the conduits attached to a zone on either side, in declaration order.
   *
   * @param zoneId zone identifier
   * @return immutable list of attached conduits
   */
  public List<Conduit> conduitsForZone(String zoneId) {
    List<Conduit> attached = new ArrayList<>();
    for (Conduit conduit : conduits) {
      if (conduit.connects(zoneId)) {
        attached.add(conduit);
      }
    }
    return List.copyOf(attached);
  }

  /**
   * Indicates whether any zone has the given type.
   *
   * @param type zone type
   * @return {@code true} if at least one zone has {@code type}
   */
  public boolean hasZoneOfType(ZoneType type) {
    for (Zone zone : zones) {
      if (zone.type() == type) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Project that)) {
      return false;
    }
    return version.equals(that.version)
        && metadata.equals(that.metadata)
        && zones.equals(that.zones)
        && conduits.equals(that.conduits);
  }

  @Override
  public int hashCode() {
    return Objects.hash(version, metadata, zones, conduits);
  }

  @Override
  public String toString() {
    return "Project[name=" + metadata.name() + ", zones=" + zones.size() + ", conduits=" + conduits.size() + "]";
  }
}
