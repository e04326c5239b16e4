package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.validation.Numbers;
import ca.gc.cra.induform.validation.Strings;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Security zone grouping assets that share a target security level.
 * <p><strong>Why:</strong> Zones are the primary unit evaluated by every engine component.</p>
 * <p><strong>Thread-safety:</strong> Immutable; assets are defensively copied.</p>
 *
 * @param id zone identifier unique within the project
 * @param name human-readable name
 * @param type zone classification
 * @param securityLevelTarget target security level (SL-T) between 1 and 4
 * @param securityLevelCapability optional achieved security level (SL-C) between SL-T and 4
 * @param description optional description
 * @param assets assets in this zone; identifiers unique within the zone
 * @param parentZone optional parent zone id for hierarchical nesting
 * @param networkSegment optional network segment or VLAN identifier
 * @param xPosition optional layout x coordinate for visual editors
 * @param yPosition optional layout y coordinate for visual editors
 * @since 0.1.0
 */
public record Zone(
    String id,
    String name,
    ZoneType type,
    int securityLevelTarget,
    Integer securityLevelCapability,
    String description,
    List<Asset> assets,
    String parentZone,
    String networkSegment,
    Double xPosition,
    Double yPosition) {

  /**
   * Validates identifiers, security level ranges and asset uniqueness.
   *
   * @throws IllegalArgumentException if SL-C is below SL-T, an asset id repeats, or a field is invalid
   */
  public Zone {
    id = Strings.requireIdentifier("zone.id", id);
    name = Strings.requireNonBlank("zone.name", name);
    type = Objects.requireNonNull(type, "zone.type");
    Numbers.requireRange("zone.security_level_target", securityLevelTarget, 1, 4);
    Numbers.requireOptionalRange("zone.security_level_capability", securityLevelCapability, 1, 4);
    if (securityLevelCapability != null && securityLevelCapability < securityLevelTarget) {
      throw new IllegalArgumentException("Zone '" + id + "' security_level_capability ("
          + securityLevelCapability + ") must be >= security_level_target (" + securityLevelTarget + ")");
    }
    description = Strings.optional("zone.description", description);
    assets = List.copyOf(Objects.requireNonNullElse(assets, List.of()));
    Set<String> assetIds = new HashSet<>();
    for (Asset asset : assets) {
      if (!assetIds.add(asset.id())) {
        throw new IllegalArgumentException("Zone '" + id + "' contains duplicate asset id '" + asset.id() + "'");
      }
    }
    parentZone = parentZone == null ? null : Strings.requireIdentifier("zone.parent_zone", parentZone);
    networkSegment = Strings.optional("zone.network_segment", networkSegment);
  }

  /**
   * Creates a zone without assets or optional attributes.
   *
   * @param id zone identifier
   * @param name zone name
   * @param type zone classification
   * @param securityLevelTarget SL-T between 1 and 4
   * @return new zone
   */
  public static Zone of(String id, String name, ZoneType type, int securityLevelTarget) {
    return new Zone(id, name, type, securityLevelTarget, null, null, List.of(), null, null, null, null);
  }

  /**
   * Returns a copy carrying the given assets.
   *
   * @param values assets to place in the zone
   * @return updated zone
   */
  public Zone withAssets(List<Asset> values) {
    return new Zone(id, name, type, securityLevelTarget, securityLevelCapability, description, values,
        parentZone, networkSegment, xPosition, yPosition);
  }

  /**
   * Returns a copy nested under another zone.
   *
   * @param parent parent zone id, or {@code null} to clear
   * @return updated zone
   */
  public Zone withParentZone(String parent) {
    return new Zone(id, name, type, securityLevelTarget, securityLevelCapability, description, assets,
        parent, networkSegment, xPosition, yPosition);
  }

  /**
   * Returns a copy with an achieved security level.
   *
   * @param capability SL-C between SL-T and 4, or {@code null} to clear
   * @return updated zone
   */
  public Zone withSecurityLevelCapability(Integer capability) {
    return new Zone(id, name, type, securityLevelTarget, capability, description, assets,
        parentZone, networkSegment, xPosition, yPosition);
  }
}
