package ca.gc.cra.induform.domain.model;

import ca.gc.cra.induform.validation.Numbers;
import ca.gc.cra.induform.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable operational technology asset placed inside a zone.
 * <p><strong>Why:</strong> Asset type and criticality feed risk scoring, safety zone checks and NERC CIP rules;
 * IP addresses feed firewall rule generation.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param id identifier unique within the owning zone
 * @param name human-readable name
 * @param type asset category
 * @param ipAddress optional IP address
 * @param macAddress optional MAC address
 * @param vendor optional equipment vendor
 * @param model optional equipment model
 * @param firmwareVersion optional firmware version
 * @param description optional description
 * @param criticality business criticality rating, 1 (low) to 5 (critical); default {@value #DEFAULT_CRITICALITY}
 * @param details optional inventory attributes keyed by one of {@link #DETAIL_KEYS}
 * @since 0.1.0
 */
public record Asset(
    String id,
    String name,
    AssetType type,
    String ipAddress,
    String macAddress,
    String vendor,
    String model,
    String firmwareVersion,
    String description,
    int criticality,
    Map<String, String> details) {

  /** Criticality assumed when a project document omits the rating. */
  public static final int DEFAULT_CRITICALITY = 3;

  /** Inventory, network and lifecycle attributes carried through without engine semantics. */
  public static final Set<String> DETAIL_KEYS = Set.of(
      "os_name", "os_version", "software", "cpe",
      "subnet", "gateway", "vlan", "dns", "open_ports", "protocols",
      "purchase_date", "end_of_life", "warranty_expiry", "last_patched", "patch_level", "location");

  /**
   * Validates identifiers, the criticality range and detail keys.
   *
   * @throws IllegalArgumentException if a field is blank or out of range
   */
  public Asset {
    id = Strings.requireIdentifier("asset.id", id);
    name = Strings.requireNonBlank("asset.name", name);
    type = Objects.requireNonNull(type, "asset.type");
    ipAddress = Strings.optional("asset.ip_address", ipAddress);
    macAddress = Strings.optional("asset.mac_address", macAddress);
    vendor = Strings.optional("asset.vendor", vendor);
    model = Strings.optional("asset.model", model);
    firmwareVersion = Strings.optional("asset.firmware_version", firmwareVersion);
    description = Strings.optional("asset.description", description);
    Numbers.requireRange("asset.criticality", criticality, 1, 5);
    Map<String, String> copy = new LinkedHashMap<>();
    if (details != null) {
      for (Map.Entry<String, String> entry : details.entrySet()) {
        if (!DETAIL_KEYS.contains(entry.getKey())) {
          throw new IllegalArgumentException("Unknown asset attribute: " + entry.getKey());
        }
        String value = Strings.optional("asset." + entry.getKey(), entry.getValue());
        if (value != null) {
          copy.put(entry.getKey(), value);
        }
      }
    }
    details = Map.copyOf(copy);
  }

  /**
   * Creates an asset with default criticality and no optional attributes.
   *
   * @param id asset identifier
   * @param name asset name
   * @param type asset category
   * @return new asset
   */
  public static Asset of(String id, String name, AssetType type) {
    return new Asset(id, name, type, null, null, null, null, null, null, DEFAULT_CRITICALITY, Map.of());
  }

  /**
   * Returns a copy with a different criticality rating.
   *
   * @param value criticality between 1 and 5
   * @return updated asset
   */
  public Asset withCriticality(int value) {
    return new Asset(id, name, type, ipAddress, macAddress, vendor, model, firmwareVersion, description,
        value, details);
  }

  /**
   * Returns a copy with a different IP address.
   *
   * @param value IP address; may be {@code null}
   * @return updated asset
   */
  public Asset withIpAddress(String value) {
    return new Asset(id, name, type, value, macAddress, vendor, model, firmwareVersion, description,
        criticality, details);
  }
}
