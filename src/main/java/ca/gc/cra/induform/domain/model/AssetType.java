package ca.gc.cra.induform.domain.model;

import java.util.Locale;

/**
 * Operational technology asset categories.
 *
 * @since 0.1.0
 */
public enum AssetType {
  PLC("plc"),
  HMI("hmi"),
  SCADA("scada"),
  ENGINEERING_WORKSTATION("engineering_workstation"),
  HISTORIAN("historian"),
  JUMP_HOST("jump_host"),
  FIREWALL("firewall"),
  SWITCH("switch"),
  ROUTER("router"),
  SERVER("server"),
  RTU("rtu"),
  IED("ied"),
  DCS("dcs"),
  OTHER("other");

  private final String wireName;

  AssetType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used in project documents.
   *
   * @return wire name such as {@code "engineering_workstation"}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves an asset type from its wire name (case-insensitive).
   *
   * @param raw wire name; must not be {@code null}
   * @return matching asset type
   * @throws IllegalArgumentException if no asset type matches
   */
  public static AssetType fromWireName(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (AssetType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown asset type: " + raw);
  }
}
