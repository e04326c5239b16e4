package ca.gc.cra.induform.domain.model;

import java.util.Locale;

/**
 * <strong>What:</strong> Zone classification following the IEC 62443 / Purdue reference hierarchy.
 * <p><strong>Why:</strong> Zone type drives Purdue adjacency, DMZ and cell isolation checks, and safety constraints.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ZoneType {
  /** Business network (Purdue level 5). */
  ENTERPRISE("enterprise", 5),
  /** Site operations (Purdue level 3). */
  SITE("site", 3),
  /** Area supervisory control (Purdue level 2). */
  AREA("area", 2),
  /** Basic control / cell (Purdue level 1). */
  CELL("cell", 1),
  /** Demilitarized zone between enterprise and operations (Purdue level 3.5, modelled as 4). */
  DMZ("dmz", 4),
  /** Safety instrumented systems (Purdue level 0). */
  SAFETY("safety", 0);

  private final String wireName;
  private final int purdueLevel;

  ZoneType(String wireName, int purdueLevel) {
    this.wireName = wireName;
    this.purdueLevel = purdueLevel;
  }

  /**
   * Returns the lowercase name used in project documents and JSON output.
   *
   * @return wire name such as {@code "cell"}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Returns the numeric Purdue level used for adjacency checks.
   *
   * @return level between 0 (safety) and 5 (enterprise)
   */
  public int purdueLevel() {
    return purdueLevel;
  }

  /**
   * Indicates whether two different zone types sit on neighbouring Purdue levels.
   *
   * @param other zone type on the far side of a conduit; must not be {@code null}
   * @return {@code true} when the levels differ by exactly one
   */
  public boolean isPurdueAdjacentTo(ZoneType other) {
    return Math.abs(purdueLevel - other.purdueLevel) == 1;
  }

  /**
   * Resolves a zone type from its wire name (case-insensitive).
   *
   * @param raw wire name; must not be {@code null}
   * @return matching zone type
   * @throws IllegalArgumentException if no zone type matches
   */
  public static ZoneType fromWireName(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ZoneType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown zone type: " + raw);
  }
}
