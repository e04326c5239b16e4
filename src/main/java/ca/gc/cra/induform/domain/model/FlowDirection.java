package ca.gc.cra.induform.domain.model;

import java.util.Locale;

/**
 * Direction of a protocol flow relative to the conduit's {@code from_zone}.
 *
 * @since 0.1.0
 */
public enum FlowDirection {
  /** Traffic initiated from the {@code to} zone towards the {@code from} zone. */
  INBOUND("inbound"),
  /** Traffic initiated from the {@code from} zone towards the {@code to} zone. */
  OUTBOUND("outbound"),
  /** Traffic permitted in both directions. */
  BIDIRECTIONAL("bidirectional");

  private final String wireName;

  FlowDirection(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a direction from its wire name (case-insensitive).
   *
   * @param raw wire name; must not be {@code null}
   * @return matching direction
   * @throws IllegalArgumentException if no direction matches
   */
  public static FlowDirection fromWireName(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (FlowDirection direction : values()) {
      if (direction.wireName.equals(normalized)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown flow direction: " + raw);
  }
}
