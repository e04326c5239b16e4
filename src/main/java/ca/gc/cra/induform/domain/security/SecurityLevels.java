package ca.gc.cra.induform.domain.security;

import ca.gc.cra.induform.validation.Numbers;

/**
 * <strong>What:</strong> Pure security level arithmetic shared by the validator, policy rules, risk engine and resolver.
 * <p><strong>Why:</strong> A conduit must carry the stricter of its two zones' targets, and a wide gap between
 * targets calls for deep packet inspection at the boundary.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SecurityLevels {
  /** Minimum SL-T gap at which a conduit requires inspection. */
  public static final int INSPECTION_GAP = 2;

  private SecurityLevels() {
    // Utility
  }

  /**
   * Returns the security level a conduit between two zones must support.
   *
   * @param fromLevel SL-T of the source zone (1-4)
   * @param toLevel SL-T of the destination zone (1-4)
   * @return {@code max(fromLevel, toLevel)}
   * @throws IllegalArgumentException if either level is outside 1-4
   */
  public static int conduitSecurityLevel(int fromLevel, int toLevel) {
    Numbers.requireRange("fromLevel", fromLevel, 1, 4);
    Numbers.requireRange("toLevel", toLevel, 1, 4);
    return Math.max(fromLevel, toLevel);
  }

  /**
   * Indicates whether a conduit between two zones requires deep packet inspection.
   *
   * @param fromLevel SL-T of the source zone (1-4)
   * @param toLevel SL-T of the destination zone (1-4)
   * @return {@code true} when the levels differ by {@value #INSPECTION_GAP} or more
   * @throws IllegalArgumentException if either level is outside 1-4
   */
  public static boolean requiresInspection(int fromLevel, int toLevel) {
    return gap(fromLevel, toLevel) >= INSPECTION_GAP;
  }

  /**
   * Returns the absolute difference between two security levels.
   *
   * @param fromLevel first level (1-4)
   * @param toLevel second level (1-4)
   * @return absolute difference, 0-3
   */
  public static int gap(int fromLevel, int toLevel) {
    Numbers.requireRange("fromLevel", fromLevel, 1, 4);
    Numbers.requireRange("toLevel", toLevel, 1, 4);
    return Math.abs(fromLevel - toLevel);
  }
}
