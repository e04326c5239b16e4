package ca.gc.cra.induform.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by the InduForm model, project reader and CLI.
 * <p><strong>Why:</strong> Security levels, criticality ratings and ports have fixed inclusive ranges; checking them
 * once at construction lets every engine component assume well-formed values.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Integer overload of {@link #requireRange(String, long, long, long)}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static int requireRange(String name, int value, int min, int max) {
    return (int) requireRange(name, (long) value, (long) min, (long) max);
  }

  /**
   * Validates an optional integer against an inclusive range; {@code null} passes through.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value; may be {@code null}
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value or {@code null}
   * @throws IllegalArgumentException if a non-null {@code value} lies outside {@code [min, max]}
   */
  public static Integer requireOptionalRange(String name, Integer value, int min, int max) {
    if (value == null) {
      return null;
    }
    return requireRange(name, value.intValue(), min, max);
  }
}
