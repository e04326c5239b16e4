package ca.gc.cra.induform.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for identifiers and free text used by the InduForm model and CLI.
 * <p><strong>Why:</strong> Zone, conduit and asset identifiers become lookup keys, log fields and firewall rule
 * references, so they must be trimmed and free of control characters before the engine sees them.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked from model constructors and configuration loaders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via project files or CLI arguments.</li>
 *   <li>Constrain entity identifiers to a portable character set.</li>
 *   <li>Verify printable ASCII constraints for telemetry attribute overrides.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9._:-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an entity identifier (zone, conduit, asset).
   *
   * @param name logical parameter name included in exception messages
   * @param id candidate identifier; must be non-null
   * @return trimmed identifier matching {@code [A-Za-z0-9._:-]+}
   * @throws NullPointerException if {@code id} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank or contains unsupported characters
   */
  public static String requireIdentifier(String name, String id) {
    String sanitized = requireNonBlank(name, id);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, colon, underscore, or hyphen (was '" + sanitized + "')"));
    }
    return sanitized;
  }

  /**
   * Normalizes optional free text: {@code null} and blank collapse to {@code null}, otherwise trimmed.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; may be {@code null}
   * @return trimmed text or {@code null}
   * @throws IllegalArgumentException if the value contains control characters other than line breaks and tabs
   */
  public static String optional(String name, String value) {
    if (value == null) {
      return null;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value exceeds {@code maxLength} or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
