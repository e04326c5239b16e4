package ca.gc.cra.induform.application.validation;

import java.util.Objects;

/**
 * Single validation finding.
 *
 * @param severity severity fixed by the emitting check
 * @param code stable check code such as {@code DMZ_BYPASS}
 * @param message human-readable description
 * @param location location in the project document, e.g. {@code conduits[c1].requires_inspection}
 * @param recommendation suggested fix; may be {@code null}
 * @since 0.1.0
 */
public record ValidationResult(
    ValidationSeverity severity,
    String code,
    String message,
    String location,
    String recommendation) {

  public ValidationResult {
    severity = Objects.requireNonNull(severity, "severity");
    code = Objects.requireNonNull(code, "code");
    message = Objects.requireNonNull(message, "message");
  }
}
