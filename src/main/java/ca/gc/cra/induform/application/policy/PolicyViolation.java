package ca.gc.cra.induform.application.policy;

import java.util.List;
import java.util.Objects;

/**
 * Failed policy rule instance.
 *
 * @param ruleId rule identifier such as {@code POL-005}
 * @param ruleName rule display name
 * @param severity severity of this violation; usually the rule's own severity
 * @param message human-readable description
 * @param affectedEntities zone, conduit or asset ids responsible for the violation
 * @param remediation suggested fix; may be {@code null}
 * @since 0.1.0
 */
public record PolicyViolation(
    String ruleId,
    String ruleName,
    PolicySeverity severity,
    String message,
    List<String> affectedEntities,
    String remediation) {

  public PolicyViolation {
    ruleId = Objects.requireNonNull(ruleId, "ruleId");
    ruleName = Objects.requireNonNull(ruleName, "ruleName");
    severity = Objects.requireNonNull(severity, "severity");
    message = Objects.requireNonNull(message, "message");
    affectedEntities = List.copyOf(Objects.requireNonNullElse(affectedEntities, List.of()));
  }
}
