package ca.gc.cra.induform.application.pipeline;

import ca.gc.cra.induform.application.policy.PolicyViolation;
import ca.gc.cra.induform.application.resolver.ResolvedControls;
import ca.gc.cra.induform.application.risk.RiskAssessment;
import ca.gc.cra.induform.application.validation.ValidationReport;
import java.util.List;
import java.util.Objects;

/**
 * Combined output of every engine component for one project.
 *
 * @param projectName project name from metadata
 * @param validation validation report
 * @param policyViolations policy violations in rule order
 * @param risk risk assessment
 * @param controls resolved security controls
 * @since 0.1.0
 */
public record ProjectAssessment(
    String projectName,
    ValidationReport validation,
    List<PolicyViolation> policyViolations,
    RiskAssessment risk,
    ResolvedControls controls) {

  public ProjectAssessment {
    projectName = Objects.requireNonNull(projectName, "projectName");
    validation = Objects.requireNonNull(validation, "validation");
    policyViolations = List.copyOf(policyViolations);
    risk = Objects.requireNonNull(risk, "risk");
    controls = Objects.requireNonNull(controls, "controls");
  }
}
