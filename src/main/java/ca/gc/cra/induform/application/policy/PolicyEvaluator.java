package ca.gc.cra.induform.application.policy;

import ca.gc.cra.induform.application.standards.StandardMappings;
import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import ca.gc.cra.induform.domain.model.Project;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Evaluates every {@link PolicyRule} against a project.
 * <p><strong>Role:</strong> Application service alongside the validator; rules are independent and never
 * short-circuit each other.</p>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class PolicyEvaluator {
  private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

  /**
   * Evaluates all rules.
   *
   * @param project project to evaluate
   * @return violations in rule order
   */
  public List<PolicyViolation> evaluate(Project project) {
    return evaluate(project, Set.of());
  }

  /**
   * Evaluates the rules attributed to at least one of {@code standards}.
   *
   * @param project project to evaluate
   * @param standards active standards; empty evaluates every rule
   * @return violations in rule order
   */
  public List<PolicyViolation> evaluate(Project project, Set<ComplianceStandard> standards) {
    Objects.requireNonNull(project, "project");
    Set<ComplianceStandard> active = standards == null ? Set.of() : standards;
    List<PolicyViolation> violations = new ArrayList<>();
    for (PolicyRule rule : PolicyRule.values()) {
      if (StandardMappings.appliesTo(StandardMappings.standardsForRule(rule.id()), active)) {
        rule.evaluate(project, violations);
      }
    }
    log.debug("Evaluated policies for {}: {} violation(s)", project, violations.size());
    return List.copyOf(violations);
  }

  /**
   * Lists rule definitions in evaluation order.
   *
   * @return rules
   */
  public List<PolicyRule> rules() {
    return List.of(PolicyRule.values());
  }
}
