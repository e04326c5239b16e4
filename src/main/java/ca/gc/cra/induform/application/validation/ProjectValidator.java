package ca.gc.cra.induform.application.validation;

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
 * <strong>What:</strong> Runs the {@link ValidationCheck} battery over a project and tallies the findings.
 * <p><strong>Why:</strong> Produces a deterministic diagnostic report for editors, the CLI and CI gates.</p>
 * <p><strong>Role:</strong> Application service; pure function of its input.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Execute every check in declaration order without short-circuiting.</li>
 *   <li>Optionally keep only findings attributed to the active compliance standards.</li>
 *   <li>Derive validity, treating warnings as failures in strict mode.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless and reentrant.</p>
 *
 * @since 0.1.0
 */
public final class ProjectValidator {
  private static final Logger log = LoggerFactory.getLogger(ProjectValidator.class);

  /**
   * Validates a project against every check.
   *
   * @param project project to validate; must not be {@code null}
   * @param strict whether warnings make the project invalid
   * @return validation report
   */
  public ValidationReport validate(Project project, boolean strict) {
    return validate(project, strict, Set.of());
  }

  /**
   * Validates a project and keeps findings whose check applies to one of {@code standards}.
   *
   * @param project project to validate; must not be {@code null}
   * @param strict whether warnings make the project invalid
   * @param standards active standards; empty keeps every finding
   * @return validation report
   */
  public ValidationReport validate(Project project, boolean strict, Set<ComplianceStandard> standards) {
    Objects.requireNonNull(project, "project");
    Set<ComplianceStandard> active = standards == null ? Set.of() : standards;
    List<ValidationResult> results = new ArrayList<>();
    for (ValidationCheck check : ValidationCheck.values()) {
      if (!StandardMappings.appliesTo(StandardMappings.standardsForCheck(check.code()), active)) {
        continue;
      }
      check.run(project, results);
    }
    ValidationReport report = ValidationReport.of(results, strict);
    if (log.isDebugEnabled()) {
      log.debug("Validated {}: valid={} errors={} warnings={} infos={} strict={}",
          project, report.valid(), report.errorCount(), report.warningCount(), report.infoCount(), strict);
    }
    return report;
  }
}
