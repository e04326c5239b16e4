package ca.gc.cra.induform.application.validation;

import java.util.List;
import java.util.Objects;

/**
 * Complete validation outcome for a project.
 *
 * @param valid {@code false} when any error is present, or in strict mode when any warning is present
 * @param results findings in check order
 * @param errorCount number of error findings
 * @param warningCount number of warning findings
 * @param infoCount number of informational findings
 * @since 0.1.0
 */
public record ValidationReport(
    boolean valid,
    List<ValidationResult> results,
    int errorCount,
    int warningCount,
    int infoCount) {

  public ValidationReport {
    results = List.copyOf(Objects.requireNonNull(results, "results"));
  }

  /**
   * Tallies findings and derives validity.
   *
   * @param results findings in check order
   * @param strict whether warnings invalidate the project
   * @return report
   */
  public static ValidationReport of(List<ValidationResult> results, boolean strict) {
    int errors = 0;
    int warnings = 0;
    int infos = 0;
    for (ValidationResult result : results) {
      switch (result.severity()) {
        case ERROR -> errors++;
        case WARNING -> warnings++;
        case INFO -> infos++;
      }
    }
    boolean valid = errors == 0 && (!strict || warnings == 0);
    return new ValidationReport(valid, results, errors, warnings, infos);
  }

  /**
   * Returns the findings carrying a given code.
   *
   * @param code check code
   * @return matching findings in order
   */
  public List<ValidationResult> resultsWithCode(String code) {
    return results.stream().filter(result -> result.code().equals(code)).toList();
  }
}
