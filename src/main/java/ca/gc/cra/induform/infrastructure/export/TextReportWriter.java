package ca.gc.cra.induform.infrastructure.export;

import ca.gc.cra.induform.application.validation.ValidationReport;
import ca.gc.cra.induform.application.validation.ValidationResult;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a validation report as fixed-width terminal text.
 *
 * <p>One line per finding ({@code SEVERITY CODE location: message}), followed by an optional indented
 * recommendation, a pass/fail line and the severity counts.</p>
 *
 * @since 0.1.0
 */
public final class TextReportWriter {
  private static final int SEVERITY_WIDTH = 8;
  private static final int CODE_WIDTH = 32;

  /**
   * Renders the report.
   *
   * @param projectName name shown in the heading
   * @param report report to render
   * @return text ending with a newline
   */
  public String validationReport(String projectName, ValidationReport report) {
    Objects.requireNonNull(report, "report");
    StringBuilder sb = new StringBuilder();
    sb.append("Validation results for ").append(projectName).append('\n');
    for (ValidationResult result : report.results()) {
      sb.append(pad(result.severity().wireName().toUpperCase(Locale.ROOT), SEVERITY_WIDTH))
          .append(pad(result.code(), CODE_WIDTH))
          .append(result.location() == null ? "-" : result.location())
          .append(": ")
          .append(result.message())
          .append('\n');
      if (result.recommendation() != null) {
        sb.append(" ".repeat(SEVERITY_WIDTH)).append("-> ").append(result.recommendation()).append('\n');
      }
    }
    if (!report.results().isEmpty()) {
      sb.append('\n');
    }
    sb.append(report.valid() ? "Validation passed" : "Validation failed").append('\n');
    sb.append("  Errors: ").append(report.errorCount())
        .append(", Warnings: ").append(report.warningCount())
        .append(", Info: ").append(report.infoCount())
        .append('\n');
    return sb.toString();
  }

  private static String pad(String value, int width) {
    if (value.length() >= width) {
      return value + ' ';
    }
    return value + " ".repeat(width - value.length());
  }
}
