package ca.gc.cra.induform.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.application.validation.ValidationReport;
import ca.gc.cra.induform.application.validation.ValidationResult;
import ca.gc.cra.induform.application.validation.ValidationSeverity;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextReportWriterTest {
  private final TextReportWriter writer = new TextReportWriter();

  @Test
  void cleanReportPrintsSummaryOnly() {
    String text = writer.validationReport("Plant", ValidationReport.of(List.of(), false));

    assertEquals("Validation results for Plant\nValidation passed\n  Errors: 0, Warnings: 0, Info: 0\n", text);
  }

  @Test
  void findingsAreAlignedWithRecommendations() {
    ValidationReport report = ValidationReport.of(List.of(
        new ValidationResult(ValidationSeverity.ERROR, "DMZ_BYPASS", "bypasses DMZ", "conduits[direct_link]",
            "Route traffic through DMZ zone for proper security boundary"),
        new ValidationResult(ValidationSeverity.INFO, "ZONE_NO_CONDUITS", "isolated", null, null)), false);

    String[] lines = writer.validationReport("Plant", report).split("\n");

    assertEquals(String.format("%-8s%-32s%s", "ERROR", "DMZ_BYPASS", "conduits[direct_link]: bypasses DMZ"),
        lines[1]);
    assertEquals("        -> Route traffic through DMZ zone for proper security boundary", lines[2]);
    assertEquals(String.format("%-8s%-32s%s", "INFO", "ZONE_NO_CONDUITS", "-: isolated"), lines[3]);
    assertEquals("", lines[4]);
    assertEquals("Validation failed", lines[5]);
    assertTrue(lines[6].contains("Errors: 1, Warnings: 0, Info: 1"));
  }
}
