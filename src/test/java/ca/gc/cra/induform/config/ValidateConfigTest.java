package ca.gc.cra.induform.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.compliance.ComplianceStandard;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ValidateConfigTest {

  @Test
  void parsesStandardsListCaseInsensitively() {
    ValidateConfig config = ValidateConfig.fromMap(Map.of(
        "project", "plant.yaml",
        "standards", "iec62443, nerc-cip",
        "strict", "yes",
        "format", "JSON",
        "out", "reports/validation.json"));

    assertEquals(Optional.of(Set.of(ComplianceStandard.IEC62443, ComplianceStandard.NERC_CIP)), config.standards());
    assertTrue(config.strict());
    assertEquals(OutputFormat.JSON, config.format());
    assertEquals(Path.of("reports/validation.json").toAbsolutePath().normalize(), config.outputPath().orElseThrow());
  }

  @Test
  void allStandardsDisablesFiltering() {
    ValidateConfig config = ValidateConfig.fromMap(Map.of("project", "plant.yaml", "standards", "ALL"));

    assertEquals(Optional.of(Set.of()), config.standards());
  }

  @Test
  void unknownStandardIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ValidateConfig.fromMap(Map.of("project", "plant.yaml", "standards", "ISO27001")));
  }

  @Test
  void malformedBooleanIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ValidateConfig.fromMap(Map.of("project", "plant.yaml", "strict", "maybe")));
    assertEquals("expected true or false but was 'maybe'", ex.getMessage());
  }

  @Test
  void iptablesFormatIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ValidateConfig.fromMap(Map.of("project", "plant.yaml", "format", "iptables")));
  }

  @Test
  void projectIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> ValidateConfig.fromMap(Map.of("strict", "true")));
  }
}
