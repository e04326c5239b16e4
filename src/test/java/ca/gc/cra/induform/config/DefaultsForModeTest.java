package ca.gc.cra.induform.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.application.firewall.FirewallOptions;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void firewallDefaultsMirrorFirewallOptions() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("firewall");
    FirewallConfig config = FirewallConfig.fromMap(defaults);

    assertEquals(FirewallOptions.DEFAULTS, config.options());
    assertEquals(OutputFormat.JSON, config.format());
    assertEquals(InitConfig.DEFAULT_FILE, config.projectPath().getFileName().toString());
    assertEquals("none", defaults.get("metricsExporter"));
  }

  @Test
  void validateDefaultsProduceTextReportOnStdout() {
    ValidateConfig config = ValidateConfig.fromMap(DefaultsForMode.asFlatMap("validate"));

    assertEquals(OutputFormat.TEXT, config.format());
    assertFalse(config.strict());
    assertTrue(config.standards().isEmpty());
    assertTrue(config.outputPath().isEmpty());
  }

  @Test
  void initDefaultsRefuseOverwrite() {
    InitConfig config = InitConfig.fromMap(DefaultsForMode.asFlatMap("INIT"));

    assertEquals(InitConfig.DEFAULT_NAME, config.projectName());
    assertFalse(config.allowOverwrite());
  }

  @Test
  void vlanDefaultsUseTypeRangesAndJson() {
    VlanConfig config = VlanConfig.fromMap(DefaultsForMode.asFlatMap("vlan"));

    assertEquals(OutputFormat.JSON, config.format());
    assertTrue(config.startVlan().isEmpty());
    assertTrue(config.outputPath().isEmpty());
  }

  @Test
  void analyzeDefaultsReportTenAttackPaths() {
    assertEquals(10, AnalyzeConfig.fromMap(DefaultsForMode.asFlatMap("analyze")).maxPaths());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
