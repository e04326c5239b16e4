package ca.gc.cra.induform.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.induform.application.firewall.FirewallOptions;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FirewallConfigTest {

  @Test
  void generationFlagsOverrideDefaults() {
    FirewallConfig config = FirewallConfig.fromMap(Map.of(
        "project", "plant.yaml",
        "format", "iptables",
        "includeDeny", "false",
        "logAllowed", "true",
        "allowOverwrite", "no"));

    assertEquals(OutputFormat.IPTABLES, config.format());
    assertEquals(new FirewallOptions(false, true, true), config.options());
    assertFalse(config.allowOverwrite());
  }

  @Test
  void textFormatIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> FirewallConfig.fromMap(Map.of("project", "plant.yaml", "format", "text")));
  }

  @Test
  void unknownFormatIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> FirewallConfig.fromMap(Map.of("project", "plant.yaml", "format", "nftables")));
    assertEquals("Unknown format: nftables", ex.getMessage());
  }
}
