package ca.gc.cra.induform.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.induform.domain.model.ProjectMetadata;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class IndustrialProtocolsTest {

  @Test
  void builtInProtocolsMatchCaseInsensitively() {
    Set<String> allowlist = IndustrialProtocols.effectiveAllowlist(ProjectMetadata.named("Plant"));

    assertTrue(IndustrialProtocols.isAllowed(allowlist, "Modbus_TCP"));
    assertTrue(IndustrialProtocols.isAllowed(allowlist, "opcua"));
    assertFalse(IndustrialProtocols.isAllowed(allowlist, "telnet"));
  }

  @Test
  void projectProtocolsExtendTheAllowlist() {
    ProjectMetadata metadata = new ProjectMetadata("Plant", null, null, List.of("Telnet"), null, null);

    assertTrue(IndustrialProtocols.isAllowed(IndustrialProtocols.effectiveAllowlist(metadata), "telnet"));
  }
}
