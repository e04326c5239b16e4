package ca.gc.cra.induform.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConduitTest {

  @Test
  void conduitMustConnectTwoDifferentZones() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Conduit.of("loop", "cell_a", "cell_a", List.of()));
    assertTrue(ex.getMessage().contains("two different zones"));
  }

  @Test
  void factoryDisablesInspectionAndLeavesLevelUnset() {
    Conduit conduit = Conduit.of("c1", "site", "cell", List.of(ProtocolFlow.of("modbus_tcp", 502)));

    assertFalse(conduit.requiresInspection());
    assertEquals(null, conduit.securityLevelRequired());
    assertTrue(conduit.connects("site"));
    assertTrue(conduit.connects("cell"));
    assertFalse(conduit.connects("dmz"));
  }

  @Test
  void explicitSecurityLevelMustBeWithinRange() {
    Conduit conduit = Conduit.of("c1", "site", "cell", List.of());

    assertThrows(IllegalArgumentException.class, () -> conduit.withSecurityLevelRequired(5));
    assertEquals(3, conduit.withSecurityLevelRequired(3).securityLevelRequired());
  }

  @Test
  void flowDirectionDefaultsToBidirectional() {
    ProtocolFlow flow = new ProtocolFlow("opcua", 4840, null, null);

    assertEquals(FlowDirection.BIDIRECTIONAL, flow.direction());
  }

  @Test
  void flowPortMustBeValid() {
    assertThrows(IllegalArgumentException.class, () -> ProtocolFlow.of("modbus_tcp", 0));
    assertThrows(IllegalArgumentException.class, () -> ProtocolFlow.of("modbus_tcp", 70_000));
    assertThrows(IllegalArgumentException.class, () -> ProtocolFlow.of(" ", 502));
  }
}
