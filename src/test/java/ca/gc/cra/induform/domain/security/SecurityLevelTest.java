package ca.gc.cra.induform.domain.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SecurityLevelTest {

  @Test
  void numericLevelsResolveToDescriptors() {
    assertEquals(SecurityLevel.SL3, SecurityLevel.of(3));
    assertEquals("SL 4 - State-Critical", SecurityLevel.of(4).title());
    assertEquals("Generic tools, public exploits", SecurityLevel.SL2.resources());
  }

  @Test
  void unknownLevelIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> SecurityLevel.of(5));
    assertEquals("Invalid security level: 5. Must be 1-4.", ex.getMessage());
  }
}
