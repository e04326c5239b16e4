package ca.gc.cra.induform.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InitConfigTest {

  @Test
  void blankValuesFallBackToDefaults() {
    InitConfig config = InitConfig.fromMap(Map.of("name", "  ", "out", ""));

    assertEquals(InitConfig.DEFAULT_NAME, config.projectName());
    assertEquals(Path.of(InitConfig.DEFAULT_FILE).toAbsolutePath().normalize(), config.outputPath());
  }

  @Test
  void forceAllowsOverwrite() {
    InitConfig config = InitConfig.fromMap(Map.of("name", "Water Plant", "allowOverwrite", "true"));

    assertEquals("Water Plant", config.projectName());
    assertTrue(config.allowOverwrite());
  }

  @Test
  void controlCharactersInNameAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new InitConfig("bad\u0000name", Path.of("induform.yaml"), false));
  }
}
