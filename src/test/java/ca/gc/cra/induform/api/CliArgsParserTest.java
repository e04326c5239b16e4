package ca.gc.cra.induform.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"project=plant.yaml", "format=json"});
    assertEquals("plant.yaml", map.get("project"));
    assertEquals("json", map.get("format"));
  }

  @Test
  void valuesMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"otelResourceAttributes=site=plant-7,env=lab"});
    assertEquals("site=plant-7,env=lab", map.get("otelResourceAttributes"));
  }

  @Test
  void lastRepeatedKeyWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"strict=false", " ", "strict=true"});
    assertEquals(Map.of("strict", "true"), map);
  }

  @Test
  void rejectsBareWordsAndEmptyValues() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"project="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=plant.yaml"}));
  }

  @Test
  void rejectsMalformedKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"1st=value"}));
    assertEquals("invalid argument name: 1st", ex.getMessage());
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
