package ca.gc.cra.induform.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateOutputFileCreatesMissingParents() {
    Path target = tempDir.resolve("reports/nested/rules.json");

    Path validated = Paths.validateOutputFile(target, false);

    assertEquals(target.toAbsolutePath().normalize(), validated);
    assertTrue(Files.isDirectory(target.getParent()));
  }

  @Test
  void validateOutputFileRejectsExistingFileWithoutOverwrite() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("induform.yaml"), "project: {}");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(existing, false));
    assertTrue(ex.getMessage().contains("--force"));
  }

  @Test
  void validateOutputFileAllowsOverwriteWhenRequested() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("report.txt"), "old");

    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateOutputFile(existing, true));
  }

  @Test
  void validateOutputFileRejectsDirectories() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir, true));
  }
}
