package ca.gc.cra.induform.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ValidateCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ValidateCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void validProjectPrintsTextReport() {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);

    ExitCode code = ValidateCli.run(new String[] {"project=" + project});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("Validation results for Reference Plant\n"));
    assertTrue(output.contains("PURDUE_NON_ADJACENT"));
    assertTrue(output.contains("Validation passed"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.INFO
            && event.getFormattedMessage().contains("valid=true, errors=0, warnings=0, info=1")));
  }

  @Test
  void dmzBypassFailsWithJsonReport() {
    Path project = CliFixtures.copy("/projects/dmz-bypass.yaml", tempDir);

    ExitCode code = ValidateCli.run(new String[] {"in=" + project, "--json"});

    assertEquals(ExitCode.VALIDATION_FAILED, code);
    assertTrue(buffer.toString().contains("\"valid\" : false"));
    assertTrue(buffer.toString().contains("\"code\" : \"DMZ_BYPASS\""));
  }

  @Test
  void reportIsWrittenToOutFile() throws Exception {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);
    Path out = tempDir.resolve("reports/validation.txt");

    ExitCode code = ValidateCli.run(new String[] {"project=" + project, "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("", buffer.toString());
    assertTrue(Files.readString(out).contains("Validation passed"));
  }

  @Test
  void yamlConfigSuppliesDefaultsAndCliWins() {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);
    Path config = CliFixtures.copy("/config/induform-config.yaml", tempDir);

    ExitCode code = ValidateCli.run(new String[] {"project=" + project, "config=" + config, "format=text"});

    assertEquals(ExitCode.SUCCESS, code);
    assertFalse(buffer.toString().contains("{"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().equals("CLI overrides YAML for key: format")));
  }

  @Test
  void danglingConduitReferenceIsConfigError() {
    Path project = CliFixtures.copy("/projects/broken-reference.yaml", tempDir);

    ExitCode code = ValidateCli.run(new String[] {"project=" + project});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid project document")));
  }

  @Test
  void missingProjectIsIoError() {
    ExitCode code = ValidateCli.run(new String[] {"project=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void unknownFlagPrintsUsage() {
    ExitCode code = ValidateCli.run(new String[] {"--zones"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: validate"));
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    ExitCode code = ValidateCli.run(new String[] {"config=" + tempDir.resolve("nope.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
