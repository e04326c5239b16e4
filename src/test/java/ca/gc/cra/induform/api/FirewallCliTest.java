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

class FirewallCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(FirewallCli.class);
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
  void jsonRulesetIncludesDenyRulesByDefault() {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);

    ExitCode code = FirewallCli.run(new String[] {"project=" + project});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("\"name\" : \"Reference Plant Firewall Rules\""));
    assertTrue(output.contains("\"default_action\" : \"deny\""));
    assertTrue(output.contains("\"name\" : \"deny-enterprise-to-dmz\""));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.INFO
            && event.getFormattedMessage().startsWith("Generated 18 firewall rules")));
  }

  @Test
  void iptablesScriptFromYamlConfig() {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);
    Path config = CliFixtures.copy("/config/induform-config.yaml", tempDir);

    ExitCode code = FirewallCli.run(new String[] {"project=" + project, "config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("# Auto-generated iptables rules\n"));
    assertTrue(output.contains("-A FORWARD -s 10.2.0.30 -d 10.3.0.40 -p tcp --dport 502 -j ACCEPT"));
    assertFalse(output.contains("Default deny"));
    assertTrue(output.endsWith("COMMIT\n"));
  }

  @Test
  void existingOutputNeedsOverwriteApproval() throws Exception {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);
    Path out = Files.writeString(tempDir.resolve("rules.json"), "keep");

    ExitCode refused = FirewallCli.run(new String[] {
        "project=" + project, "out=" + out, "allowOverwrite=false"});
    ExitCode replaced = FirewallCli.run(new String[] {"project=" + project, "out=" + out});

    assertEquals(ExitCode.CONFIG_ERROR, refused);
    assertEquals(ExitCode.SUCCESS, replaced);
    assertTrue(Files.readString(out).contains("\"rules\""));
  }

  @Test
  void textFormatIsRejected() {
    Path project = CliFixtures.copy("/projects/reference-plant.yaml", tempDir);

    ExitCode code = FirewallCli.run(new String[] {"project=" + project, "format=text"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: firewall"));
  }
}
