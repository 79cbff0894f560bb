package ca.gc.cra.mosaic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class EncodeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(EncodeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpFlagPrintsUsageAndReturnsSuccess() {
    ExitCode code = EncodeCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("MOSAIC encode"));
    assertTrue(buffer.toString().contains("passphraseEnv=VAR"));
  }

  @Test
  void malformedKeyValueReturnsInvalidArgs() {
    ExitCode code = EncodeCli.run(new String[] {"hello"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: mosaic encode"));
    assertTrue(hasLog(Level.ERROR, "must be key=value"));
  }

  @Test
  void missingOutputReturnsInvalidArgs() {
    ExitCode code = EncodeCli.run(new String[] {"text=hello"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLog(Level.ERROR, "out is required"));
  }

  @Test
  void missingInputReturnsInvalidArgs() {
    ExitCode code = EncodeCli.run(new String[] {"out=" + tempDir.resolve("m.png")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLog(Level.ERROR, "text or in is required"));
  }

  @Test
  void dryRunPrintsPlanWithoutWriting() {
    Path out = tempDir.resolve("plan.png");

    ExitCode code = EncodeCli.run(new String[] {"text=hello world", "chunkSize=5", "out=" + out, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Encode dry-run"));
    assertTrue(output.contains("Frames            : 20"));
    assertTrue(output.contains("Grid              : 5 x 4"));
    assertTrue(output.contains("Encrypted         : false"));
    assertTrue(Files.notExists(out));
  }

  @Test
  void writesPngMosaic() throws Exception {
    Path out = tempDir.resolve("nested/hello.png");

    ExitCode code = EncodeCli.run(new String[] {"text=hello world", "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    byte[] png = Files.readAllBytes(out);
    assertEquals((byte) 0x89, png[0]);
    assertTrue(buffer.toString().contains("Wrote png mosaic to " + out));
  }

  @Test
  void existingOutputRequiresAllowOverwrite() throws Exception {
    Path out = Files.writeString(tempDir.resolve("taken.png"), "old");

    assertEquals(ExitCode.INVALID_ARGS, EncodeCli.run(new String[] {"text=hi", "out=" + out}));
    assertTrue(hasLog(Level.ERROR, "--allow-overwrite"));
    assertEquals("old", Files.readString(out));

    assertEquals(ExitCode.SUCCESS, EncodeCli.run(new String[] {"text=hi", "out=" + out, "--allow-overwrite"}));
    assertEquals((byte) 0x89, Files.readAllBytes(out)[0]);
  }

  @Test
  void stdoutTargetPrintsBase64Png() {
    ExitCode code = EncodeCli.run(new String[] {"text=hi", "format=base64", "out=-"});

    assertEquals(ExitCode.SUCCESS, code);
    byte[] png = Base64.getDecoder().decode(buffer.toString().trim());
    assertEquals('P', png[1]);
  }

  @Test
  void stdoutTargetRequiresBase64() {
    assertEquals(ExitCode.INVALID_ARGS, EncodeCli.run(new String[] {"text=hi", "out=-"}));
    assertTrue(hasLog(Level.ERROR, "requires format=base64"));
  }

  @Test
  void readsTextFromFileAndPassphraseFromEnvironment() throws Exception {
    Path in = Files.writeString(tempDir.resolve("notes.txt"), "from a file", StandardCharsets.UTF_8);
    Path out = tempDir.resolve("notes.png");

    ExitCode code = EncodeCli.run(
        new String[] {"in=" + in, "out=" + out, "passphraseEnv=MOSAIC_PASSPHRASE", "--dry-run"},
        Map.of("MOSAIC_PASSPHRASE", "s3cret")::get);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Encrypted         : true"));
  }

  @Test
  void unsetPassphraseVariableReturnsInvalidArgs() {
    ExitCode code = EncodeCli.run(
        new String[] {"text=hi", "out=" + tempDir.resolve("x.png"), "passphraseEnv=MISSING_VAR"},
        name -> null);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLog(Level.ERROR, "MISSING_VAR is not set"));
  }

  @Test
  void yamlConfigSuppliesOptions() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("mosaic.yaml"), "encode:\n  chunkSize: 7\n  labels: false\n");

    ExitCode code = EncodeCli.run(new String[] {
        "config=" + yaml, "text=abcdefghijklmn", "out=" + tempDir.resolve("y.png"), "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Chunk size        : 7"));
    assertTrue(buffer.toString().contains("Labels            : false"));
  }

  @Test
  void malformedConfigFileReturnsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "encode: [unclosed\n");

    ExitCode code = EncodeCli.run(new String[] {
        "config=" + yaml, "text=hi", "out=" + tempDir.resolve("z.png")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLog(Level.ERROR, "Invalid encode configuration file"));
  }

  @Test
  void missingConfigFileReturnsConfigError() {
    ExitCode code = EncodeCli.run(new String[] {
        "config=" + tempDir.resolve("absent.yaml"), "text=hi", "out=" + tempDir.resolve("z.png")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void oversizedChunkReturnsInvalidArgs() {
    ExitCode code = EncodeCli.run(new String[] {
        "text=" + "x".repeat(3000), "chunkSize=3000", "errorCorrection=H", "out=" + tempDir.resolve("big.png")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLog(Level.ERROR, "too large"));
  }

  private boolean hasLog(Level level, String fragment) {
    List<ILoggingEvent> events = appender.list;
    return events.stream()
        .filter(event -> event.getLevel().equals(level))
        .anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
