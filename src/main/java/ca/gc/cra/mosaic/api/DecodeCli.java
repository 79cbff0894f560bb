package ca.gc.cra.mosaic.api;

import ca.gc.cra.mosaic.application.pipeline.DecodeResult;
import ca.gc.cra.mosaic.config.CompositionRoot;
import ca.gc.cra.mosaic.config.MosaicConfig;
import ca.gc.cra.mosaic.domain.error.ErrorKind;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import ca.gc.cra.mosaic.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.mosaic.logging.LoggingConfigurator;
import ca.gc.cra.mosaic.logging.Logs;
import ca.gc.cra.mosaic.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code mosaic decode}: recovers text from a mosaic image and prints a JSON report.
 *
 * <p>A failed decode still prints a report naming the error kind and exits with
 * {@link ExitCode#DECODE_FAILURE}. With {@code out=FILE} the text goes to the file and the report carries
 * the path instead of the text.</p>
 *
 * @since 0.1.0
 */
public final class DecodeCli {
  private static final Logger log = LoggerFactory.getLogger(DecodeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: mosaic decode in=FILE [passphrase=P | passphraseEnv=VAR] [out=FILE] "
          + "[tokenTtlSeconds=N] [config=mosaic.yaml] [--allow-overwrite] [--verbose]";
  private static final String HELP_TEXT = """
      MOSAIC decode

      Usage:
        mosaic decode in=hello.png
        mosaic decode in=notes.png passphraseEnv=MOSAIC_PASSPHRASE out=notes.txt

      Required:
        in=FILE                   Mosaic image (PNG, JPEG, GIF or BMP)

      Options:
        passphrase=P              Decrypt with this passphrase
        passphraseEnv=VAR         Decrypt with the passphrase held in environment variable VAR
        out=FILE                  Write recovered text to FILE instead of the report
        tokenTtlSeconds=N         Reject encrypted mosaics older than N seconds (default 0, no limit)
        scanMaxGrid=N             Largest grid the scanner sweeps (default 8)
        config=PATH               YAML file with common/decode sections
        metricsExporter=otlp|none Metrics exporter (default none)
        --allow-overwrite         Replace an existing out file
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Output:
        {"data":"...","sha256":"..."} on success
        {"error":"...","kind":"...","sha256":...,"missing":[...]} on failure (exit code 6)
      """;

  private DecodeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, System::getenv);
  }

  static ExitCode run(String[] args, Function<String, String> env) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for decode CLI: {}", input);
    }
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid decode arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Optional<Map<String, String>> yaml;
    try {
      yaml = ConfigCliUtils.loadConfigFile("decode", kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid decode configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    Map<String, String> effective;
    MosaicConfig config;
    String exporter;
    String passphrase;
    Path in;
    Path out = null;
    try {
      effective = ConfigCliUtils.effectiveConfig("decode", yaml, kv, log::warn);
      allowOverwrite = allowOverwrite || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = MosaicConfig.fromMap(effective);
      passphrase = ConfigCliUtils.resolvePassphrase(effective, env);
      String inRaw = effective.get("in");
      if (inRaw == null || inRaw.isBlank()) {
        throw new IllegalArgumentException("in is required");
      }
      in = Paths.requireReadableFile("in", Path.of(inRaw.trim()));
      String outRaw = effective.get("out");
      if (outRaw != null && !outRaw.isBlank()) {
        out = Paths.requireWritableFile("out", Path.of(outRaw.trim()), allowOverwrite, true);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid decode arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(
        config, CompositionRoot.metricsFor(exporter), new SystemClockAdapter(), MessageId::random)) {
      byte[] image = Files.readAllBytes(in);
      log.info("Decoding {} ({} bytes, passphrase={})", in, image.length, Logs.redact(passphrase));
      DecodeResult result = root.decodeUseCase().decode(image, passphrase);
      if (!result.succeeded()) {
        CliPrinter.println(DecodeReportWriter.render(result, null));
        return result.failure().kind() == ErrorKind.VALIDATION ? ExitCode.INVALID_ARGS : ExitCode.DECODE_FAILURE;
      }
      if (out != null) {
        Files.writeString(out, result.text(), StandardCharsets.UTF_8);
        log.info("Wrote {} recovered characters to {}", result.text().length(), out);
      }
      CliPrinter.println(DecodeReportWriter.render(result, out));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Decode I/O failure for {}", in, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Decode configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in decode", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
