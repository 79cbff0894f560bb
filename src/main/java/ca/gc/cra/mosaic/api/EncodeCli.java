package ca.gc.cra.mosaic.api;

import ca.gc.cra.mosaic.application.pipeline.EncodeUseCase;
import ca.gc.cra.mosaic.config.CompositionRoot;
import ca.gc.cra.mosaic.config.MosaicConfig;
import ca.gc.cra.mosaic.domain.error.ImageException;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.Frame;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import ca.gc.cra.mosaic.infrastructure.image.TileLayoutEngine;
import ca.gc.cra.mosaic.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.mosaic.logging.Logs;
import ca.gc.cra.mosaic.logging.LoggingConfigurator;
import ca.gc.cra.mosaic.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code mosaic encode}: writes text as a PNG mosaic of QR symbols.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge CLI, YAML and default options and validate them.</li>
 *   <li>Read the text from {@code text=} or a UTF-8 file given by {@code in=}.</li>
 *   <li>Encode and write PNG bytes, or base64 text, to {@code out=} ({@code out=-} prints base64).</li>
 * </ul>
 * <p><strong>Observability:</strong> Logs to stderr; stdout carries only the command result.</p>
 *
 * @since 0.1.0
 */
public final class EncodeCli {
  private static final Logger log = LoggerFactory.getLogger(EncodeCli.class);
  private static final String STDOUT_TARGET = "-";
  private static final String SUMMARY_USAGE =
      "usage: mosaic encode (text=TEXT | in=FILE) out=FILE|- [chunkSize=N] "
          + "[passphrase=P | passphraseEnv=VAR] [labels=true|false] [format=png|base64] "
          + "[errorCorrection=L|M|Q|H] [moduleSize=N] [quietZone=N] [config=mosaic.yaml] "
          + "[--dry-run] [--allow-overwrite] [--verbose]";
  private static final String HELP_TEXT = """
      MOSAIC encode

      Usage:
        mosaic encode text="hello world" out=hello.png [options]
        mosaic encode in=notes.txt out=notes.png passphraseEnv=MOSAIC_PASSPHRASE

      Input (one of):
        text=TEXT                 Text to encode
        in=FILE                   UTF-8 text file to encode

      Output:
        out=FILE|-                Destination file; '-' prints base64 to stdout
        format=png|base64         File content (default png)

      Options:
        chunkSize=N               Characters per QR symbol (default 500)
        passphrase=P              Encrypt with this passphrase
        passphraseEnv=VAR         Encrypt with the passphrase held in environment variable VAR
        labels=true|false         Print index/total under each symbol (default true)
        errorCorrection=L|M|Q|H   QR error-correction level (default Q)
        moduleSize=N              Pixels per QR module (default 10)
        quietZone=N               Blank border in modules (default 4)
        config=PATH               YAML file with common/encode sections
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        --dry-run                 Validate and print the frame plan without writing
        --allow-overwrite         Replace an existing output file
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private EncodeCli() {}

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
      log.debug("Verbose logging enabled for encode CLI: {}", input);
    }
    boolean dryRun = input.hasFlag("--dry-run");
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid encode arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Optional<Map<String, String>> yaml;
    try {
      yaml = ConfigCliUtils.loadConfigFile("encode", kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid encode configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig("encode", yaml, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid encode arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    dryRun = dryRun || ConfigCliUtils.parseBoolean(effective, "dryRun");
    allowOverwrite = allowOverwrite || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    MosaicConfig config;
    String exporter;
    String passphrase;
    String format;
    String outRaw;
    try {
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = MosaicConfig.fromMap(effective);
      passphrase = ConfigCliUtils.resolvePassphrase(effective, env);
      format = effective.getOrDefault("format", "png").trim().toLowerCase(Locale.ROOT);
      if (!format.equals("png") && !format.equals("base64")) {
        throw new IllegalArgumentException("format must be png or base64 (was " + format + ")");
      }
      outRaw = effective.get("out");
      if (outRaw == null || outRaw.isBlank()) {
        throw new IllegalArgumentException("out is required");
      }
      if (STDOUT_TARGET.equals(outRaw.trim()) && !format.equals("base64")) {
        throw new IllegalArgumentException("out=- requires format=base64");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid encode arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path out = null;
    String text;
    try {
      if (!STDOUT_TARGET.equals(outRaw.trim())) {
        out = Paths.requireWritableFile("out", Path.of(outRaw.trim()), allowOverwrite, !dryRun);
      }
      text = readText(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid encode input: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read encode input", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(
        config, CompositionRoot.metricsFor(exporter), new SystemClockAdapter(), MessageId::random)) {
      EncodeUseCase useCase = root.encodeUseCase();
      if (dryRun) {
        printDryRunPlan(useCase.plan(text, config.chunkSize(), passphrase), config, out, format, passphrase);
        return ExitCode.SUCCESS;
      }
      log.info("Encoding {} characters (chunkSize={}, level={}, labels={}, passphrase={})",
          text.length(), config.chunkSize(), config.errorCorrection(), config.labels(), Logs.redact(passphrase));
      byte[] png = useCase.encode(text, config.chunkSize(), passphrase);
      if (out == null) {
        CliPrinter.println(Base64.getEncoder().encodeToString(png));
        return ExitCode.SUCCESS;
      }
      if (format.equals("base64")) {
        Files.writeString(out, Base64.getEncoder().encodeToString(png), StandardCharsets.US_ASCII);
      } else {
        Files.write(out, png);
      }
      CliPrinter.println("Wrote " + format + " mosaic to " + out + " (" + png.length + " PNG bytes)");
      return ExitCode.SUCCESS;
    } catch (ValidationException ex) {
      log.error("Encode rejected: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (ImageException ex) {
      log.error("Unable to produce mosaic image", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Unable to write mosaic to {}", out, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Encode configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in encode", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String readText(Map<String, String> effective) throws IOException {
    String text = effective.get("text");
    if (text != null && !text.isEmpty()) {
      return text;
    }
    String in = effective.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("text or in is required");
    }
    Path file = Paths.requireReadableFile("in", Path.of(in.trim()));
    return Files.readString(file, StandardCharsets.UTF_8);
  }

  private static void printDryRunPlan(
      List<Frame> frames, MosaicConfig config, Path out, String format, String passphrase) {
    TileLayoutEngine.GridShape grid = TileLayoutEngine.GridShape.forCount(frames.size());
    CliPrinter.printLines(
        "Encode dry-run: no files will be produced.",
        " Message id        : " + frames.get(0).messageId(),
        " Frames            : " + frames.size(),
        " Grid              : " + grid.columns() + " x " + grid.rows(),
        " Chunk size        : " + config.chunkSize(),
        " Error correction  : " + config.errorCorrection(),
        " Labels            : " + config.labels(),
        " Encrypted         : " + (passphrase != null),
        " Output            : " + (out == null ? "<stdout>" : out) + " (" + format + ")",
        " Re-run without --dry-run to write the mosaic.");
  }
}
