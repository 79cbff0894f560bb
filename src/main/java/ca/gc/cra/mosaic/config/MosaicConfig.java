package ca.gc.cra.mosaic.config;

import ca.gc.cra.mosaic.domain.msg.ErrorCorrection;
import ca.gc.cra.mosaic.validation.Numbers;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated codec and rendering knobs shared by the encode and decode commands.
 * <p><strong>Why:</strong> Gives the composition root one immutable object instead of loose strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param chunkSize maximum code points per fragment
 * @param errorCorrection QR error-correction level
 * @param moduleSize pixels per QR module
 * @param quietZone blank border around each symbol, in modules
 * @param labels whether symbols are captioned with {@code index+1/total}
 * @param labelMinHeight minimum caption strip height in pixels
 * @param tokenTtlSeconds maximum age of an encryption token on decode; {@code 0} disables the check
 * @param scanMaxGrid largest column count the scanner's grid sweep tries
 * @since 0.1.0
 */
public record MosaicConfig(
    int chunkSize,
    ErrorCorrection errorCorrection,
    int moduleSize,
    int quietZone,
    boolean labels,
    int labelMinHeight,
    long tokenTtlSeconds,
    int scanMaxGrid) {

  static final int MAX_CHUNK_SIZE = 4_296;
  static final int MAX_MODULE_SIZE = 64;
  static final int MAX_QUIET_ZONE = 32;
  static final int MAX_LABEL_MIN_HEIGHT = 512;
  static final int MAX_SCAN_GRID = 16;

  public MosaicConfig {
    Numbers.requireRange("chunkSize", chunkSize, 1, MAX_CHUNK_SIZE);
    errorCorrection = Objects.requireNonNullElse(errorCorrection, ErrorCorrection.Q);
    Numbers.requireRange("moduleSize", moduleSize, 1, MAX_MODULE_SIZE);
    Numbers.requireRange("quietZone", quietZone, 0, MAX_QUIET_ZONE);
    Numbers.requireRange("labelMinHeight", labelMinHeight, 1, MAX_LABEL_MIN_HEIGHT);
    if (tokenTtlSeconds < 0) {
      throw new IllegalArgumentException("tokenTtlSeconds must not be negative (was " + tokenTtlSeconds + ")");
    }
    Numbers.requireRange("scanMaxGrid", scanMaxGrid, 0, MAX_SCAN_GRID);
  }

  /**
   * Returns the built-in defaults: 500-character chunks, level Q, 10 px modules, 4-module quiet zone,
   * labels on, no token expiry.
   *
   * @return default configuration
   */
  public static MosaicConfig defaults() {
    return new MosaicConfig(500, ErrorCorrection.Q, 10, 4, true, 24, 0L, 8);
  }

  /**
   * Builds a configuration from flattened {@code key=value} options; unknown keys are ignored.
   *
   * @param options merged CLI, YAML and default options; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if any recognised option is malformed or out of range
   */
  public static MosaicConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    MosaicConfig defaults = defaults();
    return new MosaicConfig(
        intOption(options, "chunkSize", defaults.chunkSize(), 1, MAX_CHUNK_SIZE),
        ErrorCorrection.parse(options.get("errorCorrection"), defaults.errorCorrection()),
        intOption(options, "moduleSize", defaults.moduleSize(), 1, MAX_MODULE_SIZE),
        intOption(options, "quietZone", defaults.quietZone(), 0, MAX_QUIET_ZONE),
        booleanOption(options, "labels", defaults.labels()),
        intOption(options, "labelMinHeight", defaults.labelMinHeight(), 1, MAX_LABEL_MIN_HEIGHT),
        intOption(options, "tokenTtlSeconds", (int) defaults.tokenTtlSeconds(), 0, Integer.MAX_VALUE),
        intOption(options, "scanMaxGrid", defaults.scanMaxGrid(), 0, MAX_SCAN_GRID));
  }

  private static int intOption(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseInt(key, raw, min, max);
  }

  private static boolean booleanOption(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw.trim() + ")");
    };
  }
}
