package ca.gc.cra.mosaic.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@code key=value} options per CLI command, the lowest layer of the configuration merge.
 *
 * @since 0.1.0
 * @see ConfigMerger
 */
public final class DefaultsForMode {
  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command.
   *
   * @param mode {@code encode} or {@code decode}, case-insensitive
   * @return immutable flat map of defaults
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    MosaicConfig defaults = MosaicConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "encode" -> {
        map.put("chunkSize", Integer.toString(defaults.chunkSize()));
        map.put("errorCorrection", defaults.errorCorrection().name());
        map.put("moduleSize", Integer.toString(defaults.moduleSize()));
        map.put("quietZone", Integer.toString(defaults.quietZone()));
        map.put("labels", Boolean.toString(defaults.labels()));
        map.put("labelMinHeight", Integer.toString(defaults.labelMinHeight()));
        map.put("format", "png");
      }
      case "decode" -> {
        map.put("tokenTtlSeconds", Long.toString(defaults.tokenTtlSeconds()));
        map.put("scanMaxGrid", Integer.toString(defaults.scanMaxGrid()));
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(map);
  }
}
