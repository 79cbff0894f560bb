package ca.gc.cra.mosaic.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code metricsExporter} and {@code otelEndpoint} options as OpenTelemetry system properties.
 *
 * @since 0.1.0
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Consumes the telemetry options from {@code args} and publishes them as system properties.
   *
   * @param args mutable option map; telemetry keys are removed
   * @return normalized exporter, {@code otlp} or {@code none}
   * @throws IllegalArgumentException if the exporter is unknown or the endpoint is not an http(s) URI
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = "none";
    String rawExporter = args.remove("metricsExporter");
    if (rawExporter != null && !rawExporter.isBlank()) {
      exporter = rawExporter.trim().toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    }
    System.setProperty("otel.metrics.exporter", exporter);
    log.debug("Metrics exporter: {}", exporter);

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
      log.debug("OTLP endpoint: {}", trimmed);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }
}
