package ca.gc.cra.mosaic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
  }

  @Test
  void consumesTelemetryKeysAndSetsProperties() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP", "otelEndpoint", "http://collector:4317", "chunkSize", "5"));

    String exporter = TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", exporter);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertFalse(args.containsKey("metricsExporter"));
    assertEquals(Map.of("chunkSize", "5"), args);
  }

  @Test
  void defaultsToNone() {
    assertEquals("none", TelemetryConfigurator.configureMetrics(new HashMap<>()));
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://host"))));
  }
}
