package ca.gc.cra.mosaic.config;

import ca.gc.cra.mosaic.application.codec.ChecksumEnvelope;
import ca.gc.cra.mosaic.application.codec.PassphraseCipher;
import ca.gc.cra.mosaic.application.codec.Reassembler;
import ca.gc.cra.mosaic.application.pipeline.DecodeUseCase;
import ca.gc.cra.mosaic.application.pipeline.EncodeUseCase;
import ca.gc.cra.mosaic.application.port.ClockPort;
import ca.gc.cra.mosaic.application.port.MetricsPort;
import ca.gc.cra.mosaic.application.port.SymbolRenderer;
import ca.gc.cra.mosaic.application.port.SymbolScanner;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import ca.gc.cra.mosaic.infrastructure.image.IndexLabelPainter;
import ca.gc.cra.mosaic.infrastructure.image.TileLayoutEngine;
import ca.gc.cra.mosaic.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.mosaic.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.mosaic.infrastructure.qr.ZxingSymbolRenderer;
import ca.gc.cra.mosaic.infrastructure.qr.ZxingSymbolScanner;
import ca.gc.cra.mosaic.infrastructure.time.SystemClockAdapter;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Wires the encode and decode use cases from a {@link MosaicConfig}.
 * <p><strong>Role:</strong> The only place that picks concrete adapters for the application ports.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; each factory call returns a new graph.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts down an OpenTelemetry metrics adapter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MosaicConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Supplier<MessageId> messageIds;

  /**
   * Creates a root with no-op metrics and the system clock.
   *
   * @param config validated configuration
   */
  public CompositionRoot(MosaicConfig config) {
    this(config, new NoOpMetricsAdapter(), new SystemClockAdapter(), MessageId::random);
  }

  /**
   * Creates a root with explicit infrastructure.
   *
   * @param config validated configuration; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock used for token timestamps; must not be {@code null}
   * @param messageIds message id source; must not be {@code null}
   */
  public CompositionRoot(
      MosaicConfig config, MetricsPort metrics, ClockPort clock, Supplier<MessageId> messageIds) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.messageIds = Objects.requireNonNull(messageIds, "messageIds");
  }

  /**
   * Selects the metrics adapter for an exporter name.
   *
   * @param exporter {@code otlp} or {@code none}; {@code null} means {@code none}
   * @return OpenTelemetry adapter for {@code otlp}, otherwise a no-op adapter
   */
  public static MetricsPort metricsFor(String exporter) {
    if (exporter != null && "otlp".equals(exporter.trim().toLowerCase(Locale.ROOT))) {
      return new OpenTelemetryMetricsAdapter();
    }
    return new NoOpMetricsAdapter();
  }

  /** @return the configuration this root was built from */
  public MosaicConfig config() {
    return config;
  }

  /** @return the metrics sink shared by all use cases */
  public MetricsPort metrics() {
    return metrics;
  }

  /** @return symbol renderer honouring module size and quiet zone */
  public SymbolRenderer symbolRenderer() {
    return new ZxingSymbolRenderer(config.moduleSize(), config.quietZone());
  }

  /** @return symbol scanner honouring the grid sweep limit */
  public SymbolScanner symbolScanner() {
    return new ZxingSymbolScanner(config.scanMaxGrid());
  }

  /** @return tile layout engine for the configured level and labels */
  public TileLayoutEngine tileLayoutEngine() {
    return new TileLayoutEngine(
        symbolRenderer(), new IndexLabelPainter(config.labelMinHeight()), config.errorCorrection(), config.labels());
  }

  /** @return passphrase cipher using the configured token age limit */
  public PassphraseCipher passphraseCipher() {
    return new PassphraseCipher(clock, new SecureRandom(), config.tokenTtlSeconds());
  }

  /** @return encode use case */
  public EncodeUseCase encodeUseCase() {
    return new EncodeUseCase(new ChecksumEnvelope(), passphraseCipher(), tileLayoutEngine(), metrics, messageIds);
  }

  /** @return decode use case */
  public DecodeUseCase decodeUseCase() {
    return new DecodeUseCase(
        symbolScanner(), new Reassembler(metrics), passphraseCipher(), new ChecksumEnvelope(), metrics);
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.flush();
      otel.close();
    }
  }
}
