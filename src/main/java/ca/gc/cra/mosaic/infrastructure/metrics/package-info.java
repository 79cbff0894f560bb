/**
 * Metrics adapters bridging {@link ca.gc.cra.mosaic.application.port.MetricsPort} to OpenTelemetry or to nothing.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code encode.*} and {@code decode.*} keys.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported, never message text.</p>
 */
package ca.gc.cra.mosaic.infrastructure.metrics;
