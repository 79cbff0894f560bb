/**
 * Ports through which the MOSAIC core reaches the symbol renderer, the scanner, time and metrics.
 * <p><strong>Role:</strong> Domain ports; adapters live under {@code ca.gc.cra.mosaic.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Implementations must be stateless or thread-safe; calls arrive from
 * independent encode/decode invocations.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.mosaic.application.port.MetricsPort} defines the
 * {@code encode.*} and {@code decode.*} names.</p>
 */
package ca.gc.cra.mosaic.application.port;
