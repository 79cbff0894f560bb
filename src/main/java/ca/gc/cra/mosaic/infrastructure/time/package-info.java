/**
 * Clock adapters implementing {@link ca.gc.cra.mosaic.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Thread-safe.</p>
 */
package ca.gc.cra.mosaic.infrastructure.time;
