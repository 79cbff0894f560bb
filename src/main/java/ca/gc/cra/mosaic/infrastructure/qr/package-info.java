/**
 * QR symbol adapters built on ZXing.
 * <p><strong>Role:</strong> Implementations of the renderer and scanner ports.</p>
 * <p><strong>Concurrency:</strong> Stateless per call.</p>
 */
package ca.gc.cra.mosaic.infrastructure.qr;
