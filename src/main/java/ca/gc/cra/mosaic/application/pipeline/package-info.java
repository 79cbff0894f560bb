/**
 * Encode and decode use cases: the caller-facing codec surface.
 * <p><strong>Role:</strong> Application layer; composes the codec with the image and symbol adapters.</p>
 * <p><strong>Concurrency:</strong> Calls are independent; nothing outlives a call.</p>
 * <p><strong>Observability:</strong> {@code encode.*} and {@code decode.*} metrics, MDC {@code mosaic.msgId}.</p>
 */
package ca.gc.cra.mosaic.application.pipeline;
