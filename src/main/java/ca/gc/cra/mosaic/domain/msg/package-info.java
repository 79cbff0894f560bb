/**
 * Domain value types for messages, frames and checksum envelopes.
 * <p><strong>Role:</strong> Domain layer shared by the encode and decode pipelines.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Frames and envelopes carry user text; log them only through
 * {@link ca.gc.cra.mosaic.logging.Logs#truncate(String, int)}.</p>
 */
package ca.gc.cra.mosaic.domain.msg;
