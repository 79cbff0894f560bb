/**
 * Image adapters: symbol captions, grid tiling and PNG I/O.
 * <p><strong>Role:</strong> Adapter layer on the driven side of the encode and decode pipelines.</p>
 * <p><strong>Concurrency:</strong> Stateless; image buffers are scoped to one call.</p>
 * <p><strong>Performance:</strong> Memory grows with tile count and symbol size; no streaming.</p>
 */
package ca.gc.cra.mosaic.infrastructure.image;
