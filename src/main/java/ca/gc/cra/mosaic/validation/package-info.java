/**
 * <strong>Purpose:</strong> Input guards shared by the configuration and CLI layers.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException}s that the CLI maps
 * to exit code 2.
 *
 * @since 0.1.0
 */
package ca.gc.cra.mosaic.validation;
