/**
 * Error taxonomy shared by the encode and decode paths.
 * <p><strong>Role:</strong> Domain layer; checked exceptions each bound to one {@link ca.gc.cra.mosaic.domain.error.ErrorKind}.</p>
 * <p><strong>Security:</strong> Messages are caller-facing and never include passphrases or payload text.</p>
 */
package ca.gc.cra.mosaic.domain.error;
