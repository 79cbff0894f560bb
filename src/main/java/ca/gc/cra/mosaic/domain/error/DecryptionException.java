package ca.gc.cra.mosaic.domain.error;

/**
 * Thrown when an encryption token fails authentication or cannot be decrypted.
 *
 * @since 0.1.0
 */
public final class DecryptionException extends MosaicException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a caller-facing message.
   *
   * @param message human-readable error
   */
  public DecryptionException(String message) {
    super(ErrorKind.DECRYPTION, message);
  }

  /**
   * Creates the exception with a caller-facing message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, logged but never surfaced to callers
   */
  public DecryptionException(String message, Throwable cause) {
    super(ErrorKind.DECRYPTION, message, cause);
  }
}
