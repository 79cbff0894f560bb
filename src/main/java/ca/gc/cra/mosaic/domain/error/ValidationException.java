package ca.gc.cra.mosaic.domain.error;

/**
 * Thrown when caller input is rejected before any image work starts.
 *
 * @since 0.1.0
 */
public final class ValidationException extends MosaicException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a caller-facing message.
   *
   * @param message human-readable error
   */
  public ValidationException(String message) {
    super(ErrorKind.VALIDATION, message);
  }

  /**
   * Creates the exception with a caller-facing message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, logged but never surfaced to callers
   */
  public ValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION, message, cause);
  }
}
