package ca.gc.cra.mosaic.domain.error;

/**
 * Thrown when bytes cannot be read or written as a raster image.
 *
 * @since 0.1.0
 */
public final class ImageException extends MosaicException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a caller-facing message.
   *
   * @param message human-readable error
   */
  public ImageException(String message) {
    super(ErrorKind.IMAGE, message);
  }

  /**
   * Creates the exception with a caller-facing message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, logged but never surfaced to callers
   */
  public ImageException(String message, Throwable cause) {
    super(ErrorKind.IMAGE, message, cause);
  }
}
