package ca.gc.cra.mosaic.domain.error;

/**
 * Thrown when a raster yields no symbols or no symbol parses as a frame.
 *
 * @since 0.1.0
 */
public final class ScanException extends MosaicException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a caller-facing message.
   *
   * @param message human-readable error
   */
  public ScanException(String message) {
    super(ErrorKind.SCAN, message);
  }

  /**
   * Creates the exception with a caller-facing message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, logged but never surfaced to callers
   */
  public ScanException(String message, Throwable cause) {
    super(ErrorKind.SCAN, message, cause);
  }
}
