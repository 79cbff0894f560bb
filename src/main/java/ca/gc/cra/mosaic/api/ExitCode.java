package ca.gc.cra.mosaic.api;

/**
 * Process exit codes returned by the MOSAIC commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments, configuration values or input text were rejected. */
  INVALID_ARGS(2),
  /** A file could not be read or written. */
  IO_ERROR(3),
  /** The configuration file could not be applied. */
  CONFIG_ERROR(4),
  /** Unexpected failure, including image encoding errors. */
  RUNTIME_FAILURE(5),
  /** No text could be recovered from the image. */
  DECODE_FAILURE(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric process exit status */
  public int code() {
    return code;
  }
}
