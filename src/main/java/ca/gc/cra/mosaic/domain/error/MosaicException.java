package ca.gc.cra.mosaic.domain.error;

import java.util.Objects;

/**
 * Checked root of the MOSAIC error taxonomy.
 *
 * <p>Every subclass pins exactly one {@link ErrorKind}; the message is safe to show to callers and
 * never echoes passphrases or raw library diagnostics.</p>
 *
 * @since 0.1.0
 */
public abstract class MosaicException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /**
   * Creates an exception with a caller-facing message.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable description
   */
  protected MosaicException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception with a caller-facing message and the underlying cause.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable description
   * @param cause root cause kept for logs only
   */
  protected MosaicException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind; never {@code null}
   */
  public ErrorKind kind() {
    return kind;
  }
}
