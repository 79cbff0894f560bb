package ca.gc.cra.mosaic.domain.error;

import java.util.Objects;

/**
 * Thrown when the checksum stored in an envelope disagrees with its text.
 *
 * <p>The stored hash is untrusted; it is kept only so callers can display it for diagnostics.</p>
 *
 * @since 0.1.0
 */
public final class IntegrityException extends MosaicException {
  private static final long serialVersionUID = 1L;

  private final String storedHash;

  /**
   * Creates the exception for a mismatched envelope.
   *
   * @param storedHash hash value read from the envelope; must not be {@code null}
   */
  public IntegrityException(String storedHash) {
    super(ErrorKind.INTEGRITY, "Integrity check failed (SHA-256 mismatch)");
    this.storedHash = Objects.requireNonNull(storedHash, "storedHash");
  }

  /**
   * Returns the hash recovered from the envelope.
   *
   * @return stored (untrusted) hash
   */
  public String storedHash() {
    return storedHash;
  }
}
