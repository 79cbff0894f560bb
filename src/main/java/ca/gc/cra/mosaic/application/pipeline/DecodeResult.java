package ca.gc.cra.mosaic.application.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one decode call.
 *
 * <p>Exactly one of {@code text} and {@code failure} is present. {@code sha256} accompanies recovered text
 * when the payload carried a checksum envelope, and accompanies an integrity failure as the untrusted
 * stored hash.</p>
 *
 * @param text recovered text, or {@code null} on failure
 * @param sha256 envelope hash, or {@code null} when none was recoverable
 * @param failure failure details, or {@code null} on success
 * @since 0.1.0
 */
public record DecodeResult(String text, String sha256, DecodeFailure failure) {
  public DecodeResult {
    if ((text == null) == (failure == null)) {
      throw new IllegalArgumentException("exactly one of text and failure must be present");
    }
  }

  /**
   * Creates a successful result.
   *
   * @param text recovered text; must not be {@code null}
   * @param sha256 verified hash, or {@code null} for legacy payloads
   * @return success result
   */
  public static DecodeResult success(String text, String sha256) {
    return new DecodeResult(Objects.requireNonNull(text, "text"), sha256, null);
  }

  /**
   * Creates a failed result.
   *
   * @param failure failure details; must not be {@code null}
   * @param storedHash untrusted stored hash, or {@code null}
   * @return failure result
   */
  public static DecodeResult failed(DecodeFailure failure, String storedHash) {
    return new DecodeResult(null, storedHash, Objects.requireNonNull(failure, "failure"));
  }

  /** @return {@code true} when text was recovered */
  public boolean succeeded() {
    return failure == null;
  }

  /** @return recovered text if present */
  public Optional<String> textValue() {
    return Optional.ofNullable(text);
  }

  /** @return envelope hash if present */
  public Optional<String> hashValue() {
    return Optional.ofNullable(sha256);
  }
}
