package ca.gc.cra.mosaic.domain.error;

import java.util.Locale;

/**
 * <strong>What:</strong> Failure categories surfaced by MOSAIC encode and decode calls.
 * <p><strong>Why:</strong> Callers branch on a closed set of causes instead of parsing library messages.</p>
 * <p><strong>Role:</strong> Domain enum carried by {@link MosaicException} and decode results.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 * <p><strong>Observability:</strong> {@link #metricSuffix()} names the {@code decode.failure.*} counters.</p>
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Bad caller input: empty text, non-positive chunk size, missing file, oversized chunk. */
  VALIDATION,
  /** Input bytes are not a decodable raster image. */
  IMAGE,
  /** No symbols were found, or none parsed as a frame. */
  SCAN,
  /** The selected message is missing one or more fragment indices. */
  MISSING_CHUNKS,
  /** Authenticated decryption failed: wrong passphrase or corrupted token. */
  DECRYPTION,
  /** Checksum mismatch after successful decryption. */
  INTEGRITY;

  /**
   * Returns the lowercase token used in metric names and JSON reports.
   *
   * @return lowercase, underscore separated name (e.g., {@code missing_chunks})
   */
  public String metricSuffix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
