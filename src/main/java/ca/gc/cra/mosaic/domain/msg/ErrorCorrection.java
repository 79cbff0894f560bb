package ca.gc.cra.mosaic.domain.msg;

import java.util.Locale;

/**
 * QR error-correction levels understood by the symbol renderer.
 *
 * @since 0.1.0
 */
public enum ErrorCorrection {
  /** About 7% of codewords recoverable. */
  L,
  /** About 15% of codewords recoverable. */
  M,
  /** About 25% of codewords recoverable; the MOSAIC default. */
  Q,
  /** About 30% of codewords recoverable. */
  H;

  /**
   * Parses a level name case-insensitively.
   *
   * @param raw level name such as {@code "q"}; blank values yield {@code defaultValue}
   * @param defaultValue fallback for blank input
   * @return parsed level
   * @throws IllegalArgumentException if {@code raw} names no level
   */
  public static ErrorCorrection parse(String raw, ErrorCorrection defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("errorCorrection must be one of L, M, Q, H (was " + raw + ")", ex);
    }
  }
}
