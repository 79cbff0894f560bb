package ca.gc.cra.mosaic.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene helpers for user text and passphrases.
 * <p><strong>Why:</strong> Message text can be large or private and passphrases must never reach a log.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 previews to a byte budget without splitting a code point.</li>
 *   <li>Provide one redaction placeholder for secrets.</li>
 *   <li>Name the MDC key that carries the message id during encode and decode.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** MDC key holding the 8-hex message id of the encode or decode in progress. */
  public static final String MDC_MESSAGE_ID = "mosaic.msgId";
  /** Default byte budget for text previews. */
  public static final int PREVIEW_BYTES = 64;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String ABSENT_PLACEHOLDER = "<none>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the original value when it fits, otherwise a shortened copy with a {@code (truncated, X of Y)} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Shorthand for {@link #truncate(String, int)} with {@link #PREVIEW_BYTES}.
   *
   * @param value text to preview
   * @return log-safe preview
   */
  public static String preview(String value) {
    return truncate(value, PREVIEW_BYTES);
  }

  /**
   * Returns a placeholder describing a secret without revealing it.
   *
   * @param secret secret value; only its presence is reflected
   * @return {@code "[REDACTED]"} when present, {@code "<none>"} when absent or blank
   */
  public static String redact(String secret) {
    return secret == null || secret.isBlank() ? ABSENT_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
