package ca.gc.cra.mosaic.application.codec;

import ca.gc.cra.mosaic.domain.msg.Frame;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Serializes frames as {@code id|index|total|text} and parses them back.
 * <p><strong>Why:</strong> One self-describing string per QR symbol lets reassembly ignore tile order.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @implNote Parsing cuts at the first three separators only; the text field keeps any separators verbatim.
 * @since 0.1.0
 */
public final class FrameCodec {
  private static final int MAX_COUNT_DIGITS = 9;

  private FrameCodec() {}

  /**
   * Serializes a frame.
   *
   * @param frame frame to serialize; must not be {@code null}
   * @return wire string for one symbol
   */
  public static String encode(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    return new StringBuilder(frame.text().length() + 24)
        .append(frame.messageId().value())
        .append(Frame.SEPARATOR)
        .append(frame.index())
        .append(Frame.SEPARATOR)
        .append(frame.total())
        .append(Frame.SEPARATOR)
        .append(frame.text())
        .toString();
  }

  /**
   * Attempts to parse a scanned string as a frame.
   *
   * @param raw scanned symbol content; {@code null} yields {@link Optional#empty()}
   * @return parsed frame, or empty when the string has fewer than four fields, non-numeric counts, or
   *     counts that violate {@code 0 <= index < total <= Frame.MAX_TOTAL}
   */
  public static Optional<Frame> decode(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    int first = raw.indexOf(Frame.SEPARATOR);
    if (first < 0) {
      return Optional.empty();
    }
    int second = raw.indexOf(Frame.SEPARATOR, first + 1);
    if (second < 0) {
      return Optional.empty();
    }
    int third = raw.indexOf(Frame.SEPARATOR, second + 1);
    if (third < 0) {
      return Optional.empty();
    }
    int index = parseCount(raw, first + 1, second);
    int total = parseCount(raw, second + 1, third);
    if (index < 0 || total < 1 || total > Frame.MAX_TOTAL || index >= total) {
      return Optional.empty();
    }
    MessageId id = new MessageId(raw.substring(0, first));
    return Optional.of(new Frame(id, index, total, raw.substring(third + 1)));
  }

  private static int parseCount(String raw, int start, int end) {
    int length = end - start;
    if (length == 0 || length > MAX_COUNT_DIGITS) {
      return -1;
    }
    int value = 0;
    for (int i = start; i < end; i++) {
      char c = raw.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
      value = value * 10 + (c - '0');
    }
    return value;
  }
}
