package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;

/**
 * One contiguous slice of a message payload.
 *
 * @param index zero-based position within the message
 * @param text slice content; may contain the frame separator
 * @since 0.1.0
 */
public record Fragment(int index, String text) {
  public Fragment {
    Objects.requireNonNull(text, "text");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative (was " + index + ")");
    }
  }

  /**
   * Binds this fragment to its message.
   *
   * @param messageId owning message; must not be {@code null}
   * @param total fragment count of the message
   * @return frame carrying this fragment
   * @throws IllegalArgumentException if {@code index >= total}
   */
  public Frame inMessage(MessageId messageId, int total) {
    return new Frame(messageId, index, total, text);
  }
}
