package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;

/**
 * <strong>What:</strong> One fragment of a message together with its message context.
 * <p><strong>Role:</strong> Domain value object rendered as exactly one QR symbol.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param messageId identifier shared by all frames of the message
 * @param index zero-based fragment position, {@code 0 <= index < total}
 * @param total number of fragments in the message, between one and {@link #MAX_TOTAL}
 * @param text raw fragment content; may itself contain {@link #SEPARATOR}
 * @since 0.1.0
 */
public record Frame(MessageId messageId, int index, int total, String text) {
  /** Field separator of the frame wire format. */
  public static final char SEPARATOR = '|';

  /** Largest fragment count a message may declare. */
  public static final int MAX_TOTAL = 65_536;

  /**
   * Enforces fragment invariants.
   *
   * @throws IllegalArgumentException if {@code total} is outside {@code [1, MAX_TOTAL]} or {@code index} is
   *     outside {@code [0, total)}
   */
  public Frame {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(text, "text");
    if (total < 1 || total > MAX_TOTAL) {
      throw new IllegalArgumentException(
          "total must be between 1 and " + MAX_TOTAL + " (was " + total + ")");
    }
    if (index < 0 || index >= total) {
      throw new IllegalArgumentException(
          "index must be between 0 and " + (total - 1) + " (was " + index + ")");
    }
  }

  /**
   * Returns the human-readable label printed beneath the symbol.
   *
   * @return one-based position such as {@code "2/5"}
   */
  public String label() {
    return (index + 1) + "/" + total;
  }

  /**
   * Returns the fragment this frame carries.
   *
   * @return index and text without message context
   */
  public Fragment fragment() {
    return new Fragment(index, text);
  }
}
