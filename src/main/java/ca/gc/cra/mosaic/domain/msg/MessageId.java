package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * <strong>What:</strong> Short random identifier shared by every frame of one encoded message.
 * <p><strong>Why:</strong> Lets reassembly pick one message when foreign frames share the same image.</p>
 * <p><strong>Role:</strong> Domain value object created once per encode call.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #random()} draws from {@link ThreadLocalRandom} so
 * concurrent encode calls share no generator state.</p>
 *
 * @param value identifier text; must not be {@code null} and must not contain the frame separator
 * @since 0.1.0
 */
public record MessageId(String value) {
  private static final char[] HEX = "0123456789abcdef".toCharArray();
  private static final int RANDOM_LENGTH = 8;

  /**
   * Validates the identifier.
   *
   * @throws IllegalArgumentException if the value contains the frame separator
   */
  public MessageId {
    Objects.requireNonNull(value, "value");
    if (value.indexOf(Frame.SEPARATOR) >= 0) {
      throw new IllegalArgumentException("message id must not contain '" + Frame.SEPARATOR + "'");
    }
  }

  /**
   * Generates a fresh eight character lowercase hex identifier.
   *
   * @return new message id
   * @implNote Not cryptographic; a collision only risks cross-talk inside a single scanned image.
   */
  public static MessageId random() {
    long bits = ThreadLocalRandom.current().nextLong();
    char[] out = new char[RANDOM_LENGTH];
    for (int i = RANDOM_LENGTH - 1; i >= 0; i--) {
      out[i] = HEX[(int) (bits & 0xF)];
      bits >>>= 4;
    }
    return new MessageId(new String(out));
  }

  @Override
  public String toString() {
    return value;
  }
}
