package ca.gc.cra.mosaic.application.codec;

import ca.gc.cra.mosaic.domain.error.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a payload into contiguous fragments of at most {@code chunkSize} characters.
 *
 * <p>Lengths count Unicode code points, so a fragment boundary never separates a surrogate pair. Stateless
 * and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Chunker {
  private Chunker() {}

  /**
   * Splits {@code payload} in order; only the final fragment may be shorter than {@code chunkSize}.
   *
   * @param payload text to split; must not be {@code null}
   * @param chunkSize maximum fragment length in code points
   * @return ordered fragments; empty when {@code payload} is empty
   * @throws ValidationException if {@code chunkSize} is not positive
   */
  public static List<String> split(String payload, int chunkSize) throws ValidationException {
    Objects.requireNonNull(payload, "payload");
    if (chunkSize <= 0) {
      throw new ValidationException("chunk_size must be positive (was " + chunkSize + ")");
    }
    int codePoints = payload.codePointCount(0, payload.length());
    List<String> fragments = new ArrayList<>((codePoints + chunkSize - 1) / chunkSize);
    int start = 0;
    int remaining = codePoints;
    while (remaining > 0) {
      int take = Math.min(chunkSize, remaining);
      int end = payload.offsetByCodePoints(start, take);
      fragments.add(payload.substring(start, end));
      start = end;
      remaining -= take;
    }
    return fragments;
  }
}
