package ca.gc.cra.mosaic.domain.error;

import java.util.List;

/**
 * Thrown when reassembly finds gaps in the selected message.
 *
 * @since 0.1.0
 */
public final class MissingChunksException extends MosaicException {
  private static final long serialVersionUID = 1L;

  private final List<Integer> missingIndices;

  /**
   * Creates the exception for the given gaps.
   *
   * @param missingIndices absent fragment indices, sorted ascending; must not be empty
   */
  public MissingChunksException(List<Integer> missingIndices) {
    super(ErrorKind.MISSING_CHUNKS, "Missing QR chunks: " + missingIndices);
    if (missingIndices.isEmpty()) {
      throw new IllegalArgumentException("missingIndices must not be empty");
    }
    this.missingIndices = List.copyOf(missingIndices);
  }

  /**
   * Returns the absent fragment indices.
   *
   * @return immutable list sorted ascending
   */
  public List<Integer> missingIndices() {
    return missingIndices;
  }
}
