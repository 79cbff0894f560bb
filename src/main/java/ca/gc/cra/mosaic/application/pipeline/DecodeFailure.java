package ca.gc.cra.mosaic.application.pipeline;

import ca.gc.cra.mosaic.domain.error.ErrorKind;
import ca.gc.cra.mosaic.domain.error.MissingChunksException;
import ca.gc.cra.mosaic.domain.error.MosaicException;
import java.util.List;
import java.util.Objects;

/**
 * Why a decode produced no text.
 *
 * @param kind taxonomy entry
 * @param message user-facing message; never a raw library message
 * @param missingIndices absent fragment indices, sorted; empty unless {@code kind} is
 *     {@link ErrorKind#MISSING_CHUNKS}
 * @since 0.1.0
 */
public record DecodeFailure(ErrorKind kind, String message, List<Integer> missingIndices) {
  public DecodeFailure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    missingIndices = missingIndices == null ? List.of() : List.copyOf(missingIndices);
  }

  /**
   * Maps a domain exception to a failure.
   *
   * @param ex domain exception; must not be {@code null}
   * @return failure carrying the exception's kind and message
   */
  public static DecodeFailure from(MosaicException ex) {
    List<Integer> missing = ex instanceof MissingChunksException m ? m.missingIndices() : List.of();
    return new DecodeFailure(ex.kind(), ex.getMessage(), missing);
  }
}
