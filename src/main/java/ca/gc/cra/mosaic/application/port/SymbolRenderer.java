package ca.gc.cra.mosaic.application.port;

import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.ErrorCorrection;
import java.awt.image.BufferedImage;

/**
 * <strong>What:</strong> Port that turns one frame string into a scannable QR symbol image.
 * <p><strong>Why:</strong> Keeps the tile layout independent of the barcode library.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code ZxingSymbolRenderer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode the full string (UTF-8) at the requested error-correction level.</li>
 *   <li>Include a quiet zone so neighbouring tiles do not disturb detection.</li>
 *   <li>Produce symbols that round-trip through {@link SymbolScanner}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless.</p>
 *
 * @since 0.1.0
 */
public interface SymbolRenderer {
  /**
   * Renders one symbol.
   *
   * @param content frame string to encode; must not be {@code null}
   * @param level error-correction level
   * @return freshly allocated RGB image owned by the caller
   * @throws ValidationException if the content does not fit a single symbol at {@code level}
   */
  BufferedImage render(String content, ErrorCorrection level) throws ValidationException;
}
