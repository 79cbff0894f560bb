package ca.gc.cra.mosaic.application.port;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * <strong>What:</strong> Port that finds and decodes every QR symbol in a raster image.
 * <p><strong>Role:</strong> Domain port implemented by {@code ZxingSymbolScanner}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless.</p>
 *
 * @implNote Order and multiplicity of the returned strings are unspecified; the same symbol may be
 * reported more than once.
 * @since 0.1.0
 */
public interface SymbolScanner {
  /**
   * Decodes all symbols found in {@code image}.
   *
   * @param image raster to scan; must not be {@code null}
   * @return decoded symbol contents; empty when nothing was found, never {@code null}
   */
  List<String> scan(BufferedImage image);
}
