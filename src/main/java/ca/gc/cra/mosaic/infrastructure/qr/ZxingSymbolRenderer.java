package ca.gc.cra.mosaic.infrastructure.qr;

import ca.gc.cra.mosaic.application.port.SymbolRenderer;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.ErrorCorrection;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SymbolRenderer} backed by the ZXing QR encoder.
 * <p><strong>Why:</strong> ZXing picks the smallest QR version that fits the content at the requested
 * level; this adapter only controls pixel geometry.</p>
 * <p><strong>Role:</strong> Driven adapter for the encode pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @implNote Content is encoded in byte mode as UTF-8. Modules are painted directly from the
 * {@link ByteMatrix} so every module is exactly {@code moduleSize} pixels square.
 * @since 0.1.0
 */
public final class ZxingSymbolRenderer implements SymbolRenderer {
  private static final Logger log = LoggerFactory.getLogger(ZxingSymbolRenderer.class);

  /** Default pixels per module. */
  public static final int DEFAULT_MODULE_SIZE = 10;
  /** Default quiet zone in modules. */
  public static final int DEFAULT_QUIET_ZONE = 4;

  private static final int BLACK = 0x000000;
  private static final int WHITE = 0xFFFFFF;

  private final int moduleSize;
  private final int quietZone;

  /** Creates a renderer with a 10 px module and a 4-module quiet zone. */
  public ZxingSymbolRenderer() {
    this(DEFAULT_MODULE_SIZE, DEFAULT_QUIET_ZONE);
  }

  /**
   * Creates a renderer.
   *
   * @param moduleSize pixels per module; must be positive
   * @param quietZone blank border in modules; must not be negative
   */
  public ZxingSymbolRenderer(int moduleSize, int quietZone) {
    if (moduleSize <= 0) {
      throw new IllegalArgumentException("moduleSize must be positive");
    }
    if (quietZone < 0) {
      throw new IllegalArgumentException("quietZone must not be negative");
    }
    this.moduleSize = moduleSize;
    this.quietZone = quietZone;
  }

  @Override
  public BufferedImage render(String content, ErrorCorrection level) throws ValidationException {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(level, "level");
    Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
    hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
    QRCode code;
    try {
      code = Encoder.encode(content, ErrorCorrectionLevel.valueOf(level.name()), hints);
    } catch (WriterException ex) {
      log.debug("QR encoder rejected {} chars at level {}: {}", content.length(), level, ex.getMessage());
      throw new ValidationException("chunk_size too large for a single QR symbol", ex);
    }
    ByteMatrix matrix = code.getMatrix();
    int modules = matrix.getWidth() + 2 * quietZone;
    int side = modules * moduleSize;
    BufferedImage image = new BufferedImage(side, side, BufferedImage.TYPE_INT_RGB);
    for (int my = 0; my < modules; my++) {
      for (int mx = 0; mx < modules; mx++) {
        int x = mx - quietZone;
        int y = my - quietZone;
        boolean dark = x >= 0 && y >= 0 && x < matrix.getWidth() && y < matrix.getHeight()
            && matrix.get(x, y) == 1;
        fill(image, mx * moduleSize, my * moduleSize, dark ? BLACK : WHITE);
      }
    }
    return image;
  }

  private void fill(BufferedImage image, int x0, int y0, int rgb) {
    for (int y = y0; y < y0 + moduleSize; y++) {
      for (int x = x0; x < x0 + moduleSize; x++) {
        image.setRGB(x, y, rgb);
      }
    }
  }
}
