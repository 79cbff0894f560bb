package ca.gc.cra.mosaic.infrastructure.image;

import ca.gc.cra.mosaic.domain.error.ImageException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import javax.imageio.ImageIO;

/**
 * PNG encoding and raster decoding helpers.
 *
 * @since 0.1.0
 */
public final class PngImages {
  private PngImages() {}

  /**
   * Encodes an image as PNG.
   *
   * @param image image to encode; must not be {@code null}
   * @return PNG bytes
   * @throws ImageException if no PNG writer accepts the image
   */
  public static byte[] write(BufferedImage image) throws ImageException {
    Objects.requireNonNull(image, "image");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      if (!ImageIO.write(image, "png", out)) {
        throw new ImageException("No PNG writer available for image type " + image.getType());
      }
    } catch (IOException ex) {
      throw new ImageException("Unable to encode PNG", ex);
    }
    return out.toByteArray();
  }

  /**
   * Decodes raster bytes in any format supported by {@link ImageIO}.
   *
   * @param bytes image bytes; must not be {@code null}
   * @return decoded image
   * @throws ImageException if the bytes are empty, unsupported or corrupt
   */
  public static BufferedImage read(byte[] bytes) throws ImageException {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length == 0) {
      throw new ImageException("Invalid image: no data");
    }
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(bytes));
    } catch (IOException | RuntimeException ex) {
      throw new ImageException("Invalid image: unreadable raster data", ex);
    }
    if (image == null) {
      throw new ImageException("Invalid image: unsupported format");
    }
    return image;
  }
}
