package ca.gc.cra.mosaic.infrastructure.qr;

import ca.gc.cra.mosaic.application.port.SymbolScanner;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.ReaderException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.GenericMultipleBarcodeReader;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;
import com.google.zxing.qrcode.QRCodeReader;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SymbolScanner} that finds every QR symbol in a raster with ZXing.
 * <p><strong>Why:</strong> A single ZXing strategy can miss symbols in a dense mosaic, so three are combined.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run {@link QRCodeMultiReader} over the whole image.</li>
 *   <li>Run {@link GenericMultipleBarcodeReader}, which re-scans the regions around each hit.</li>
 *   <li>Sweep regular grids of windows, which matches mosaics whose cells are equally sized.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Readers are created per call; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> The grid sweep decodes up to {@code 2 * maxGrid^2} windows; keep
 * {@code maxGrid} small for large photographs.</p>
 *
 * @implNote Results are de-duplicated and keep first-seen order, so the whole-image pass decides which
 * message id the reassembler sees first.
 * @since 0.1.0
 */
public final class ZxingSymbolScanner implements SymbolScanner {
  private static final Logger log = LoggerFactory.getLogger(ZxingSymbolScanner.class);

  /** Default largest column count tried by the grid sweep. */
  public static final int DEFAULT_MAX_GRID = 8;
  private static final int MIN_WINDOW_PX = 21;

  private final int maxGrid;

  /** Creates a scanner sweeping grids up to {@value #DEFAULT_MAX_GRID} columns. */
  public ZxingSymbolScanner() {
    this(DEFAULT_MAX_GRID);
  }

  /**
   * Creates a scanner.
   *
   * @param maxGrid largest column count for the grid sweep; {@code 0} or {@code 1} disables the sweep
   */
  public ZxingSymbolScanner(int maxGrid) {
    if (maxGrid < 0) {
      throw new IllegalArgumentException("maxGrid must not be negative");
    }
    this.maxGrid = maxGrid;
  }

  @Override
  public List<String> scan(BufferedImage image) {
    Objects.requireNonNull(image, "image");
    Map<DecodeHintType, Object> hints = hints();
    Set<String> found = new LinkedHashSet<>();

    BinaryBitmap whole = bitmap(image);
    try {
      collect(new QRCodeMultiReader().decodeMultiple(whole, hints), found);
    } catch (NotFoundException ex) {
      log.debug("Multi-QR pass found no symbols");
    }
    try {
      collect(new GenericMultipleBarcodeReader(new QRCodeReader()).decodeMultiple(whole, hints), found);
    } catch (NotFoundException ex) {
      log.debug("Generic multi-barcode pass found no symbols");
    }
    int beforeSweep = found.size();
    sweep(image, hints, found);
    log.debug("Scanned {}x{} image: {} symbol(s), {} from grid sweep",
        image.getWidth(), image.getHeight(), found.size(), found.size() - beforeSweep);
    return new ArrayList<>(found);
  }

  private void sweep(BufferedImage image, Map<DecodeHintType, Object> hints, Set<String> found) {
    QRCodeReader reader = new QRCodeReader();
    int misses = 0;
    for (int cols = 2; cols <= maxGrid; cols++) {
      for (int rows = cols - 1; rows <= cols; rows++) {
        int cellWidth = image.getWidth() / cols;
        int cellHeight = image.getHeight() / rows;
        if (cellWidth < MIN_WINDOW_PX || cellHeight < MIN_WINDOW_PX) {
          log.trace("Grid sweep stopped at {}x{}; {} window(s) held no symbol", cols, rows, misses);
          return;
        }
        for (int r = 0; r < rows; r++) {
          for (int c = 0; c < cols; c++) {
            BufferedImage window = image.getSubimage(c * cellWidth, r * cellHeight, cellWidth, cellHeight);
            try {
              found.add(reader.decode(bitmap(window), hints).getText());
            } catch (ReaderException ex) {
              misses++;
            } finally {
              reader.reset();
            }
          }
        }
      }
    }
    log.trace("Grid sweep finished; {} window(s) held no symbol", misses);
  }

  private static void collect(Result[] results, Set<String> found) {
    for (Result result : results) {
      if (result.getBarcodeFormat() == BarcodeFormat.QR_CODE && result.getText() != null) {
        found.add(result.getText());
      }
    }
  }

  private static BinaryBitmap bitmap(BufferedImage image) {
    LuminanceSource source = new BufferedImageLuminanceSource(image);
    return new BinaryBitmap(new HybridBinarizer(source));
  }

  private static Map<DecodeHintType, Object> hints() {
    Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
    hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
    hints.put(DecodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
    hints.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE));
    return hints;
  }
}
