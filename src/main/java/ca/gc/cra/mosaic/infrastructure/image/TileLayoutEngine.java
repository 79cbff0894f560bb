package ca.gc.cra.mosaic.infrastructure.image;

import ca.gc.cra.mosaic.application.codec.FrameCodec;
import ca.gc.cra.mosaic.application.port.SymbolRenderer;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.ErrorCorrection;
import ca.gc.cra.mosaic.domain.msg.Frame;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Renders a message's frames and packs the symbols into one grid image.
 * <p><strong>Why:</strong> A single picture is easier to share and scan than a series of symbols.</p>
 * <p><strong>Role:</strong> Image-side adapter of the encode pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render each frame through the {@link SymbolRenderer} port.</li>
 *   <li>Optionally caption each symbol with its {@code index+1/total} label.</li>
 *   <li>Place tiles left-to-right, top-to-bottom on a {@code ceil(sqrt(n))} column grid.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe when the renderer is; images are call-scoped.</p>
 *
 * @implNote Tile position has no meaning on decode; reassembly relies on frame headers only.
 * @since 0.1.0
 */
public final class TileLayoutEngine {
  private static final Logger log = LoggerFactory.getLogger(TileLayoutEngine.class);

  private final SymbolRenderer renderer;
  private final IndexLabelPainter labelPainter;
  private final ErrorCorrection level;
  private final boolean labelsEnabled;

  /**
   * Creates a layout engine.
   *
   * @param renderer symbol renderer; must not be {@code null}
   * @param labelPainter caption painter; must not be {@code null}
   * @param level error-correction level passed to the renderer; must not be {@code null}
   * @param labelsEnabled whether to caption symbols
   */
  public TileLayoutEngine(
      SymbolRenderer renderer, IndexLabelPainter labelPainter, ErrorCorrection level, boolean labelsEnabled) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.labelPainter = Objects.requireNonNull(labelPainter, "labelPainter");
    this.level = Objects.requireNonNull(level, "level");
    this.labelsEnabled = labelsEnabled;
  }

  /**
   * Renders every frame and tiles the results.
   *
   * @param frames frames of one message in index order; must not be empty
   * @return tiled RGB image
   * @throws ValidationException if a frame does not fit a single symbol
   */
  public BufferedImage render(List<Frame> frames) throws ValidationException {
    Objects.requireNonNull(frames, "frames");
    List<BufferedImage> tiles = new ArrayList<>(frames.size());
    for (Frame frame : frames) {
      BufferedImage symbol = renderer.render(FrameCodec.encode(frame), level);
      tiles.add(labelsEnabled ? labelPainter.paint(symbol, frame.label()) : symbol);
    }
    return tile(tiles);
  }

  /**
   * Packs images into a grid whose cells are sized to the largest image.
   *
   * @param images images to place; must not be empty
   * @return new RGB canvas with a white background
   * @throws IllegalArgumentException if {@code images} is empty
   */
  public static BufferedImage tile(List<BufferedImage> images) {
    if (images == null || images.isEmpty()) {
      throw new IllegalArgumentException("No images to tile");
    }
    int cellWidth = 0;
    int cellHeight = 0;
    for (BufferedImage image : images) {
      cellWidth = Math.max(cellWidth, image.getWidth());
      cellHeight = Math.max(cellHeight, image.getHeight());
    }
    GridShape grid = GridShape.forCount(images.size());
    BufferedImage canvas = new BufferedImage(
        grid.columns() * cellWidth, grid.rows() * cellHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = canvas.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());
      for (int i = 0; i < images.size(); i++) {
        int row = i / grid.columns();
        int col = i % grid.columns();
        g.drawImage(images.get(i), col * cellWidth, row * cellHeight, null);
      }
    } finally {
      g.dispose();
    }
    log.debug("Tiled {} symbol(s) into {}x{} grid ({}x{} px)",
        images.size(), grid.columns(), grid.rows(), canvas.getWidth(), canvas.getHeight());
    return canvas;
  }

  /**
   * Grid dimensions for {@code n} tiles.
   *
   * @param columns {@code ceil(sqrt(n))}
   * @param rows {@code ceil(n / columns)}
   */
  public record GridShape(int columns, int rows) {
    /**
     * Computes the grid for a tile count.
     *
     * @param count number of tiles; must be positive
     * @return grid shape
     */
    public static GridShape forCount(int count) {
      if (count <= 0) {
        throw new IllegalArgumentException("count must be positive");
      }
      int columns = (int) Math.ceil(Math.sqrt(count));
      int rows = (count + columns - 1) / columns;
      return new GridShape(columns, rows);
    }
  }
}
