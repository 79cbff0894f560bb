package ca.gc.cra.mosaic.infrastructure.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.Objects;

/**
 * Stamps an {@code "index/total"} caption in a white strip below a symbol.
 *
 * <p>The symbol is copied untouched to the top of a taller canvas, so its scannable region and quiet zone
 * are never painted over. Glyphs come from a built-in 5x7 bitmap font covering digits and {@code '/'},
 * which keeps rendering identical on headless hosts without installed fonts.</p>
 *
 * @since 0.1.0
 */
public final class IndexLabelPainter {
  static final int MIN_LABEL_HEIGHT = 24;
  private static final int GLYPH_WIDTH = 5;
  private static final int GLYPH_HEIGHT = 7;
  private static final Map<Character, String[]> GLYPHS = Map.ofEntries(
      Map.entry('0', new String[] {" ### ", "#   #", "#  ##", "# # #", "##  #", "#   #", " ### "}),
      Map.entry('1', new String[] {"  #  ", " ##  ", "  #  ", "  #  ", "  #  ", "  #  ", " ### "}),
      Map.entry('2', new String[] {" ### ", "#   #", "    #", "   # ", "  #  ", " #   ", "#####"}),
      Map.entry('3', new String[] {"#####", "   # ", "  #  ", "   # ", "    #", "#   #", " ### "}),
      Map.entry('4', new String[] {"   # ", "  ## ", " # # ", "#  # ", "#####", "   # ", "   # "}),
      Map.entry('5', new String[] {"#####", "#    ", "#### ", "    #", "    #", "#   #", " ### "}),
      Map.entry('6', new String[] {"  ## ", " #   ", "#    ", "#### ", "#   #", "#   #", " ### "}),
      Map.entry('7', new String[] {"#####", "    #", "   # ", "  #  ", " #   ", " #   ", " #   "}),
      Map.entry('8', new String[] {" ### ", "#   #", "#   #", " ### ", "#   #", "#   #", " ### "}),
      Map.entry('9', new String[] {" ### ", "#   #", "#   #", " ####", "    #", "   # ", " ##  "}),
      Map.entry('/', new String[] {"    #", "    #", "   # ", "  #  ", " #   ", "#    ", "#    "}));

  private final int minLabelHeight;

  /** Creates a painter using the default minimum strip height of 24 pixels. */
  public IndexLabelPainter() {
    this(MIN_LABEL_HEIGHT);
  }

  /**
   * Creates a painter.
   *
   * @param minLabelHeight minimum caption strip height in pixels; must be positive
   */
  public IndexLabelPainter(int minLabelHeight) {
    if (minLabelHeight <= 0) {
      throw new IllegalArgumentException("minLabelHeight must be positive");
    }
    this.minLabelHeight = minLabelHeight;
  }

  /**
   * Returns the height of the caption strip added below a symbol of the given height.
   *
   * @param symbolHeight symbol height in pixels
   * @return {@code max(minLabelHeight, symbolHeight / 6)}
   */
  public int labelHeight(int symbolHeight) {
    return Math.max(minLabelHeight, symbolHeight / 6);
  }

  /**
   * Copies {@code symbol} onto a taller white canvas and draws {@code label} centred below it.
   *
   * @param symbol rendered symbol; must not be {@code null}
   * @param label caption such as {@code "3/7"}; characters without a glyph are left blank
   * @return new RGB image of size {@code width x (height + labelHeight(height))}
   */
  public BufferedImage paint(BufferedImage symbol, String label) {
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(label, "label");
    int width = symbol.getWidth();
    int height = symbol.getHeight();
    int strip = labelHeight(height);

    BufferedImage labeled = new BufferedImage(width, height + strip, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = labeled.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, width, height + strip);
      g.drawImage(symbol, 0, 0, null);

      int scale = Math.max(1, (strip / 2) / GLYPH_HEIGHT);
      int advance = (GLYPH_WIDTH + 1) * scale;
      int textWidth = label.length() * advance - scale;
      int textHeight = GLYPH_HEIGHT * scale;
      int x = Math.max(0, (width - textWidth) / 2);
      int y = height + (strip - textHeight) / 2;

      g.setColor(Color.BLACK);
      for (int i = 0; i < label.length(); i++) {
        String[] glyph = GLYPHS.get(label.charAt(i));
        if (glyph != null) {
          drawGlyph(g, glyph, x + i * advance, y, scale);
        }
      }
    } finally {
      g.dispose();
    }
    return labeled;
  }

  private static void drawGlyph(Graphics2D g, String[] glyph, int x, int y, int scale) {
    for (int row = 0; row < glyph.length; row++) {
      String bits = glyph[row];
      for (int col = 0; col < bits.length(); col++) {
        if (bits.charAt(col) == '#') {
          g.fillRect(x + col * scale, y + row * scale, scale, scale);
        }
      }
    }
  }
}
