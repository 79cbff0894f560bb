package ca.gc.cra.mosaic.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueInsideBounds() {
    assertEquals(5, Numbers.requireRange("chunkSize", 5, 1, 10));
    assertEquals(1, Numbers.requireRange("chunkSize", 1, 1, 10));
  }

  @Test
  void requireRangeNamesTheOption() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("quietZone", 40, 0, 32));

    assertEquals("quietZone must be between 0 and 32 (was 40)", ex.getMessage());
  }

  @Test
  void parseIntTrimsAndValidates() {
    assertEquals(42, Numbers.parseInt("n", " 42 ", 0, 100));
    assertEquals("n must be an integer (was 4x)",
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("n", "4x", 0, 100)).getMessage());
    assertEquals("n must not be blank",
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("n", " ", 0, 100)).getMessage());
  }
}
