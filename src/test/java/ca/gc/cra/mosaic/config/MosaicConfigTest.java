package ca.gc.cra.mosaic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mosaic.domain.msg.ErrorCorrection;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MosaicConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    MosaicConfig config = MosaicConfig.defaults();

    assertEquals(500, config.chunkSize());
    assertEquals(ErrorCorrection.Q, config.errorCorrection());
    assertEquals(10, config.moduleSize());
    assertEquals(4, config.quietZone());
    assertTrue(config.labels());
    assertEquals(24, config.labelMinHeight());
    assertEquals(0L, config.tokenTtlSeconds());
    assertEquals(8, config.scanMaxGrid());
  }

  @Test
  void emptyMapYieldsDefaults() {
    assertEquals(MosaicConfig.defaults(), MosaicConfig.fromMap(Map.of()));
  }

  @Test
  void fromMapParsesEveryOptionAndIgnoresUnknownKeys() {
    MosaicConfig config = MosaicConfig.fromMap(Map.of(
        "chunkSize", " 120 ",
        "errorCorrection", "h",
        "moduleSize", "6",
        "quietZone", "2",
        "labels", "off",
        "labelMinHeight", "30",
        "tokenTtlSeconds", "3600",
        "scanMaxGrid", "4",
        "format", "base64"));

    assertEquals(new MosaicConfig(120, ErrorCorrection.H, 6, 2, false, 30, 3600L, 4), config);
  }

  @Test
  void booleanSynonymsAccepted() {
    assertTrue(MosaicConfig.fromMap(Map.of("labels", "YES")).labels());
    assertFalse(MosaicConfig.fromMap(Map.of("labels", "no")).labels());
    assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromMap(Map.of("labels", "maybe")));
  }

  @Test
  void outOfRangeValuesRejected() {
    IllegalArgumentException zero =
        assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromMap(Map.of("chunkSize", "0")));
    assertEquals("chunkSize must be between 1 and 4296 (was 0)", zero.getMessage());
    assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromMap(Map.of("moduleSize", "abc")));
    assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromMap(Map.of("errorCorrection", "Z")));
    assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromMap(Map.of("scanMaxGrid", "99")));
    assertThrows(IllegalArgumentException.class,
        () -> new MosaicConfig(10, ErrorCorrection.Q, 10, 4, true, 24, -1L, 8));
  }
}
