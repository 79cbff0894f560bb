package ca.gc.cra.mosaic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void encodeDefaultsBuildDefaultConfig() {
    Map<String, String> encode = DefaultsForMode.asFlatMap("encode");

    assertEquals("png", encode.get("format"));
    assertEquals("none", encode.get("metricsExporter"));
    assertEquals(MosaicConfig.defaults(), MosaicConfig.fromMap(encode));
  }

  @Test
  void decodeDefaultsCarryScannerAndTokenOptions() {
    Map<String, String> decode = DefaultsForMode.asFlatMap("Decode");

    assertEquals("0", decode.get("tokenTtlSeconds"));
    assertEquals("8", decode.get("scanMaxGrid"));
    assertFalse(decode.containsKey("chunkSize"));
  }

  @Test
  void unknownModeRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("serve"));
  }
}
