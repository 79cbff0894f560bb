package ca.gc.cra.mosaic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonAndNestedKeysFlatten() throws Exception {
    Path yaml = tempDir.resolve("mosaic.yaml");
    Files.writeString(yaml, """
        common:
          errorCorrection: M
          metricsExporter: none
        encode:
          errorCorrection: H
          chunkSize: 300
          labels: false
          extra:
            note: kept
        decode:
          scanMaxGrid: 4
        """);

    Map<String, String> encode = YamlConfigLoader.load(yaml, "encode").orElseThrow();
    Map<String, String> decode = YamlConfigLoader.load(yaml, "DECODE").orElseThrow();

    assertEquals("H", encode.get("errorCorrection"));
    assertEquals("300", encode.get("chunkSize"));
    assertEquals("false", encode.get("labels"));
    assertEquals("kept", encode.get("extra.note"));
    assertEquals("M", decode.get("errorCorrection"));
    assertEquals("4", decode.get("scanMaxGrid"));
    assertFalse(decode.containsKey("chunkSize"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "encode"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "encode"));
  }

  @Test
  void arraysAreRejected() throws Exception {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, "encode:\n  chunkSize: [1, 2]\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "encode"));
  }

  @Test
  void malformedYamlIsRejected() throws Exception {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "encode: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "encode"));
  }
}
