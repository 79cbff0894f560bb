package ca.gc.cra.mosaic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsKeepingEqualsInValue() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"text=a=b", " out = m.png ", "chunkSize=5"});

    assertEquals(Map.of("text", "a=b", "out", "m.png", "chunkSize", "5"), map);
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, " "}).isEmpty());
  }

  @Test
  void rejectsMissingEqualsEmptyValueAndBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"text"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertEquals("argument out must have a value",
        assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out="}))
            .getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=v"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"text=a\u0007b"}));
  }
}
