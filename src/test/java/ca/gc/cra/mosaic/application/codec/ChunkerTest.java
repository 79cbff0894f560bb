package ca.gc.cra.mosaic.application.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mosaic.domain.error.ErrorKind;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkerTest {

  @Test
  void splitsIntoFixedSizeSlicesWithShortTail() throws Exception {
    assertEquals(List.of("hello", " worl", "d"), Chunker.split("hello world", 5));
  }

  @Test
  void exactMultipleHasNoEmptyTail() throws Exception {
    assertEquals(List.of("abc", "def"), Chunker.split("abcdef", 3));
  }

  @Test
  void chunkLargerThanPayloadYieldsSingleFragment() throws Exception {
    assertEquals(List.of("abc"), Chunker.split("abc", 500));
  }

  @Test
  void emptyPayloadYieldsNoFragments() throws Exception {
    assertTrue(Chunker.split("", 10).isEmpty());
  }

  @Test
  void concatenationRestoresPayload() throws Exception {
    String payload = "x".repeat(1234) + "|y|";

    List<String> fragments = Chunker.split(payload, 97);

    assertEquals(payload, String.join("", fragments));
    assertEquals((payload.length() + 96) / 97, fragments.size());
  }

  @Test
  void surrogatePairsStayTogether() throws Exception {
    String payload = "a😀b😁";

    List<String> fragments = Chunker.split(payload, 2);

    assertEquals(List.of("a😀", "b😁"), fragments);
  }

  @Test
  void nonPositiveChunkSizeRejected() {
    ValidationException zero = assertThrows(ValidationException.class, () -> Chunker.split("abc", 0));
    assertThrows(ValidationException.class, () -> Chunker.split("abc", -3));

    assertEquals(ErrorKind.VALIDATION, zero.kind());
    assertTrue(zero.getMessage().contains("chunk_size"));
  }
}
