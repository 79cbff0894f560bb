package ca.gc.cra.mosaic.application.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mosaic.domain.msg.Frame;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FrameCodecTest {
  private static final MessageId ID = new MessageId("a1b2c3d4");

  @Test
  void encodesPipeSeparatedFields() {
    assertEquals("a1b2c3d4|0|3|hello", FrameCodec.encode(new Frame(ID, 0, 3, "hello")));
  }

  @Test
  void decodeKeepsSeparatorsInsideText() {
    Optional<Frame> frame = FrameCodec.decode("a1b2c3d4|1|3|a|b||c");

    assertEquals(Optional.of(new Frame(ID, 1, 3, "a|b||c")), frame);
  }

  @Test
  void decodeAcceptsEmptyText() {
    assertEquals(Optional.of(new Frame(ID, 2, 3, "")), FrameCodec.decode("a1b2c3d4|2|3|"));
  }

  @Test
  void decodeRejectsTooFewFields() {
    assertTrue(FrameCodec.decode("a1b2c3d4|0|3").isEmpty());
    assertTrue(FrameCodec.decode("https://example.com").isEmpty());
    assertTrue(FrameCodec.decode(null).isEmpty());
  }

  @Test
  void decodeRejectsNonNumericOrOutOfRangeCounts() {
    assertTrue(FrameCodec.decode("id|x|3|t").isEmpty());
    assertTrue(FrameCodec.decode("id|0|three|t").isEmpty());
    assertTrue(FrameCodec.decode("id|-1|3|t").isEmpty());
    assertTrue(FrameCodec.decode("id||3|t").isEmpty());
    assertTrue(FrameCodec.decode("id|3|3|t").isEmpty());
    assertTrue(FrameCodec.decode("id|0|0|t").isEmpty());
    assertTrue(FrameCodec.decode("id|0|99999999999|t").isEmpty());
  }

  @Test
  void decodeRejectsTotalAboveFrameLimit() {
    assertTrue(FrameCodec.decode("abcd|0|999999999|x").isEmpty());
    assertTrue(FrameCodec.decode("abcd|0|" + (Frame.MAX_TOTAL + 1) + "|x").isEmpty());
    assertEquals(Frame.MAX_TOTAL,
        FrameCodec.decode("abcd|0|" + Frame.MAX_TOTAL + "|x").orElseThrow().total());
  }

  @Test
  void labelIsOneBased() {
    assertEquals("3/3", new Frame(ID, 2, 3, "").label());
  }
}
