package ca.gc.cra.mosaic.domain.msg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FrameTest {

  @Test
  void randomMessageIdsAreEightHexCharacters() {
    MessageId first = MessageId.random();
    MessageId second = MessageId.random();

    assertTrue(first.value().matches("[0-9a-f]{8}"));
    assertNotEquals(first, second);
  }

  @Test
  void messageIdRejectsSeparator() {
    assertThrows(IllegalArgumentException.class, () -> new MessageId("a|b"));
  }

  @Test
  void frameEnforcesIndexWithinTotal() {
    MessageId id = new MessageId("id");

    assertThrows(IllegalArgumentException.class, () -> new Frame(id, 0, 0, "x"));
    assertThrows(IllegalArgumentException.class, () -> new Frame(id, 2, 2, "x"));
    assertThrows(IllegalArgumentException.class, () -> new Frame(id, -1, 2, "x"));
    assertThrows(IllegalArgumentException.class, () -> new Frame(id, 0, Frame.MAX_TOTAL + 1, "x"));
  }

  @Test
  void fragmentBindsToMessage() {
    MessageId id = new MessageId("id");
    Frame frame = new Fragment(1, "b|c").inMessage(id, 3);

    assertEquals(new Frame(id, 1, 3, "b|c"), frame);
    assertEquals("2/3", frame.label());
    assertEquals(new Fragment(1, "b|c"), frame.fragment());
    assertThrows(IllegalArgumentException.class, () -> new Fragment(3, "x").inMessage(id, 3));
  }

  @Test
  void errorCorrectionParsesCaseInsensitively() {
    assertEquals(ErrorCorrection.H, ErrorCorrection.parse(" h ", ErrorCorrection.Q));
    assertEquals(ErrorCorrection.Q, ErrorCorrection.parse(null, ErrorCorrection.Q));
    assertThrows(IllegalArgumentException.class, () -> ErrorCorrection.parse("X", ErrorCorrection.Q));
  }
}
