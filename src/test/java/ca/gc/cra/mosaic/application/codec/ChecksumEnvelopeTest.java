package ca.gc.cra.mosaic.application.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import ca.gc.cra.mosaic.domain.msg.EnvelopeParse;
import ca.gc.cra.mosaic.domain.msg.UnwrapResult;
import org.junit.jupiter.api.Test;

class ChecksumEnvelopeTest {
  private static final String HELLO_WORLD_SHA256 =
      "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";

  private final ChecksumEnvelope envelope = new ChecksumEnvelope();

  @Test
  void wrapEmitsHashThenText() {
    assertEquals(
        "{\"hash\":\"" + HELLO_WORLD_SHA256 + "\",\"text\":\"hello world\"}",
        envelope.wrap("hello world"));
  }

  @Test
  void sha256HexIsLowercaseDigestOfUtf8() {
    assertEquals(HELLO_WORLD_SHA256, ChecksumEnvelope.sha256Hex("hello world"));
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        ChecksumEnvelope.sha256Hex(""));
  }

  @Test
  void unwrapVerifiesWrappedText() {
    String text = "Quotes \" and \\ backslashes, pipes | and café 😀\nnewline";

    UnwrapResult result = envelope.unwrap(envelope.wrap(text));

    UnwrapResult.Verified verified = assertInstanceOf(UnwrapResult.Verified.class, result);
    assertEquals(text, verified.text());
    assertEquals(ChecksumEnvelope.sha256Hex(text), verified.hash());
  }

  @Test
  void plainTextIsLegacy() {
    UnwrapResult result = envelope.unwrap("just some old text");

    assertEquals(new UnwrapResult.Legacy("just some old text"), result);
  }

  @Test
  void jsonWithExtraMemberIsLegacy() {
    String payload = "{\"hash\":\"" + HELLO_WORLD_SHA256 + "\",\"text\":\"hello world\",\"v\":\"2\"}";

    assertInstanceOf(EnvelopeParse.RawLegacyText.class, envelope.parse(payload));
    assertEquals(new UnwrapResult.Legacy(payload), envelope.unwrap(payload));
  }

  @Test
  void jsonWithNonStringMemberIsLegacy() {
    String payload = "{\"hash\":1,\"text\":\"hello\"}";

    assertEquals(new UnwrapResult.Legacy(payload), envelope.unwrap(payload));
  }

  @Test
  void malformedJsonIsLegacy() {
    String payload = "{\"hash\":\"abc\",";

    assertEquals(new UnwrapResult.Legacy(payload), envelope.unwrap(payload));
  }

  @Test
  void memberOrderDoesNotMatter() {
    String payload = "{\"text\":\"hello world\",\"hash\":\"" + HELLO_WORLD_SHA256 + "\"}";

    assertEquals(new UnwrapResult.Verified("hello world", HELLO_WORLD_SHA256), envelope.unwrap(payload));
  }

  @Test
  void mismatchedDigestIsTamperedWithStoredHash() {
    String tampered = envelope.wrap("hello world").replace("hello world", "hello w0rld");

    UnwrapResult result = envelope.unwrap(tampered);

    assertEquals(new UnwrapResult.Tampered(HELLO_WORLD_SHA256), result);
  }
}
