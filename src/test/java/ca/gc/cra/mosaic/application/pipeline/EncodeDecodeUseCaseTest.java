package ca.gc.cra.mosaic.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.mosaic.application.codec.ChecksumEnvelope;
import ca.gc.cra.mosaic.application.codec.Chunker;
import ca.gc.cra.mosaic.config.CompositionRoot;
import ca.gc.cra.mosaic.config.MosaicConfig;
import ca.gc.cra.mosaic.domain.error.ErrorKind;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.Frame;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import ca.gc.cra.mosaic.infrastructure.image.PngImages;
import ca.gc.cra.mosaic.logging.Logs;
import ca.gc.cra.mosaic.testutil.FixedClock;
import ca.gc.cra.mosaic.testutil.RecordingMetrics;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class EncodeDecodeUseCaseTest {
  private static final String FOX = "The quick brown fox jumps over the lazy dog";
  private static final MessageId ID = new MessageId("feedc0de");

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final CompositionRoot root =
      new CompositionRoot(MosaicConfig.defaults(), metrics, new FixedClock(1_700_000_000_000L), () -> ID);
  private final EncodeUseCase encoder = root.encodeUseCase();
  private final DecodeUseCase decoder = root.decodeUseCase();

  @Test
  void plainRoundTripReturnsTextAndHash() throws Exception {
    byte[] png = encoder.encode(FOX, 40, null);

    DecodeResult result = decoder.decode(png, null);

    assertTrue(result.succeeded(), () -> "decode failed: " + result.failure());
    assertEquals(FOX, result.text());
    assertEquals(ChecksumEnvelope.sha256Hex(FOX), result.sha256());
    assertEquals(1L, metrics.counter("decode.success"));
    assertEquals(4L, metrics.lastObservation("encode.frames"));
    assertEquals(png.length, metrics.lastObservation("encode.png.bytes"));
    assertNull(MDC.get(Logs.MDC_MESSAGE_ID));
  }

  @Test
  void helloWorldWithTinyChunksUsesOneFramePerFiveCharacters() throws Exception {
    String wrapped = new ChecksumEnvelope().wrap("hello world");

    List<Frame> frames = encoder.plan("hello world", 5, null);
    DecodeResult result = decoder.decode(encoder.encode("hello world", 5, null), null);

    assertEquals((wrapped.length() + 4) / 5, frames.size());
    assertEquals(frames.size(), frames.get(0).total());
    assertEquals(wrapped, String.join("", frames.stream().map(Frame::text).toList()));
    assertEquals("hello world", result.text());
  }

  @Test
  void encryptedRoundTripWithPassphrase() throws Exception {
    String text = "Meet at the usual place | bring the café receipts 😀";
    byte[] png = encoder.encode(text, 120, "s3cret");

    DecodeResult result = decoder.decode(png, "s3cret");

    assertEquals(text, result.text());
    assertEquals(ChecksumEnvelope.sha256Hex(text), result.sha256());
  }

  @Test
  void encryptedFramesDoNotLeakPlaintext() throws Exception {
    List<Frame> frames = encoder.plan(FOX, 500, "s3cret");

    assertEquals(1, frames.size());
    assertFalse(frames.get(0).text().contains("quick"));
  }

  @Test
  void wrongPassphraseIsDecryptionFailure() throws Exception {
    byte[] png = encoder.encode(FOX, 120, "alpha");

    DecodeResult result = decoder.decode(png, "beta");

    assertFalse(result.succeeded());
    assertEquals(ErrorKind.DECRYPTION, result.failure().kind());
    assertEquals("Decryption failed. Wrong passphrase or corrupted data.", result.failure().message());
    assertNull(result.sha256());
    assertEquals(1L, metrics.counter("decode.failure.decryption"));
  }

  @Test
  void blankedTileIsReportedAsMissingChunk() throws Exception {
    byte[] png = encoder.encode(FOX, 40, null);
    BufferedImage mosaic = PngImages.read(png);
    int cellWidth = mosaic.getWidth() / 2;
    int cellHeight = mosaic.getHeight() / 2;
    // frame 1 sits in the top-right cell of the 2x2 grid
    for (int y = 0; y < cellHeight; y++) {
      for (int x = cellWidth; x < 2 * cellWidth; x++) {
        mosaic.setRGB(x, y, 0xFFFFFF);
      }
    }

    DecodeResult result = decoder.decode(PngImages.write(mosaic), null);

    assertEquals(ErrorKind.MISSING_CHUNKS, result.failure().kind());
    assertEquals(List.of(1), result.failure().missingIndices());
    assertEquals(1L, metrics.counter("decode.failure.missing_chunks"));
  }

  @Test
  void tamperedEnvelopeIsIntegrityFailureWithStoredHash() throws Exception {
    String storedHash = ChecksumEnvelope.sha256Hex("hello");
    String forged = "{\"hash\":\"" + storedHash + "\",\"text\":\"HELLO\"}";

    DecodeResult result = decoder.decode(mosaicOf(forged, 30), null);

    assertEquals(ErrorKind.INTEGRITY, result.failure().kind());
    assertEquals(storedHash, result.sha256());
  }

  @Test
  void payloadWithoutEnvelopeIsReturnedAsLegacyText() throws Exception {
    DecodeResult result = decoder.decode(mosaicOf("plain old text", 500), null);

    assertEquals("plain old text", result.text());
    assertNull(result.sha256());
  }

  @Test
  void imageWithoutSymbolsIsScanFailure() throws Exception {
    BufferedImage blank = new BufferedImage(200, 200, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < 200; y++) {
      for (int x = 0; x < 200; x++) {
        blank.setRGB(x, y, 0xFFFFFF);
      }
    }

    DecodeResult result = decoder.decode(PngImages.write(blank), null);

    assertEquals(ErrorKind.SCAN, result.failure().kind());
    assertEquals("No QR codes found", result.failure().message());
  }

  @Test
  void unreadableBytesAreImageFailure() {
    DecodeResult result = decoder.decode("not an image".getBytes(StandardCharsets.UTF_8), null);

    assertEquals(ErrorKind.IMAGE, result.failure().kind());
  }

  @Test
  void missingImageIsValidationFailure() {
    assertEquals(ErrorKind.VALIDATION, decoder.decode(null, null).failure().kind());
    assertEquals("No image provided", decoder.decode(new byte[0], null).failure().message());
  }

  @Test
  void emptyTextAndNonPositiveChunkSizeAreRejected() {
    ValidationException empty = assertThrows(ValidationException.class, () -> encoder.encode("", 10, null));
    assertThrows(ValidationException.class, () -> encoder.encode("abc", 0, null));

    assertEquals("text must not be empty", empty.getMessage());
    assertEquals(2L, metrics.counter("encode.failure"));
  }

  @Test
  void payloadNeedingMoreThanMaxFramesIsRejected() {
    ValidationException ex = assertThrows(ValidationException.class,
        () -> encoder.encode("a".repeat(Frame.MAX_TOTAL), 1, null));

    assertTrue(ex.getMessage().startsWith("chunk_size too small"), ex.getMessage());
    assertEquals(1L, metrics.counter("encode.failure"));
  }

  @Test
  void base64VariantDecodesToPng() throws Exception {
    String base64 = encoder.encodeBase64("hi", 500, null);

    byte[] png = Base64.getDecoder().decode(base64);

    assertEquals("hi", decoder.decode(png, null).text());
  }

  private byte[] mosaicOf(String payload, int chunkSize) throws Exception {
    List<String> pieces = Chunker.split(payload, chunkSize);
    List<Frame> frames = new ArrayList<>();
    for (int i = 0; i < pieces.size(); i++) {
      frames.add(new Frame(ID, i, pieces.size(), pieces.get(i)));
    }
    return PngImages.write(root.tileLayoutEngine().render(frames));
  }
}
