package ca.gc.cra.mosaic.application.pipeline;

import ca.gc.cra.mosaic.application.codec.ChecksumEnvelope;
import ca.gc.cra.mosaic.application.codec.PassphraseCipher;
import ca.gc.cra.mosaic.application.codec.Reassembler;
import ca.gc.cra.mosaic.application.port.MetricsPort;
import ca.gc.cra.mosaic.application.port.SymbolScanner;
import ca.gc.cra.mosaic.domain.error.IntegrityException;
import ca.gc.cra.mosaic.domain.error.MosaicException;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.ReassembledMessage;
import ca.gc.cra.mosaic.domain.msg.UnwrapResult;
import ca.gc.cra.mosaic.infrastructure.image.PngImages;
import ca.gc.cra.mosaic.logging.Logs;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Recovers text from a mosaic image.
 * <p><strong>Role:</strong> Application-layer use case driving the decode flow: scan, reassemble, decrypt,
 * verify.</p>
 * <p><strong>Error handling:</strong> Never throws for bad input. Every domain failure becomes a
 * {@link DecodeFailure} inside the returned {@link DecodeResult}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when its collaborators are.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code mosaic.msgId} once a message is selected; records
 * {@code decode.success} and {@code decode.failure.<kind>}.</p>
 *
 * @since 0.1.0
 */
public final class DecodeUseCase {
  private static final Logger log = LoggerFactory.getLogger(DecodeUseCase.class);

  private final SymbolScanner scanner;
  private final Reassembler reassembler;
  private final PassphraseCipher cipher;
  private final ChecksumEnvelope envelope;
  private final MetricsPort metrics;

  /**
   * Creates a decode use case.
   *
   * @param scanner symbol scanner; must not be {@code null}
   * @param reassembler frame reassembler; must not be {@code null}
   * @param cipher passphrase cipher; must not be {@code null}
   * @param envelope checksum envelope codec; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public DecodeUseCase(
      SymbolScanner scanner,
      Reassembler reassembler,
      PassphraseCipher cipher,
      ChecksumEnvelope envelope,
      MetricsPort metrics) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.reassembler = Objects.requireNonNull(reassembler, "reassembler");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.envelope = Objects.requireNonNull(envelope, "envelope");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Decodes a mosaic image.
   *
   * @param imageBytes raster bytes in any format {@link javax.imageio.ImageIO} reads
   * @param passphrase optional passphrase; {@code null} or blank skips decryption
   * @return recovered text and hash, or a failure
   */
  public DecodeResult decode(byte[] imageBytes, String passphrase) {
    try {
      DecodeResult result = run(imageBytes, passphrase);
      metrics.increment("decode.success");
      log.info("Decoded message {} ({} hash)", MDC.get(Logs.MDC_MESSAGE_ID),
          result.sha256() == null ? "without" : "with verified");
      return result;
    } catch (MosaicException ex) {
      DecodeFailure failure = DecodeFailure.from(ex);
      String storedHash = ex instanceof IntegrityException integrity ? integrity.storedHash() : null;
      metrics.increment("decode.failure." + ex.kind().metricSuffix());
      log.warn("Decode failed [{}]: {}", ex.kind(), ex.getMessage());
      return DecodeResult.failed(failure, storedHash);
    } finally {
      MDC.remove(Logs.MDC_MESSAGE_ID);
    }
  }

  private DecodeResult run(byte[] imageBytes, String passphrase) throws MosaicException {
    if (imageBytes == null || imageBytes.length == 0) {
      throw new ValidationException("No image provided");
    }
    BufferedImage image = PngImages.read(imageBytes);
    List<String> symbols = scanner.scan(image);
    log.debug("Scanner returned {} symbol(s) from {}x{} image", symbols.size(), image.getWidth(), image.getHeight());
    ReassembledMessage message = reassembler.reassemble(symbols);
    MDC.put(Logs.MDC_MESSAGE_ID, message.messageId().value());
    String payload = message.payload();
    if (!PassphraseCipher.isAbsent(passphrase)) {
      payload = cipher.decrypt(payload, passphrase);
    }
    UnwrapResult unwrapped = envelope.unwrap(payload);
    if (unwrapped instanceof UnwrapResult.Verified verified) {
      return DecodeResult.success(verified.text(), verified.hash());
    }
    if (unwrapped instanceof UnwrapResult.Legacy legacy) {
      log.debug("Payload has no checksum envelope; returning it as legacy text");
      return DecodeResult.success(legacy.text(), null);
    }
    throw new IntegrityException(((UnwrapResult.Tampered) unwrapped).storedHash());
  }
}
