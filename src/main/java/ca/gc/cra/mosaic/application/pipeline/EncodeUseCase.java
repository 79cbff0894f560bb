package ca.gc.cra.mosaic.application.pipeline;

import ca.gc.cra.mosaic.application.codec.ChecksumEnvelope;
import ca.gc.cra.mosaic.application.codec.Chunker;
import ca.gc.cra.mosaic.application.codec.PassphraseCipher;
import ca.gc.cra.mosaic.application.port.MetricsPort;
import ca.gc.cra.mosaic.domain.error.ImageException;
import ca.gc.cra.mosaic.domain.error.MosaicException;
import ca.gc.cra.mosaic.domain.error.ValidationException;
import ca.gc.cra.mosaic.domain.msg.Fragment;
import ca.gc.cra.mosaic.domain.msg.Frame;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import ca.gc.cra.mosaic.infrastructure.image.PngImages;
import ca.gc.cra.mosaic.infrastructure.image.TileLayoutEngine;
import ca.gc.cra.mosaic.logging.Logs;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Turns text into a PNG mosaic of QR symbols.
 * <p><strong>Why:</strong> Text longer than one symbol's capacity still travels as a single picture.</p>
 * <p><strong>Role:</strong> Application-layer use case driving the encode flow.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Wrap the text in a checksum envelope and optionally encrypt it.</li>
 *   <li>Split the payload into fragments under one fresh {@link MessageId}.</li>
 *   <li>Render, label and tile the frames, then encode the mosaic as PNG.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe when its collaborators are; every call draws its own message id.</p>
 * <p><strong>Performance:</strong> Dominated by symbol rendering; memory grows with the fragment count.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code mosaic.msgId}; records {@code encode.frames},
 * {@code encode.png.bytes} and {@code encode.failure}.</p>
 *
 * @implNote Failures leave no partial output; either a full PNG is returned or an exception is thrown.
 * @since 0.1.0
 */
public final class EncodeUseCase {
  private static final Logger log = LoggerFactory.getLogger(EncodeUseCase.class);

  /** Fragment size used when the caller does not choose one. */
  public static final int DEFAULT_CHUNK_SIZE = 500;

  private final ChecksumEnvelope envelope;
  private final PassphraseCipher cipher;
  private final TileLayoutEngine layout;
  private final MetricsPort metrics;
  private final Supplier<MessageId> messageIds;

  /**
   * Creates an encode use case.
   *
   * @param envelope checksum envelope codec; must not be {@code null}
   * @param cipher passphrase cipher; must not be {@code null}
   * @param layout tile layout engine holding the symbol renderer; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param messageIds supplier of per-call message ids; must not be {@code null}
   */
  public EncodeUseCase(
      ChecksumEnvelope envelope,
      PassphraseCipher cipher,
      TileLayoutEngine layout,
      MetricsPort metrics,
      Supplier<MessageId> messageIds) {
    this.envelope = Objects.requireNonNull(envelope, "envelope");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.layout = Objects.requireNonNull(layout, "layout");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.messageIds = Objects.requireNonNull(messageIds, "messageIds");
  }

  /**
   * Encodes {@code text} into a PNG mosaic.
   *
   * @param text text to encode; must not be {@code null} or empty
   * @param chunkSize maximum code points per fragment; must be positive
   * @param passphrase optional passphrase; {@code null} or blank disables encryption
   * @return PNG bytes
   * @throws ValidationException if the text is empty, the chunk size is not positive, or a frame does not fit
   *     one symbol
   * @throws ImageException if the mosaic cannot be encoded as PNG
   */
  public byte[] encode(String text, int chunkSize, String passphrase) throws ValidationException, ImageException {
    List<Frame> frames;
    try {
      frames = plan(text, chunkSize, passphrase);
    } catch (ValidationException ex) {
      metrics.increment("encode.failure");
      throw ex;
    }
    MessageId id = frames.get(0).messageId();
    MDC.put(Logs.MDC_MESSAGE_ID, id.value());
    try {
      BufferedImage mosaic = layout.render(frames);
      byte[] png = PngImages.write(mosaic);
      metrics.observe("encode.frames", frames.size());
      metrics.observe("encode.png.bytes", png.length);
      log.info("Encoded message {} into {} frame(s), {} PNG bytes", id, frames.size(), png.length);
      return png;
    } catch (MosaicException ex) {
      metrics.increment("encode.failure");
      log.warn("Encode of message {} failed: {}", id, ex.getMessage());
      throw ex;
    } finally {
      MDC.remove(Logs.MDC_MESSAGE_ID);
    }
  }

  /**
   * Encodes {@code text} and returns the PNG as standard base64, ready for a {@code data:} URI.
   *
   * @param text text to encode
   * @param chunkSize maximum code points per fragment
   * @param passphrase optional passphrase
   * @return base64 PNG
   * @throws ValidationException see {@link #encode(String, int, String)}
   * @throws ImageException see {@link #encode(String, int, String)}
   */
  public String encodeBase64(String text, int chunkSize, String passphrase)
      throws ValidationException, ImageException {
    return Base64.getEncoder().encodeToString(encode(text, chunkSize, passphrase));
  }

  /**
   * Builds the frames {@link #encode(String, int, String)} would render, without rendering them.
   *
   * @param text text to encode; must not be {@code null} or empty
   * @param chunkSize maximum code points per fragment; must be positive
   * @param passphrase optional passphrase
   * @return frames of one fresh message, in index order
   * @throws ValidationException if the text is empty, the chunk size is not positive, or the payload needs more
   *     than {@link Frame#MAX_TOTAL} frames
   */
  public List<Frame> plan(String text, int chunkSize, String passphrase) throws ValidationException {
    if (text == null || text.isEmpty()) {
      throw new ValidationException("text must not be empty");
    }
    if (chunkSize <= 0) {
      throw new ValidationException("chunk_size must be positive (was " + chunkSize + ")");
    }
    String payload = envelope.wrap(text);
    if (!PassphraseCipher.isAbsent(passphrase)) {
      payload = cipher.encrypt(payload, passphrase);
    }
    List<String> pieces = Chunker.split(payload, chunkSize);
    if (pieces.size() > Frame.MAX_TOTAL) {
      throw new ValidationException("chunk_size too small: payload needs " + pieces.size()
          + " frames, at most " + Frame.MAX_TOTAL + " allowed");
    }
    MessageId id = Objects.requireNonNull(messageIds.get(), "messageId");
    List<Frame> frames = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      frames.add(new Fragment(i, pieces.get(i)).inMessage(id, pieces.size()));
    }
    log.debug("Planned message {}: {} fragment(s) of <= {} code points, encrypted={}, text={}",
        id, frames.size(), chunkSize, !PassphraseCipher.isAbsent(passphrase), Logs.preview(text));
    return frames;
  }
}
