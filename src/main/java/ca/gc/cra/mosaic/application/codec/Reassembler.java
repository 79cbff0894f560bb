package ca.gc.cra.mosaic.application.codec;

import ca.gc.cra.mosaic.application.port.MetricsPort;
import ca.gc.cra.mosaic.domain.error.MissingChunksException;
import ca.gc.cra.mosaic.domain.error.ScanException;
import ca.gc.cra.mosaic.domain.msg.Frame;
import ca.gc.cra.mosaic.domain.msg.MessageId;
import ca.gc.cra.mosaic.domain.msg.ReassembledMessage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Regroups scanned frame strings into the original payload.
 * <p><strong>Why:</strong> The scanner returns symbols in arbitrary order, possibly with duplicates and
 * foreign symbols from the same shot.</p>
 * <p><strong>Role:</strong> Decode-side counterpart of {@link Chunker} and {@link FrameCodec}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip strings that do not parse as frames.</li>
 *   <li>Select the first message id encountered and ignore frames of any other id.</li>
 *   <li>Verify every index of the selected message is present and join the fragments in order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; all state is local to {@link #reassemble(Collection)}.</p>
 * <p><strong>Observability:</strong> Records {@code decode.symbols}, {@code decode.frames.skipped} and
 * {@code decode.frames.conflict}.</p>
 *
 * @implNote The selected message's {@code total} comes from its first frame. A second frame for an index
 * already seen is ignored; if its text differs it is counted as a conflict. Counts above
 * {@link Frame#MAX_TOTAL} never parse, so a stray symbol cannot inflate the missing-index report.
 * @since 0.1.0
 */
public final class Reassembler {
  private static final Logger log = LoggerFactory.getLogger(Reassembler.class);

  private final MetricsPort metrics;

  /**
   * Creates a reassembler.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public Reassembler(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Rebuilds the payload of the first message found among {@code scanned}.
   *
   * @param scanned symbol contents returned by the scanner, in scan order; must not be {@code null}
   * @return selected message id with its fragment texts concatenated in index order
   * @throws ScanException if nothing was scanned or nothing parses as a frame
   * @throws MissingChunksException if the selected message lacks one or more indices
   */
  public ReassembledMessage reassemble(Collection<String> scanned) throws ScanException, MissingChunksException {
    Objects.requireNonNull(scanned, "scanned");
    metrics.observe("decode.symbols", scanned.size());
    if (scanned.isEmpty()) {
      throw new ScanException("No QR codes found");
    }

    List<Frame> frames = new ArrayList<>(scanned.size());
    int skipped = 0;
    for (String raw : scanned) {
      Optional<Frame> frame = FrameCodec.decode(raw);
      if (frame.isPresent()) {
        frames.add(frame.get());
      } else {
        skipped++;
      }
    }
    if (skipped > 0) {
      log.debug("Skipped {} symbol(s) that are not MOSAIC frames", skipped);
      metrics.observe("decode.frames.skipped", skipped);
    }
    if (frames.isEmpty()) {
      throw new ScanException("Invalid QR format");
    }

    Frame head = frames.get(0);
    MessageId selected = head.messageId();
    int total = head.total();
    Map<Integer, String> parts = new HashMap<>();
    Set<MessageId> ignored = new LinkedHashSet<>();
    for (Frame frame : frames) {
      if (!selected.equals(frame.messageId())) {
        ignored.add(frame.messageId());
        continue;
      }
      if (frame.total() != total) {
        log.warn("Ignoring frame {} of message {} declaring total {} (expected {})",
            frame.index(), selected, frame.total(), total);
        continue;
      }
      String existing = parts.putIfAbsent(frame.index(), frame.text());
      if (existing != null && !existing.equals(frame.text())) {
        log.warn("Conflicting content for fragment {} of message {}; keeping the first", frame.index(), selected);
        metrics.increment("decode.frames.conflict");
      }
    }
    if (!ignored.isEmpty()) {
      log.warn("Ignoring frames from other message ids {}; only {} is decoded", ignored, selected);
    }

    List<Integer> missing = new ArrayList<>();
    for (int i = 0; i < total; i++) {
      if (!parts.containsKey(i)) {
        missing.add(i);
      }
    }
    if (!missing.isEmpty()) {
      throw new MissingChunksException(missing);
    }

    StringBuilder payload = new StringBuilder();
    for (int i = 0; i < total; i++) {
      payload.append(parts.get(i));
    }
    log.debug("Reassembled message {} from {} fragment(s)", selected, total);
    return new ReassembledMessage(selected, payload.toString());
  }
}
