package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;

/**
 * Outcome of recognising a payload as a checksum envelope.
 *
 * <p>A payload is {@link StructuredEnvelope} only when it is a JSON object with exactly the string
 * members {@code hash} and {@code text}; everything else is {@link RawLegacyText}.</p>
 *
 * @since 0.1.0
 */
public sealed interface EnvelopeParse permits EnvelopeParse.StructuredEnvelope, EnvelopeParse.RawLegacyText {

  /**
   * Payload matched the envelope shape.
   *
   * @param envelope parsed envelope
   */
  record StructuredEnvelope(Envelope envelope) implements EnvelopeParse {
    public StructuredEnvelope {
      Objects.requireNonNull(envelope, "envelope");
    }
  }

  /**
   * Payload predates checksum wrapping (or is not envelope shaped) and is taken verbatim.
   *
   * @param text original payload
   */
  record RawLegacyText(String text) implements EnvelopeParse {
    public RawLegacyText {
      Objects.requireNonNull(text, "text");
    }
  }
}
