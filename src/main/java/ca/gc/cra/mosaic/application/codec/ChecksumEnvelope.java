package ca.gc.cra.mosaic.application.codec;

import ca.gc.cra.mosaic.domain.msg.Envelope;
import ca.gc.cra.mosaic.domain.msg.EnvelopeParse;
import ca.gc.cra.mosaic.domain.msg.EnvelopeParse.RawLegacyText;
import ca.gc.cra.mosaic.domain.msg.EnvelopeParse.StructuredEnvelope;
import ca.gc.cra.mosaic.domain.msg.UnwrapResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wraps text in a {@code {"hash","text"}} JSON envelope and verifies it on the way back.
 * <p><strong>Why:</strong> Detects corrupted or tampered payloads after reassembly and decryption.</p>
 * <p><strong>Role:</strong> Innermost layer of the encode pipeline, outermost of the decode pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize the SHA-256 hex digest of the text next to the text itself.</li>
 *   <li>Recognise the envelope shape structurally and fall back to legacy plain text otherwise.</li>
 *   <li>Report digest mismatches as {@link UnwrapResult.Tampered}, never as silently corrected text.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; {@link JsonFactory} is shareable and no other state is kept.</p>
 *
 * @implNote Uses the Jackson streaming API so the wire shape stays exactly two string members.
 * @since 0.1.0
 */
public final class ChecksumEnvelope {
  private static final Logger log = LoggerFactory.getLogger(ChecksumEnvelope.class);
  private static final String HASH_FIELD = "hash";
  private static final String TEXT_FIELD = "text";
  private static final HexFormat HEX = HexFormat.of();

  private final JsonFactory factory = new JsonFactory();

  /**
   * Wraps {@code text} with its digest.
   *
   * @param text cleartext to protect; must not be {@code null}
   * @return JSON envelope string
   */
  public String wrap(String text) {
    Objects.requireNonNull(text, "text");
    StringWriter out = new StringWriter(text.length() + 96);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField(HASH_FIELD, sha256Hex(text));
      generator.writeStringField(TEXT_FIELD, text);
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to serialize checksum envelope", ex);
    }
    return out.toString();
  }

  /**
   * Classifies a payload as a structured envelope or legacy plain text.
   *
   * @param payload decrypted (or plain) payload; must not be {@code null}
   * @return {@link StructuredEnvelope} for an object with exactly the string members {@code hash} and
   *     {@code text}; {@link RawLegacyText} for anything else
   */
  public EnvelopeParse parse(String payload) {
    Objects.requireNonNull(payload, "payload");
    if (!payload.strip().startsWith("{")) {
      return new RawLegacyText(payload);
    }
    try (JsonParser parser = factory.createParser(payload)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        return new RawLegacyText(payload);
      }
      String hash = null;
      String text = null;
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          return new RawLegacyText(payload);
        }
        String name = parser.currentName();
        if (parser.nextToken() != JsonToken.VALUE_STRING) {
          return new RawLegacyText(payload);
        }
        if (HASH_FIELD.equals(name) && hash == null) {
          hash = parser.getText();
        } else if (TEXT_FIELD.equals(name) && text == null) {
          text = parser.getText();
        } else {
          return new RawLegacyText(payload);
        }
      }
      if (parser.nextToken() != null || hash == null || text == null) {
        return new RawLegacyText(payload);
      }
      return new StructuredEnvelope(new Envelope(hash, text));
    } catch (IOException ex) {
      log.debug("Payload is not JSON; treating as legacy plain text ({})", ex.getClass().getSimpleName());
      return new RawLegacyText(payload);
    }
  }

  /**
   * Unwraps and verifies a payload.
   *
   * @param payload decrypted (or plain) payload; must not be {@code null}
   * @return verified text with its digest, the legacy payload unchanged, or the stored digest of a
   *     tampered envelope
   */
  public UnwrapResult unwrap(String payload) {
    EnvelopeParse parsed = parse(payload);
    if (parsed instanceof RawLegacyText legacy) {
      return new UnwrapResult.Legacy(legacy.text());
    }
    Envelope envelope = ((StructuredEnvelope) parsed).envelope();
    String actual = sha256Hex(envelope.text());
    if (!actual.equals(envelope.hash())) {
      log.warn("Checksum mismatch: stored {} computed {}", envelope.hash(), actual);
      return new UnwrapResult.Tampered(envelope.hash());
    }
    return new UnwrapResult.Verified(envelope.text(), envelope.hash());
  }

  /**
   * Computes the lowercase SHA-256 hex digest of the UTF-8 encoding of {@code text}.
   *
   * @param text input text; must not be {@code null}
   * @return 64 lowercase hex characters
   */
  public static String sha256Hex(String text) {
    return HEX.formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
  }

  static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available in this JVM", ex);
    }
  }
}
