package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;

/**
 * Checksum wrapper shape: the text plus its SHA-256 hex digest as stored on the wire.
 *
 * @param hash stored digest; trusted only after verification
 * @param text wrapped text
 * @since 0.1.0
 */
public record Envelope(String hash, String text) {
  public Envelope {
    Objects.requireNonNull(hash, "hash");
    Objects.requireNonNull(text, "text");
  }
}
