package ca.gc.cra.mosaic.domain.msg;

import java.util.Objects;

/**
 * Result of unwrapping and verifying a checksum envelope.
 *
 * @since 0.1.0
 */
public sealed interface UnwrapResult
    permits UnwrapResult.Verified, UnwrapResult.Legacy, UnwrapResult.Tampered {

  /**
   * Envelope digest matched its text.
   *
   * @param text recovered text
   * @param hash verified SHA-256 hex digest
   */
  record Verified(String text, String hash) implements UnwrapResult {
    public Verified {
      Objects.requireNonNull(text, "text");
      Objects.requireNonNull(hash, "hash");
    }
  }

  /**
   * Payload carried no envelope; returned unchanged without a hash.
   *
   * @param text payload as received
   */
  record Legacy(String text) implements UnwrapResult {
    public Legacy {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Envelope digest disagreed with its text.
   *
   * @param storedHash untrusted digest read from the envelope
   */
  record Tampered(String storedHash) implements UnwrapResult {
    public Tampered {
      Objects.requireNonNull(storedHash, "storedHash");
    }
  }
}
