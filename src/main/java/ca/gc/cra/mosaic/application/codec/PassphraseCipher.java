package ca.gc.cra.mosaic.application.codec;

import ca.gc.cra.mosaic.application.port.ClockPort;
import ca.gc.cra.mosaic.domain.error.DecryptionException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Optional passphrase-keyed confidentiality layer producing Fernet tokens.
 * <p><strong>Why:</strong> Lets a mosaic be shared publicly while only passphrase holders recover the text.</p>
 * <p><strong>Role:</strong> Sits between the checksum envelope and the chunker.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive a 32 byte key as SHA-256 of the passphrase; the passphrase itself is never kept.</li>
 *   <li>Emit versioned, timestamped, HMAC-authenticated AES-128-CBC tokens in URL-safe base64.</li>
 *   <li>Reject any token that fails authentication with {@link DecryptionException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; JCA objects are created per call.</p>
 *
 * @implNote Token layout: {@code 0x80 | seconds(8) | iv(16) | ciphertext | hmac(32)}. The first half of the
 * derived key signs, the second half encrypts.
 * @since 0.1.0
 */
public final class PassphraseCipher {
  private static final Logger log = LoggerFactory.getLogger(PassphraseCipher.class);
  private static final byte VERSION = (byte) 0x80;
  private static final int TIMESTAMP_LENGTH = 8;
  private static final int IV_LENGTH = 16;
  private static final int BLOCK_LENGTH = 16;
  private static final int HMAC_LENGTH = 32;
  private static final int HEADER_LENGTH = 1 + TIMESTAMP_LENGTH + IV_LENGTH;
  private static final int MIN_TOKEN_LENGTH = HEADER_LENGTH + BLOCK_LENGTH + HMAC_LENGTH;
  private static final long MAX_CLOCK_SKEW_SECONDS = 60;
  private static final String FAILURE_MESSAGE = "Decryption failed. Wrong passphrase or corrupted data.";

  private final ClockPort clock;
  private final SecureRandom random;
  private final long tokenTtlSeconds;

  /**
   * Creates a cipher without token expiry.
   *
   * @param clock time source embedded in new tokens; must not be {@code null}
   */
  public PassphraseCipher(ClockPort clock) {
    this(clock, new SecureRandom(), 0);
  }

  /**
   * Creates a cipher.
   *
   * @param clock time source for token timestamps and expiry checks; must not be {@code null}
   * @param random IV source; must not be {@code null}
   * @param tokenTtlSeconds maximum token age accepted on decrypt; {@code 0} disables expiry
   */
  public PassphraseCipher(ClockPort clock, SecureRandom random, long tokenTtlSeconds) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
    if (tokenTtlSeconds < 0) {
      throw new IllegalArgumentException("tokenTtlSeconds must not be negative");
    }
    this.tokenTtlSeconds = tokenTtlSeconds;
  }

  /**
   * Returns whether a passphrase disables the encryption layer.
   *
   * @param passphrase candidate passphrase; may be {@code null}
   * @return {@code true} when absent, empty or blank
   */
  public static boolean isAbsent(String passphrase) {
    return passphrase == null || passphrase.isBlank();
  }

  /**
   * Encrypts {@code text} when a passphrase is supplied.
   *
   * @param text plaintext; must not be {@code null}
   * @param passphrase optional passphrase; absent returns {@code text} unchanged
   * @return Fernet token or the unchanged text
   */
  public String encrypt(String text, String passphrase) {
    Objects.requireNonNull(text, "text");
    if (isAbsent(passphrase)) {
      return text;
    }
    byte[] key = deriveKey(passphrase);
    try {
      byte[] iv = new byte[IV_LENGTH];
      random.nextBytes(iv);
      Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey(key), new IvParameterSpec(iv));
      byte[] ciphertext = cipher.doFinal(text.getBytes(StandardCharsets.UTF_8));

      ByteBuffer body = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length + HMAC_LENGTH);
      body.put(VERSION);
      body.putLong(clock.nowMillis() / 1000L);
      body.put(iv);
      body.put(ciphertext);
      byte[] signed = body.array();
      byte[] tag = hmac(key, signed, signed.length - HMAC_LENGTH);
      body.put(tag);
      return Base64.getUrlEncoder().encodeToString(signed);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("AES/HMAC primitives unavailable", ex);
    } finally {
      Arrays.fill(key, (byte) 0);
    }
  }

  /**
   * Decrypts a token when a passphrase is supplied.
   *
   * @param token Fernet token (or plain payload when no passphrase); must not be {@code null}
   * @param passphrase optional passphrase; absent returns {@code token} unchanged
   * @return recovered plaintext
   * @throws DecryptionException if the token is malformed, fails authentication, is expired, or does not
   *     decrypt to UTF-8 text
   */
  public String decrypt(String token, String passphrase) throws DecryptionException {
    Objects.requireNonNull(token, "token");
    if (isAbsent(passphrase)) {
      return token;
    }
    byte[] data;
    try {
      data = Base64.getUrlDecoder().decode(token.strip());
    } catch (IllegalArgumentException ex) {
      log.debug("Encryption token is not URL-safe base64");
      throw new DecryptionException(FAILURE_MESSAGE, ex);
    }
    if (data.length < MIN_TOKEN_LENGTH
        || data[0] != VERSION
        || (data.length - HEADER_LENGTH - HMAC_LENGTH) % BLOCK_LENGTH != 0) {
      log.debug("Encryption token has invalid version or length ({} bytes)", data.length);
      throw new DecryptionException(FAILURE_MESSAGE);
    }
    byte[] key = deriveKey(passphrase);
    try {
      int signedLength = data.length - HMAC_LENGTH;
      byte[] expected = hmac(key, data, signedLength);
      byte[] actual = Arrays.copyOfRange(data, signedLength, data.length);
      if (!MessageDigest.isEqual(expected, actual)) {
        throw new DecryptionException(FAILURE_MESSAGE);
      }
      checkTimestamp(ByteBuffer.wrap(data, 1, TIMESTAMP_LENGTH).getLong());

      Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(
          Cipher.DECRYPT_MODE,
          encryptionKey(key),
          new IvParameterSpec(data, 1 + TIMESTAMP_LENGTH, IV_LENGTH));
      byte[] plain = cipher.doFinal(data, HEADER_LENGTH, signedLength - HEADER_LENGTH);
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plain))
          .toString();
    } catch (GeneralSecurityException | CharacterCodingException ex) {
      throw new DecryptionException(FAILURE_MESSAGE, ex);
    } finally {
      Arrays.fill(key, (byte) 0);
    }
  }

  private void checkTimestamp(long issuedSeconds) throws DecryptionException {
    if (tokenTtlSeconds == 0) {
      return;
    }
    long nowSeconds = clock.nowMillis() / 1000L;
    if (issuedSeconds + tokenTtlSeconds < nowSeconds) {
      log.debug("Encryption token expired ({}s old)", nowSeconds - issuedSeconds);
      throw new DecryptionException(FAILURE_MESSAGE);
    }
    if (nowSeconds + MAX_CLOCK_SKEW_SECONDS < issuedSeconds) {
      log.debug("Encryption token timestamp lies in the future");
      throw new DecryptionException(FAILURE_MESSAGE);
    }
  }

  private static byte[] deriveKey(String passphrase) {
    return ChecksumEnvelope.sha256(passphrase.getBytes(StandardCharsets.UTF_8));
  }

  private static SecretKeySpec encryptionKey(byte[] key) {
    return new SecretKeySpec(key, 16, 16, "AES");
  }

  private static byte[] hmac(byte[] key, byte[] data, int length) throws GeneralSecurityException {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(key, 0, 16, "HmacSHA256"));
    mac.update(data, 0, length);
    return mac.doFinal();
  }
}
