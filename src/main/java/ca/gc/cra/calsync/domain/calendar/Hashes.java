package ca.gc.cra.calsync.domain.calendar;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Hash utilities for identities and fingerprints.
 *
 * @since 0.1.0
 */
public final class Hashes {
  private static final String ALGORITHM = "SHA-256";

  private Hashes() {}

  /**
   * Computes a SHA-256 digest of the UTF-8 encoding of {@code value}.
   *
   * @param value input value; must not be {@code null}
   * @return 64 lower-case hexadecimal characters
   */
  public static String sha256Hex(CharSequence value) {
    byte[] digest = digest(value.toString().getBytes(StandardCharsets.UTF_8));
    StringBuilder hex = new StringBuilder(digest.length * 2);
    for (byte b : digest) {
      hex.append(String.format(Locale.ROOT, "%02x", b & 0xFF));
    }
    return hex.toString();
  }

  private static byte[] digest(byte[] data) {
    try {
      return MessageDigest.getInstance(ALGORITHM).digest(data);
    } catch (NoSuchAlgorithmException ex) {
      // Every JRE is required to ship SHA-256.
      throw new IllegalStateException(ALGORITHM + " not available", ex);
    }
  }
}
