package dev.lingx.quality;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.jspecify.annotations.Nullable;

/**
 * Static utility computing the content fingerprint that tags a cached quality score.
 *
 * <p>The fingerprint is the first 16 lowercase hex characters (64 bits) of the SHA-256 digest of
 * {@code source + "|" + target}. Two caveats are kept for compatibility with stored scores:
 *
 * <ul>
 *   <li>64 bits leaves a small but non-zero collision probability across a large cache.
 *   <li>The delimiter is not escaped, so {@code ("a|b", "c")} and {@code ("a", "b|c")} share a
 *       fingerprint.
 * </ul>
 */
public final class ContentHasher {

  /** Number of hex characters kept from the digest. */
  public static final int FINGERPRINT_LENGTH = 16;

  static final String DELIMITER = "|";

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the fingerprint of a source/target translation pair. Null text counts as empty.
   *
   * @param sourceText the source-language text
   * @param targetText the translated text
   * @return 16 lowercase hex characters
   */
  public static String fingerprint(@Nullable String sourceText, @Nullable String targetText) {
    String source = sourceText == null ? "" : sourceText;
    String target = targetText == null ? "" : targetText;
    return sha256(source + DELIMITER + target).substring(0, FINGERPRINT_LENGTH);
  }

  /**
   * Compute the SHA-256 hash of the given content.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
