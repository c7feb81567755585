package dev.lingx.quality;

import org.jspecify.annotations.Nullable;

/**
 * Decides whether a cached quality score still applies to a translation pair. Validity is purely
 * content-addressed: there is no expiry, a score stays valid until either text changes.
 */
public final class ScoreCacheValidator {

  private ScoreCacheValidator() {}

  /**
   * @param cachedFingerprint the fingerprint stored with the score (nullable)
   * @param sourceText the current source text
   * @param targetText the current translated text
   * @return true if a fingerprint is present and matches the current pair
   */
  public static boolean isValid(
      @Nullable String cachedFingerprint,
      @Nullable String sourceText,
      @Nullable String targetText) {
    if (cachedFingerprint == null) {
      return false;
    }
    return cachedFingerprint.equals(ContentHasher.fingerprint(sourceText, targetText));
  }

  /** Same as {@link #isValid(String, String, String)} for a possibly absent cache entry. */
  public static boolean isValid(
      @Nullable CachedQualityScore cached,
      @Nullable String sourceText,
      @Nullable String targetText) {
    return cached != null && isValid(cached.fingerprint(), sourceText, targetText);
  }
}
