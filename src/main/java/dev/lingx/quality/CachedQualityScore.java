package dev.lingx.quality;

import java.time.Instant;

/**
 * A stored quality score tagged with the fingerprint of the text pair it was computed for.
 *
 * @param fingerprint {@link ContentHasher#fingerprint} of the scored pair
 * @param score the 0-100 quality score
 * @param computedAt when the score was computed
 */
public record CachedQualityScore(String fingerprint, int score, Instant computedAt) {}
