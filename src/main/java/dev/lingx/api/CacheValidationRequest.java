package dev.lingx.api;

import org.jspecify.annotations.Nullable;

/**
 * Request body for {@code POST /api/quality/cache/validate}.
 *
 * @param fingerprint the fingerprint stored with a cached score, or null when nothing is cached
 * @param sourceText the current source text
 * @param targetText the current translated text
 */
public record CacheValidationRequest(
    @Nullable String fingerprint, @Nullable String sourceText, @Nullable String targetText) {}
