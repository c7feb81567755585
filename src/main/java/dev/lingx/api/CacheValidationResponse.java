package dev.lingx.api;

/**
 * @param valid whether the cached score still applies
 * @param fingerprint the fingerprint of the current text pair
 */
public record CacheValidationResponse(boolean valid, String fingerprint) {}
