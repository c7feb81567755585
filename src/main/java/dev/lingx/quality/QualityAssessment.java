package dev.lingx.quality;

/**
 * Outcome of scoring one translation.
 *
 * @param translationId the scored translation
 * @param score the 0-100 quality score
 * @param decision the workflow decision for the score under the project's current thresholds
 * @param cached true if the score came from a still-valid cache entry
 * @param fingerprint the fingerprint of the scored pair
 */
public record QualityAssessment(
    String translationId,
    int score,
    QualityDecision decision,
    boolean cached,
    String fingerprint) {}
