package dev.lingx.quality;

/**
 * A translation pair to score.
 *
 * @param translationId the translation being scored; cache key
 * @param projectId the owning project; selects the quality config
 * @param sourceText the source-language text
 * @param targetText the translated text (must not be empty)
 * @param sourceLanguage the source locale
 * @param targetLanguage the target locale
 */
public record QualityScoringRequest(
    String translationId,
    String projectId,
    String sourceText,
    String targetText,
    String sourceLanguage,
    String targetLanguage) {

  /** Compact constructor validating input. */
  public QualityScoringRequest {
    if (translationId == null || translationId.isBlank()) {
      throw new IllegalArgumentException("translationId must not be blank");
    }
    if (projectId == null || projectId.isBlank()) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
    if (targetText == null || targetText.isEmpty()) {
      throw new IllegalArgumentException("Translation value is empty");
    }
    sourceText = sourceText == null ? "" : sourceText;
  }
}
