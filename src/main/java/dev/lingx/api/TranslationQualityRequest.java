package dev.lingx.api;

import dev.lingx.quality.QualityScoringRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.jspecify.annotations.Nullable;

/**
 * Request body for {@code POST /api/translations/{translationId}/quality}.
 *
 * @param projectId the owning project; selects the quality config
 * @param sourceText the source-language text
 * @param targetText the translated text
 * @param sourceLanguage the source locale
 * @param targetLanguage the target locale
 */
public record TranslationQualityRequest(
    @NotBlank String projectId,
    @Nullable String sourceText,
    @NotEmpty String targetText,
    @NotBlank String sourceLanguage,
    @NotBlank String targetLanguage) {

  QualityScoringRequest toScoringRequest(String translationId) {
    return new QualityScoringRequest(
        translationId, projectId, sourceText, targetText, sourceLanguage, targetLanguage);
  }
}
