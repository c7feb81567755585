package dev.lingx.api;

import dev.lingx.quality.QualityScoringRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Request body for {@code POST /api/projects/{projectId}/quality/batch}. */
public record BatchQualityRequest(@NotEmpty @Valid List<Item> translations) {

  List<QualityScoringRequest> toScoringRequests(String projectId) {
    return translations.stream().map(item -> item.toScoringRequest(projectId)).toList();
  }

  /** One translation pair to score. */
  public record Item(
      @NotBlank String translationId,
      @Nullable String sourceText,
      @NotEmpty String targetText,
      @NotBlank String sourceLanguage,
      @NotBlank String targetLanguage) {

    QualityScoringRequest toScoringRequest(String projectId) {
      return new QualityScoringRequest(
          translationId, projectId, sourceText, targetText, sourceLanguage, targetLanguage);
    }
  }
}
