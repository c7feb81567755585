package dev.lingx.quality;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.jspecify.annotations.Nullable;

/**
 * Partial update of a project's {@link QualityConfig}. Null fields keep their current value.
 *
 * <p>Range annotations reject out-of-range thresholds at the REST boundary; {@link
 * QualityConfigService} re-checks the merged config, including threshold ordering.
 */
public record QualityConfigUpdate(
    @Nullable Boolean scoreAfterAiTranslation,
    @Nullable Boolean scoreBeforeMerge,
    @Nullable @Min(0) @Max(100) Integer autoApproveThreshold,
    @Nullable @Min(0) @Max(100) Integer flagThreshold,
    @Nullable Boolean aiEvaluationEnabled,
    @Nullable String aiEvaluationProvider,
    @Nullable String aiEvaluationModel) {

  /** Returns {@code current} with every non-null field of this update applied. */
  public QualityConfig applyTo(QualityConfig current) {
    return new QualityConfig(
        scoreAfterAiTranslation != null
            ? scoreAfterAiTranslation
            : current.scoreAfterAiTranslation(),
        scoreBeforeMerge != null ? scoreBeforeMerge : current.scoreBeforeMerge(),
        autoApproveThreshold != null ? autoApproveThreshold : current.autoApproveThreshold(),
        flagThreshold != null ? flagThreshold : current.flagThreshold(),
        aiEvaluationEnabled != null ? aiEvaluationEnabled : current.aiEvaluationEnabled(),
        aiEvaluationProvider != null ? aiEvaluationProvider : current.aiEvaluationProvider(),
        aiEvaluationModel != null ? aiEvaluationModel : current.aiEvaluationModel());
  }
}
