package dev.lingx.quality;

import org.jspecify.annotations.Nullable;

/**
 * Per-project quality scoring settings.
 *
 * <p>Thresholds are expected in [0, 100] with {@code flagThreshold <= autoApproveThreshold}. The
 * record does not enforce this; {@link QualityConfigService} rejects such configs when saving.
 *
 * @param scoreAfterAiTranslation score translations right after AI translation
 * @param scoreBeforeMerge score translations before a branch merge
 * @param autoApproveThreshold scores at or above this are auto-approved
 * @param flagThreshold scores below this are flagged for review
 * @param aiEvaluationEnabled whether AI evaluation may be used
 * @param aiEvaluationProvider configured AI provider, if any
 * @param aiEvaluationModel configured AI model, if any
 */
public record QualityConfig(
    boolean scoreAfterAiTranslation,
    boolean scoreBeforeMerge,
    int autoApproveThreshold,
    int flagThreshold,
    boolean aiEvaluationEnabled,
    @Nullable String aiEvaluationProvider,
    @Nullable String aiEvaluationModel) {

  /** Applied when a project has no stored config. */
  public static final QualityConfig DEFAULTS =
      new QualityConfig(true, false, 80, 60, true, null, null);
}
