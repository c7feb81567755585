package dev.lingx.quality;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * A translation's language and its stored quality score; input to {@link QualitySummaryCalculator}.
 */
public record ScoredTranslation(@NotBlank String language, @Min(0) @Max(100) int score) {}
