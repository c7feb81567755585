package dev.lingx.api;

import dev.lingx.quality.ScoredTranslation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request body for {@code POST /api/quality/summary}.
 *
 * @param scores stored scores of the branch's scored translations
 * @param totalTranslations number of non-empty translations in the branch, scored or not
 */
public record QualitySummaryRequest(
    @NotNull @Valid List<ScoredTranslation> scores, @NotNull @Min(0) Integer totalTranslations) {}
