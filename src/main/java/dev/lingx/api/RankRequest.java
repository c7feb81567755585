package dev.lingx.api;

import dev.lingx.context.RelatedCandidateBuckets;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/** Request body for {@code POST /api/context/rank}; without a target language no boost applies. */
public record RankRequest(
    @Nullable String targetLanguage, @NotNull @Valid RelatedCandidateBuckets buckets) {}
