package dev.lingx.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** Request body for classifying a quality score; the score is required and must lie in [0, 100]. */
public record ClassifyRequest(@NotNull @Min(0) @Max(100) Integer score) {}
