package dev.lingx.api;

import dev.lingx.context.PromptFormat;
import dev.lingx.context.RelatedCandidateBuckets;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/**
 * Request body for {@code POST /api/context/ai-context}.
 *
 * @param sourceLanguage the project's source locale
 * @param targetLanguage the locale being translated into
 * @param buckets related candidates from the relationship analyzer
 * @param promptFormat prompt rendering; structured when absent
 */
public record AiContextRequest(
    @NotBlank String sourceLanguage,
    @NotBlank String targetLanguage,
    @NotNull @Valid RelatedCandidateBuckets buckets,
    @Nullable PromptFormat promptFormat) {

  public PromptFormat promptFormatOrDefault() {
    return promptFormat == null ? PromptFormat.STRUCTURED : promptFormat;
  }
}
