package dev.lingx.context;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/**
 * One existing translation of a related key.
 *
 * @param language the locale code (e.g. {@code "fr"})
 * @param value the translated text
 * @param approvalStatus the review state of this translation
 */
public record CandidateTranslation(
    @NotBlank String language, @Nullable String value, @NotNull ApprovalStatus approvalStatus) {

  public boolean isApprovedIn(String targetLanguage) {
    return approvalStatus == ApprovalStatus.APPROVED && targetLanguage.equals(language);
  }
}
