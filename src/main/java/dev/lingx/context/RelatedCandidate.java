package dev.lingx.context;

import jakarta.validation.Valid;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A key reported as related by the relationship analyzer, with its existing translations.
 *
 * <p>Produced fresh per request and never mutated. {@code confidence} is expected in [0, 1]; see
 * {@link CandidateValidator}.
 *
 * @param id the related key identifier
 * @param keyName the related key name (e.g. {@code "checkout.button.submit"}); the id when absent
 * @param confidence analyzer-supplied strength of the relationship
 * @param translations existing translations, in analyzer order
 */
public record RelatedCandidate(
    String id,
    @Nullable String keyName,
    double confidence,
    @Valid List<CandidateTranslation> translations) {

  /** Compact constructor validating the id and defaulting the key name. */
  public RelatedCandidate {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Related candidate id must not be blank");
    }
    keyName = keyName == null || keyName.isBlank() ? id : keyName;
    translations = translations == null ? List.of() : List.copyOf(translations);
  }

  /** Returns true if any translation targets {@code language}. */
  public boolean hasTranslationIn(String language) {
    return translations.stream().anyMatch(t -> language.equals(t.language()));
  }

  /** Returns true if a translation in {@code targetLanguage} is approved; false for null. */
  public boolean isApprovedIn(@Nullable String targetLanguage) {
    if (targetLanguage == null) {
      return false;
    }
    return translations.stream().anyMatch(t -> t.isApprovedIn(targetLanguage));
  }
}
