package dev.lingx.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the related-key context for an AI translation of one key.
 *
 * <p>Pipeline: drop candidates with invalid confidence (logged) -> keep candidates that already
 * have a translation in the target language -> rank with {@link ContextSelector} -> keep the top
 * {@code lingx.context.max-related} -> render the prompt (structured XML unless the legacy
 * format is requested).
 */
@Service
public class AiContextService {

  private static final Logger log = LoggerFactory.getLogger(AiContextService.class);

  private final ContextSelector selector;
  private final ContextPromptFormatter formatter;
  private final int maxRelated;

  public AiContextService(
      ContextSelector selector, ContextPromptFormatter formatter, ContextProperties properties) {
    this.selector = selector;
    this.formatter = formatter;
    this.maxRelated = properties.getMaxRelated();
  }

  /**
   * Selects and formats related translations for an AI translation call.
   *
   * @param buckets related candidates grouped by relationship type
   * @param sourceLanguage the project's source locale
   * @param targetLanguage the locale being translated into
   * @return the selected translations and the structured prompt
   */
  public AiContext getAiContext(
      RelatedCandidateBuckets buckets, String sourceLanguage, String targetLanguage) {
    return getAiContext(buckets, sourceLanguage, targetLanguage, PromptFormat.STRUCTURED);
  }

  /**
   * Same as {@link #getAiContext(RelatedCandidateBuckets, String, String)} with a choice of prompt
   * rendering.
   */
  public AiContext getAiContext(
      RelatedCandidateBuckets buckets,
      String sourceLanguage,
      String targetLanguage,
      PromptFormat format) {
    RelatedCandidateBuckets eligible = eligibleCandidates(buckets, targetLanguage);

    List<AiContextTranslation> related =
        selector.rank(eligible, targetLanguage).stream()
            .limit(maxRelated)
            .map(scored -> toContextTranslation(scored, targetLanguage))
            .toList();

    log.debug(
        "Selected {} of {} related keys for {} -> {}",
        related.size(),
        buckets.size(),
        sourceLanguage,
        targetLanguage);

    String prompt =
        format == PromptFormat.LEGACY
            ? formatter.legacy(related, sourceLanguage, targetLanguage)
            : formatter.structured(related, sourceLanguage, targetLanguage);
    return new AiContext(related, prompt);
  }

  /**
   * Ranks all candidates with confidence in [0, 1], dropping the others with a warning. Unlike
   * {@link #getAiContext}, candidates without a target translation are kept.
   */
  public List<ScoredCandidate> rank(
      RelatedCandidateBuckets buckets, @Nullable String targetLanguage) {
    return selector.rank(validCandidates(buckets), targetLanguage);
  }

  RelatedCandidateBuckets eligibleCandidates(
      RelatedCandidateBuckets buckets, String targetLanguage) {
    RelatedCandidateBuckets valid = validCandidates(buckets);
    return new RelatedCandidateBuckets(
        withTarget(valid.nearby(), targetLanguage),
        withTarget(valid.keyPattern(), targetLanguage),
        withTarget(valid.sameComponent(), targetLanguage),
        withTarget(valid.sameFile(), targetLanguage),
        withTarget(valid.semantic(), targetLanguage));
  }

  private RelatedCandidateBuckets validCandidates(RelatedCandidateBuckets buckets) {
    return new RelatedCandidateBuckets(
        valid(buckets.nearby()),
        valid(buckets.keyPattern()),
        valid(buckets.sameComponent()),
        valid(buckets.sameFile()),
        valid(buckets.semantic()));
  }

  private List<RelatedCandidate> valid(List<RelatedCandidate> candidates) {
    List<RelatedCandidate> result = new ArrayList<>(candidates.size());
    for (RelatedCandidate candidate : candidates) {
      try {
        result.add(CandidateValidator.requireValidConfidence(candidate));
      } catch (InvalidCandidateException e) {
        log.warn("Dropping related key {} from AI context: {}", e.getCandidateId(), e.getMessage());
      }
    }
    return result;
  }

  private static List<RelatedCandidate> withTarget(
      List<RelatedCandidate> candidates, String targetLanguage) {
    return candidates.stream().filter(c -> c.hasTranslationIn(targetLanguage)).toList();
  }

  private static AiContextTranslation toContextTranslation(
      ScoredCandidate scored, String targetLanguage) {
    RelatedCandidate candidate = scored.candidate();
    Map<String, String> translations = new LinkedHashMap<>();
    candidate.translations().forEach(t -> translations.put(t.language(), t.value()));
    return new AiContextTranslation(
        candidate.keyName(),
        Collections.unmodifiableMap(translations),
        scored.relationshipType(),
        candidate.confidence(),
        candidate.isApprovedIn(targetLanguage));
  }
}
