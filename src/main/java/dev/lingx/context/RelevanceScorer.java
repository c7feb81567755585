package dev.lingx.context;

import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Scores a related candidate for inclusion in an AI translation context.
 *
 * <p>{@code score = weight(type) * confidence * boost}, where {@code boost} is the approved boost
 * when the candidate already has an approved translation in the target language, else 1.0.
 * Confidence is used as given; validation happens before ranking.
 */
@Component
public class RelevanceScorer {

  private final RelationshipPriorities priorities;

  public RelevanceScorer(RelationshipPriorities priorities) {
    this.priorities = priorities;
  }

  /**
   * Computes the relevance score of one candidate.
   *
   * @param candidate the related candidate
   * @param relationshipType the candidate's relationship type (nullable; unknown falls back to 0.5)
   * @param targetLanguage the language being translated into (nullable; disables the boost)
   * @return the relevance score
   */
  public double score(
      RelatedCandidate candidate,
      @Nullable RelationshipType relationshipType,
      @Nullable String targetLanguage) {
    double boost = candidate.isApprovedIn(targetLanguage) ? priorities.approvedBoost() : 1.0;
    return priorities.weightOf(relationshipType) * candidate.confidence() * boost;
  }
}
