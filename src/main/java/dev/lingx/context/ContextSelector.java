package dev.lingx.context;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Flattens the analyzer's relationship buckets into a single relevance-ranked sequence.
 *
 * <p>Candidates are tagged in bucket order ({@link RelationshipType} declaration order), scored by
 * {@link RelevanceScorer}, then stably sorted by score descending, so equal scores keep bucket
 * precedence and within-bucket order. No truncation: callers apply their own top-N cutoff.
 */
@Component
public class ContextSelector {

  private final RelevanceScorer scorer;

  public ContextSelector(RelevanceScorer scorer) {
    this.scorer = scorer;
  }

  /**
   * Ranks every candidate of every bucket.
   *
   * @param buckets the five relationship buckets
   * @param targetLanguage the language being translated into (nullable)
   * @return scored candidates sorted by score descending; empty when all buckets are empty
   */
  public List<ScoredCandidate> rank(
      RelatedCandidateBuckets buckets, @Nullable String targetLanguage) {
    List<ScoredCandidate> tagged = new ArrayList<>(buckets.size());
    for (RelationshipType type : RelationshipType.values()) {
      for (RelatedCandidate candidate : buckets.bucket(type)) {
        tagged.add(
            new ScoredCandidate(candidate, type, scorer.score(candidate, type, targetLanguage)));
      }
    }
    // List.sort is a stable merge sort
    tagged.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
    return List.copyOf(tagged);
  }
}
