package dev.lingx.context;

/**
 * A related candidate tagged with the relationship type of the bucket it came from and its
 * relevance score. Created by {@link ContextSelector}; not persisted.
 *
 * @param candidate the untouched analyzer candidate
 * @param relationshipType the bucket's relationship type
 * @param score the relevance score from {@link RelevanceScorer}
 */
public record ScoredCandidate(
    RelatedCandidate candidate, RelationshipType relationshipType, double score) {

  public String id() {
    return candidate.id();
  }
}
