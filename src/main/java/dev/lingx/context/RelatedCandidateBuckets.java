package dev.lingx.context;

import jakarta.validation.Valid;
import java.util.List;

/**
 * The five per-relationship candidate lists emitted by the relationship analyzer. Each list is
 * assumed deduplicated and bounded by the caller.
 */
public record RelatedCandidateBuckets(
    @Valid List<RelatedCandidate> nearby,
    @Valid List<RelatedCandidate> keyPattern,
    @Valid List<RelatedCandidate> sameComponent,
    @Valid List<RelatedCandidate> sameFile,
    @Valid List<RelatedCandidate> semantic) {

  private static final RelatedCandidateBuckets EMPTY =
      new RelatedCandidateBuckets(List.of(), List.of(), List.of(), List.of(), List.of());

  public RelatedCandidateBuckets {
    nearby = copy(nearby);
    keyPattern = copy(keyPattern);
    sameComponent = copy(sameComponent);
    sameFile = copy(sameFile);
    semantic = copy(semantic);
  }

  public static RelatedCandidateBuckets empty() {
    return EMPTY;
  }

  /** Returns the bucket holding candidates of the given relationship type. */
  public List<RelatedCandidate> bucket(RelationshipType type) {
    return switch (type) {
      case NEARBY -> nearby;
      case KEY_PATTERN -> keyPattern;
      case SAME_COMPONENT -> sameComponent;
      case SAME_FILE -> sameFile;
      case SEMANTIC -> semantic;
    };
  }

  /** Total number of candidates across all buckets. */
  public int size() {
    return nearby.size() + keyPattern.size() + sameComponent.size() + sameFile.size()
        + semantic.size();
  }

  private static List<RelatedCandidate> copy(List<RelatedCandidate> candidates) {
    return candidates == null ? List.of() : List.copyOf(candidates);
  }
}
