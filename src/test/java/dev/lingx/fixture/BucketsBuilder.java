package dev.lingx.fixture;

import dev.lingx.context.RelatedCandidate;
import dev.lingx.context.RelatedCandidateBuckets;
import java.util.ArrayList;
import java.util.List;

/** Test builder for {@link RelatedCandidateBuckets}; every bucket starts empty. */
public final class BucketsBuilder {

  private final List<RelatedCandidate> nearby = new ArrayList<>();
  private final List<RelatedCandidate> keyPattern = new ArrayList<>();
  private final List<RelatedCandidate> sameComponent = new ArrayList<>();
  private final List<RelatedCandidate> sameFile = new ArrayList<>();
  private final List<RelatedCandidate> semantic = new ArrayList<>();

  public BucketsBuilder nearby(RelatedCandidate... candidates) {
    nearby.addAll(List.of(candidates));
    return this;
  }

  public BucketsBuilder keyPattern(RelatedCandidate... candidates) {
    keyPattern.addAll(List.of(candidates));
    return this;
  }

  public BucketsBuilder sameComponent(RelatedCandidate... candidates) {
    sameComponent.addAll(List.of(candidates));
    return this;
  }

  public BucketsBuilder sameFile(RelatedCandidate... candidates) {
    sameFile.addAll(List.of(candidates));
    return this;
  }

  public BucketsBuilder semantic(RelatedCandidate... candidates) {
    semantic.addAll(List.of(candidates));
    return this;
  }

  public RelatedCandidateBuckets build() {
    return new RelatedCandidateBuckets(nearby, keyPattern, sameComponent, sameFile, semantic);
  }
}
