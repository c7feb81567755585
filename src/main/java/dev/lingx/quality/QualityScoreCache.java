package dev.lingx.quality;

import java.util.Optional;

/** Storage port for cached quality scores, keyed by translation id. */
public interface QualityScoreCache {

  Optional<CachedQualityScore> find(String translationId);

  void put(String translationId, CachedQualityScore score);

  void evict(String translationId);
}
