package dev.lingx.quality;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Thread-safe in-memory {@link QualityScoreCache}. Contents are lost on restart. */
@Repository
public class InMemoryQualityScoreCache implements QualityScoreCache {

  private final ConcurrentHashMap<String, CachedQualityScore> scores = new ConcurrentHashMap<>();

  @Override
  public Optional<CachedQualityScore> find(String translationId) {
    return Optional.ofNullable(scores.get(translationId));
  }

  @Override
  public void put(String translationId, CachedQualityScore score) {
    scores.put(translationId, score);
  }

  @Override
  public void evict(String translationId) {
    scores.remove(translationId);
  }
}
