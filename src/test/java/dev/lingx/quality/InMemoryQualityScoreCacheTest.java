package dev.lingx.quality;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryQualityScoreCacheTest {

  private final InMemoryQualityScoreCache cache = new InMemoryQualityScoreCache();

  @Test
  void findReturnsEmptyForUnknownTranslation() {
    assertThat(cache.find("missing")).isEmpty();
  }

  @Test
  void putReplacesPreviousEntry() {
    Instant at = Instant.parse("2026-01-01T00:00:00Z");
    cache.put("t1", new CachedQualityScore("aaaaaaaaaaaaaaaa", 50, at));
    cache.put("t1", new CachedQualityScore("bbbbbbbbbbbbbbbb", 90, at));

    assertThat(cache.find("t1")).contains(new CachedQualityScore("bbbbbbbbbbbbbbbb", 90, at));
  }

  @Test
  void evictRemovesEntry() {
    cache.put("t1", new CachedQualityScore("aaaaaaaaaaaaaaaa", 50, Instant.EPOCH));

    cache.evict("t1");

    assertThat(cache.find("t1")).isEmpty();
  }
}
