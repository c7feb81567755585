package dev.lingx.quality;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Thread-safe in-memory {@link QualityConfigRepository}. Contents are lost on restart; replace
 * with a persistent adapter by registering another {@code QualityConfigRepository} bean.
 */
@Repository
public class InMemoryQualityConfigRepository implements QualityConfigRepository {

  private final ConcurrentHashMap<String, QualityConfig> configs = new ConcurrentHashMap<>();

  @Override
  public Optional<QualityConfig> findByProjectId(String projectId) {
    return Optional.ofNullable(configs.get(projectId));
  }

  @Override
  public void save(String projectId, QualityConfig config) {
    configs.put(projectId, config);
  }
}
