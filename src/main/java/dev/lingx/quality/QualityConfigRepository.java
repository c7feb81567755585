package dev.lingx.quality;

import java.util.Optional;

/** Storage port for per-project quality configs. */
public interface QualityConfigRepository {

  Optional<QualityConfig> findByProjectId(String projectId);

  void save(String projectId, QualityConfig config);
}
