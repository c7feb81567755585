package dev.lingx.quality;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads and updates per-project quality configs. Projects without a stored config get {@link
 * QualityConfig#DEFAULTS}. Updates are merged over the current config and validated before saving,
 * which is where threshold ordering is enforced.
 */
@Service
public class QualityConfigService {

  private static final Logger log = LoggerFactory.getLogger(QualityConfigService.class);

  private final QualityConfigRepository repository;

  public QualityConfigService(QualityConfigRepository repository) {
    this.repository = repository;
  }

  public QualityConfig getConfig(String projectId) {
    return repository.findByProjectId(projectId).orElse(QualityConfig.DEFAULTS);
  }

  /**
   * Applies a partial update to a project's config.
   *
   * @param projectId the project to update
   * @param update fields to change; null fields are kept
   * @return the saved config
   * @throws QualityConfigValidationException if the merged config is invalid
   */
  public QualityConfig updateConfig(String projectId, QualityConfigUpdate update) {
    QualityConfig merged = update.applyTo(getConfig(projectId));
    validate(merged);
    repository.save(projectId, merged);
    log.info(
        "Updated quality config for project {}: autoApprove={} flag={} aiEvaluation={}",
        projectId,
        merged.autoApproveThreshold(),
        merged.flagThreshold(),
        merged.aiEvaluationEnabled());
    return merged;
  }

  /**
   * Checks threshold ranges and ordering.
   *
   * @throws QualityConfigValidationException listing every violation
   */
  static void validate(QualityConfig config) {
    List<String> errors = new ArrayList<>();
    if (config.autoApproveThreshold() < 0 || config.autoApproveThreshold() > 100) {
      errors.add("autoApproveThreshold must be in [0, 100], got: " + config.autoApproveThreshold());
    }
    if (config.flagThreshold() < 0 || config.flagThreshold() > 100) {
      errors.add("flagThreshold must be in [0, 100], got: " + config.flagThreshold());
    }
    if (config.flagThreshold() > config.autoApproveThreshold()) {
      errors.add(
          "flagThreshold (%d) must not exceed autoApproveThreshold (%d)"
              .formatted(config.flagThreshold(), config.autoApproveThreshold()));
    }
    if (!errors.isEmpty()) {
      throw new QualityConfigValidationException(errors);
    }
  }
}
