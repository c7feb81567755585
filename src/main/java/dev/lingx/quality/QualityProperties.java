package dev.lingx.quality;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for quality scoring, bound from {@code lingx.quality.*}.
 *
 * <ul>
 *   <li>{@code evaluation-batch-size} - translations per chunk in batch scoring (default 10, at
 *       least 1)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lingx.quality")
public class QualityProperties {

  private int evaluationBatchSize = 10;

  @PostConstruct
  void validate() {
    if (evaluationBatchSize < 1) {
      throw new IllegalStateException(
          "lingx.quality.evaluation-batch-size must be at least 1, got: " + evaluationBatchSize);
    }
  }

  public int getEvaluationBatchSize() {
    return evaluationBatchSize;
  }

  public void setEvaluationBatchSize(int evaluationBatchSize) {
    this.evaluationBatchSize = evaluationBatchSize;
  }
}
