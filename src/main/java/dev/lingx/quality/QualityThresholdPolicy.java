package dev.lingx.quality;

/**
 * Maps a 0-100 quality score to a {@link QualityDecision} using a project's thresholds.
 *
 * <p>{@code score >= autoApprove -> AUTO_APPROVE}, else {@code score < flag -> FLAG}, else {@code
 * DEFAULT}. A score equal to the flag threshold is {@code DEFAULT}. Threshold ordering is not
 * checked here; with an inverted config the auto-approve comparison wins.
 */
public final class QualityThresholdPolicy {

  private QualityThresholdPolicy() {}

  public static QualityDecision classify(int score, QualityConfig config) {
    if (score >= config.autoApproveThreshold()) {
      return QualityDecision.AUTO_APPROVE;
    }
    if (score < config.flagThreshold()) {
      return QualityDecision.FLAG;
    }
    return QualityDecision.DEFAULT;
  }
}
