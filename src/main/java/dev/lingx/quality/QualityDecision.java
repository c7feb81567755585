package dev.lingx.quality;

/**
 * Workflow outcome for a scored translation. A one-shot classification consumed by the approval
 * workflow, not a lifecycle.
 */
public enum QualityDecision {
  /** Score reached the auto-approve threshold: mark the translation approved. */
  AUTO_APPROVE,
  /** Score between the thresholds: leave the approval state unchanged. */
  DEFAULT,
  /** Score below the flag threshold: surface for manual review. */
  FLAG
}
