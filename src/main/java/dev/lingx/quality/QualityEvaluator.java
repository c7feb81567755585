package dev.lingx.quality;

/**
 * Computes a fresh 0-100 quality score for a translation pair (heuristics, AI, or both). Only
 * called on a cache miss.
 */
public interface QualityEvaluator {

  /**
   * @param request the pair to evaluate
   * @param config the project's quality config (AI provider and model, if any)
   * @return a score in [0, 100]
   */
  int evaluate(QualityScoringRequest request, QualityConfig config);
}
