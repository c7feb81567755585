package dev.lingx.context;

/**
 * Precondition checks applied to analyzer candidates before ranking. The scorer never clamps
 * confidence, so an out-of-range value here points at an analyzer bug.
 */
public final class CandidateValidator {

  private CandidateValidator() {}

  /**
   * Verifies that a candidate's confidence lies in [0, 1].
   *
   * @param candidate the candidate to check
   * @return the same candidate
   * @throws InvalidCandidateException if confidence is NaN or outside [0, 1]
   */
  public static RelatedCandidate requireValidConfidence(RelatedCandidate candidate) {
    double confidence = candidate.confidence();
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new InvalidCandidateException(
          candidate.id(),
          "Candidate " + candidate.id() + " has confidence outside [0, 1]: " + confidence);
    }
    return candidate;
  }
}
