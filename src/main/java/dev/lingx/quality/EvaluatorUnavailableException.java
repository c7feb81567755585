package dev.lingx.quality;

/** Thrown when a translation needs a fresh score but no {@link QualityEvaluator} is configured. */
public class EvaluatorUnavailableException extends IllegalStateException {

  public EvaluatorUnavailableException(String translationId) {
    super("No QualityEvaluator configured; cannot score translation " + translationId);
  }
}
