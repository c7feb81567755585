package dev.lingx.context;

/** Thrown when an analyzer candidate violates a ranking precondition. */
public class InvalidCandidateException extends IllegalArgumentException {

  private final String candidateId;

  public InvalidCandidateException(String candidateId, String message) {
    super(message);
    this.candidateId = candidateId;
  }

  public String getCandidateId() {
    return candidateId;
  }
}
