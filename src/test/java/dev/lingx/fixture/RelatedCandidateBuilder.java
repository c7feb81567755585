package dev.lingx.fixture;

import dev.lingx.context.ApprovalStatus;
import dev.lingx.context.CandidateTranslation;
import dev.lingx.context.RelatedCandidate;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight test builder for {@link RelatedCandidate}. Provides sensible defaults so tests only
 * override what they care about.
 *
 * <pre>{@code
 * RelatedCandidate candidate =
 *     new RelatedCandidateBuilder().id("k1").confidence(0.8).approved("fr", "Valider").build();
 * }</pre>
 */
public final class RelatedCandidateBuilder {

  private String id = "key-1";
  private String keyName = "common.button.save";
  private double confidence = 1.0;
  private final List<CandidateTranslation> translations = new ArrayList<>();

  public RelatedCandidateBuilder id(String id) {
    this.id = id;
    return this;
  }

  public RelatedCandidateBuilder keyName(String keyName) {
    this.keyName = keyName;
    return this;
  }

  public RelatedCandidateBuilder confidence(double confidence) {
    this.confidence = confidence;
    return this;
  }

  public RelatedCandidateBuilder translation(
      String language, String value, ApprovalStatus approvalStatus) {
    translations.add(new CandidateTranslation(language, value, approvalStatus));
    return this;
  }

  public RelatedCandidateBuilder pending(String language, String value) {
    return translation(language, value, ApprovalStatus.PENDING);
  }

  public RelatedCandidateBuilder approved(String language, String value) {
    return translation(language, value, ApprovalStatus.APPROVED);
  }

  public RelatedCandidate build() {
    return new RelatedCandidate(id, keyName, confidence, translations);
  }
}
