package dev.lingx.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QualityScoringRequestTest {

  @Test
  void emptyTargetTextIsRejected() {
    assertThatThrownBy(() -> new QualityScoringRequest("t1", "p1", "Hello", "", "en", "fr"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Translation value is empty");
  }

  @Test
  void nullTargetTextIsRejected() {
    assertThatThrownBy(() -> new QualityScoringRequest("t1", "p1", "Hello", null, "en", "fr"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Translation value is empty");
  }

  @Test
  void blankTranslationIdIsRejected() {
    assertThatThrownBy(() -> new QualityScoringRequest(" ", "p1", "Hello", "Bonjour", "en", "fr"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("translationId must not be blank");
  }

  @Test
  void blankProjectIdIsRejected() {
    assertThatThrownBy(() -> new QualityScoringRequest("t1", "", "Hello", "Bonjour", "en", "fr"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("projectId must not be blank");
  }

  @Test
  void nullSourceTextBecomesEmpty() {
    var request = new QualityScoringRequest("t1", "p1", null, "Bonjour", "en", "fr");

    assertThat(request.sourceText()).isEmpty();
  }
}
