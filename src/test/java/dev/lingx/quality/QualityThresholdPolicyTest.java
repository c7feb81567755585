package dev.lingx.quality;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QualityThresholdPolicyTest {

  @ParameterizedTest
  @CsvSource({
    "100, AUTO_APPROVE",
    "85, AUTO_APPROVE",
    "80, AUTO_APPROVE",
    "79, DEFAULT",
    "60, DEFAULT",
    "59, FLAG",
    "0, FLAG"
  })
  void classifiesWithDefaultThresholds(int score, QualityDecision expected) {
    assertThat(QualityThresholdPolicy.classify(score, QualityConfig.DEFAULTS)).isEqualTo(expected);
  }

  @Test
  void customThresholdsAreRespected() {
    var config = new QualityConfig(true, false, 95, 40, true, null, null);

    assertThat(QualityThresholdPolicy.classify(94, config)).isEqualTo(QualityDecision.DEFAULT);
    assertThat(QualityThresholdPolicy.classify(95, config)).isEqualTo(QualityDecision.AUTO_APPROVE);
    assertThat(QualityThresholdPolicy.classify(40, config)).isEqualTo(QualityDecision.DEFAULT);
    assertThat(QualityThresholdPolicy.classify(39, config)).isEqualTo(QualityDecision.FLAG);
  }

  @Test
  void equalThresholdsLeaveNoDefaultBand() {
    var config = new QualityConfig(true, false, 70, 70, true, null, null);

    assertThat(QualityThresholdPolicy.classify(70, config)).isEqualTo(QualityDecision.AUTO_APPROVE);
    assertThat(QualityThresholdPolicy.classify(69, config)).isEqualTo(QualityDecision.FLAG);
  }

  @Test
  void invertedThresholdsAreClassifiedLiterally() {
    // flag 80 > autoApprove 60: auto-approve comparison runs first
    var config = new QualityConfig(true, false, 60, 80, true, null, null);

    assertThat(QualityThresholdPolicy.classify(70, config)).isEqualTo(QualityDecision.AUTO_APPROVE);
    assertThat(QualityThresholdPolicy.classify(59, config)).isEqualTo(QualityDecision.FLAG);
  }
}
