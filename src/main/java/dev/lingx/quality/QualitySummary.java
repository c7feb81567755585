package dev.lingx.quality;

import java.util.Map;

/**
 * Aggregate quality statistics for a branch.
 *
 * @param averageScore rounded mean score of scored translations (0 when none)
 * @param distribution counts per score band
 * @param byLanguage per-language rounded mean and count
 * @param totalScored number of translations with a score
 * @param totalTranslations number of non-empty translations, scored or not
 */
public record QualitySummary(
    int averageScore,
    Distribution distribution,
    Map<String, LanguageStats> byLanguage,
    int totalScored,
    int totalTranslations) {

  /**
   * @param excellent scores of 80 and above
   * @param good scores from 60 to 79
   * @param needsReview scores below 60
   */
  public record Distribution(int excellent, int good, int needsReview) {}

  public record LanguageStats(int average, int count) {}
}
