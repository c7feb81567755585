package dev.lingx.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure static utility aggregating stored quality scores into a {@link QualitySummary}.
 *
 * <p>Bands are fixed (excellent {@code >= 80}, good {@code 60..79}, needs review {@code < 60})
 * and independent of project thresholds. Averages are rounded half up.
 */
public final class QualitySummaryCalculator {

  static final int EXCELLENT_MIN = 80;
  static final int GOOD_MIN = 60;

  private QualitySummaryCalculator() {}

  /**
   * @param scored the scored translations
   * @param totalTranslations the number of non-empty translations in the branch
   * @return the summary; languages ordered alphabetically
   */
  public static QualitySummary summarize(List<ScoredTranslation> scored, int totalTranslations) {
    int excellent = 0;
    int good = 0;
    int needsReview = 0;
    long total = 0;
    Map<String, long[]> perLanguage = new TreeMap<>();

    for (ScoredTranslation t : scored) {
      int score = t.score();
      if (score >= EXCELLENT_MIN) {
        excellent++;
      } else if (score >= GOOD_MIN) {
        good++;
      } else {
        needsReview++;
      }
      total += score;
      long[] sumAndCount = perLanguage.computeIfAbsent(t.language(), k -> new long[2]);
      sumAndCount[0] += score;
      sumAndCount[1]++;
    }

    Map<String, QualitySummary.LanguageStats> byLanguage = new LinkedHashMap<>();
    perLanguage.forEach(
        (language, sumAndCount) ->
            byLanguage.put(
                language,
                new QualitySummary.LanguageStats(
                    roundedMean(sumAndCount[0], sumAndCount[1]), (int) sumAndCount[1])));

    return new QualitySummary(
        roundedMean(total, scored.size()),
        new QualitySummary.Distribution(excellent, good, needsReview),
        Collections.unmodifiableMap(byLanguage),
        scored.size(),
        totalTranslations);
  }

  private static int roundedMean(long sum, long count) {
    if (count == 0) {
      return 0;
    }
    return (int) Math.round((double) sum / count);
  }
}
