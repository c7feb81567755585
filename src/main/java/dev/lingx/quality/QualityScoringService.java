package dev.lingx.quality;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Cache-aware quality scoring for translations.
 *
 * <p>For each request: fingerprint the pair, return the cached score if its fingerprint still
 * matches, otherwise ask the {@link QualityEvaluator} for a fresh score and store it. Either way
 * the score is classified with the project's current thresholds, so a threshold change applies to
 * cached scores too.
 *
 * <p>The evaluator is optional. Without one, cache hits still resolve but a miss throws.
 */
@Service
public class QualityScoringService {

  private static final Logger log = LoggerFactory.getLogger(QualityScoringService.class);

  private final QualityScoreCache cache;
  private final QualityConfigService configService;
  private final @Nullable QualityEvaluator evaluator;
  private final int batchSize;
  private final Clock clock;

  @Autowired
  public QualityScoringService(
      QualityScoreCache cache,
      QualityConfigService configService,
      ObjectProvider<QualityEvaluator> evaluator,
      QualityProperties properties,
      Clock clock) {
    this(
        cache,
        configService,
        evaluator.getIfAvailable(),
        properties.getEvaluationBatchSize(),
        clock);
  }

  QualityScoringService(
      QualityScoreCache cache,
      QualityConfigService configService,
      @Nullable QualityEvaluator evaluator,
      int batchSize,
      Clock clock) {
    this.cache = cache;
    this.configService = configService;
    this.evaluator = evaluator;
    this.batchSize = batchSize;
    this.clock = clock;
  }

  /**
   * Scores one translation, reusing the cached score while the text pair is unchanged.
   *
   * @param request the translation pair
   * @return the score, its decision, and whether it came from the cache
   * @throws EvaluatorUnavailableException if evaluation is needed but no evaluator is configured
   * @throws IllegalStateException if the evaluator returns a score outside [0, 100]
   */
  public QualityAssessment score(QualityScoringRequest request) {
    QualityConfig config = configService.getConfig(request.projectId());
    String fingerprint = ContentHasher.fingerprint(request.sourceText(), request.targetText());
    Optional<CachedQualityScore> cached = cache.find(request.translationId());

    if (cached.isPresent()) {
      if (ScoreCacheValidator.isValid(cached.get(), request.sourceText(), request.targetText())) {
        int score = cached.get().score();
        log.debug(
            "Cache hit for {}/{}: score={}",
            request.translationId(),
            request.targetLanguage(),
            score);
        return assess(request, score, config, true, fingerprint);
      }
      log.debug(
          "Cache miss (content changed) for {}/{}",
          request.translationId(),
          request.targetLanguage());
    } else {
      log.debug(
          "No cached score for {}/{} (first evaluation)",
          request.translationId(),
          request.targetLanguage());
    }

    int score = evaluate(request, config);
    cache.put(request.translationId(), new CachedQualityScore(fingerprint, score, clock.instant()));
    QualityAssessment assessment = assess(request, score, config, false, fingerprint);
    log.info(
        "Scored translation {} ({} -> {}): score={} decision={}",
        request.translationId(),
        request.sourceLanguage(),
        request.targetLanguage(),
        score,
        assessment.decision());
    return assessment;
  }

  /**
   * Scores many translations in chunks of {@code lingx.quality.evaluation-batch-size}. A failing
   * translation is logged and left out of the result; the others are still scored.
   *
   * @param requests the translation pairs
   * @return assessments keyed by translation id, in request order
   */
  public Map<String, QualityAssessment> scoreBatch(List<QualityScoringRequest> requests) {
    Map<String, QualityAssessment> results = new LinkedHashMap<>();
    for (int start = 0; start < requests.size(); start += batchSize) {
      List<QualityScoringRequest> chunk =
          requests.subList(start, Math.min(start + batchSize, requests.size()));
      for (QualityScoringRequest request : chunk) {
        try {
          results.put(request.translationId(), score(request));
        } catch (RuntimeException e) {
          log.error(
              "Failed to evaluate translation {}: {}", request.translationId(), e.getMessage(), e);
        }
      }
      log.debug(
          "Scored {}/{} translations",
          Math.min(start + batchSize, requests.size()),
          requests.size());
    }
    return results;
  }

  /** Drops the cached score of a translation so the next {@link #score} re-evaluates it. */
  public void invalidate(String translationId) {
    cache.evict(translationId);
  }

  private int evaluate(QualityScoringRequest request, QualityConfig config) {
    if (evaluator == null) {
      throw new EvaluatorUnavailableException(request.translationId());
    }
    int score = evaluator.evaluate(request, config);
    if (score < 0 || score > 100) {
      throw new IllegalStateException(
          "Evaluator returned score outside [0, 100] for translation "
              + request.translationId()
              + ": "
              + score);
    }
    return score;
  }

  private static QualityAssessment assess(
      QualityScoringRequest request,
      int score,
      QualityConfig config,
      boolean cached,
      String fingerprint) {
    return new QualityAssessment(
        request.translationId(),
        score,
        QualityThresholdPolicy.classify(score, config),
        cached,
        fingerprint);
  }
}
