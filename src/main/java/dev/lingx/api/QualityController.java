package dev.lingx.api;

import dev.lingx.quality.ContentHasher;
import dev.lingx.quality.QualityAssessment;
import dev.lingx.quality.QualityConfig;
import dev.lingx.quality.QualityConfigService;
import dev.lingx.quality.QualityConfigUpdate;
import dev.lingx.quality.QualityScoringService;
import dev.lingx.quality.QualitySummary;
import dev.lingx.quality.QualitySummaryCalculator;
import dev.lingx.quality.QualityThresholdPolicy;
import dev.lingx.quality.ScoreCacheValidator;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for per-project quality configuration, cache-aware scoring, score classification,
 * score-cache validation and branch summaries.
 */
@RestController
@RequestMapping("/api")
public class QualityController {

  private final QualityConfigService configService;
  private final QualityScoringService scoringService;

  public QualityController(
      QualityConfigService configService, QualityScoringService scoringService) {
    this.configService = configService;
    this.scoringService = scoringService;
  }

  @GetMapping("/projects/{projectId}/quality/config")
  public QualityConfig getConfig(@PathVariable String projectId) {
    return configService.getConfig(projectId);
  }

  @PutMapping("/projects/{projectId}/quality/config")
  public QualityConfig updateConfig(
      @PathVariable String projectId, @Valid @RequestBody QualityConfigUpdate update) {
    return configService.updateConfig(projectId, update);
  }

  @PostMapping("/projects/{projectId}/quality/classify")
  public ClassifyResponse classify(
      @PathVariable String projectId, @Valid @RequestBody ClassifyRequest request) {
    QualityConfig config = configService.getConfig(projectId);
    return new ClassifyResponse(
        request.score(), QualityThresholdPolicy.classify(request.score(), config));
  }

  @PostMapping("/translations/{translationId}/quality")
  public QualityAssessment score(
      @PathVariable String translationId, @Valid @RequestBody TranslationQualityRequest request) {
    return scoringService.score(request.toScoringRequest(translationId));
  }

  @PostMapping("/projects/{projectId}/quality/batch")
  public Map<String, QualityAssessment> scoreBatch(
      @PathVariable String projectId, @Valid @RequestBody BatchQualityRequest request) {
    return scoringService.scoreBatch(request.toScoringRequests(projectId));
  }

  @DeleteMapping("/translations/{translationId}/quality/cache")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void invalidate(@PathVariable String translationId) {
    scoringService.invalidate(translationId);
  }

  @PostMapping("/quality/cache/validate")
  public CacheValidationResponse validateCache(@RequestBody CacheValidationRequest request) {
    return new CacheValidationResponse(
        ScoreCacheValidator.isValid(
            request.fingerprint(), request.sourceText(), request.targetText()),
        ContentHasher.fingerprint(request.sourceText(), request.targetText()));
  }

  @PostMapping("/quality/summary")
  public QualitySummary summarize(@Valid @RequestBody QualitySummaryRequest request) {
    return QualitySummaryCalculator.summarize(request.scores(), request.totalTranslations());
  }
}
