package dev.lingx.api;

import dev.lingx.context.AiContext;
import dev.lingx.context.AiContextService;
import dev.lingx.context.ScoredCandidate;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST adapter for related-key ranking and AI context building. */
@RestController
@RequestMapping("/api/context")
public class ContextController {

  private final AiContextService aiContextService;

  public ContextController(AiContextService aiContextService) {
    this.aiContextService = aiContextService;
  }

  @PostMapping("/ai-context")
  public AiContext aiContext(@Valid @RequestBody AiContextRequest request) {
    return aiContextService.getAiContext(
        request.buckets(),
        request.sourceLanguage(),
        request.targetLanguage(),
        request.promptFormatOrDefault());
  }

  @PostMapping("/rank")
  public List<ScoredCandidate> rank(@Valid @RequestBody RankRequest request) {
    return aiContextService.rank(request.buckets(), request.targetLanguage());
  }
}
