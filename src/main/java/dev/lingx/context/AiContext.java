package dev.lingx.context;

import java.util.List;

/**
 * Context handed to an AI translation call.
 *
 * @param relatedTranslations ranked related keys, at most {@code lingx.context.max-related}
 * @param contextPrompt rendered prompt, empty when no related key has both languages
 */
public record AiContext(List<AiContextTranslation> relatedTranslations, String contextPrompt) {

  public AiContext {
    relatedTranslations =
        relatedTranslations == null ? List.of() : List.copyOf(relatedTranslations);
  }
}
