package dev.lingx.context;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A related key selected for an AI translation prompt.
 *
 * @param keyName the related key name
 * @param translations language to translated value, in the candidate's translation order
 * @param relationshipType why the key is related
 * @param confidence analyzer confidence of the relationship
 * @param approved whether the target-language translation is approved
 */
public record AiContextTranslation(
    String keyName,
    Map<String, String> translations,
    RelationshipType relationshipType,
    double confidence,
    boolean approved) {

  public @Nullable String valueIn(String language) {
    return translations.get(language);
  }

  /** True when both languages have a non-empty value. */
  public boolean hasBoth(String sourceLanguage, String targetLanguage) {
    String source = valueIn(sourceLanguage);
    String target = valueIn(targetLanguage);
    return source != null && !source.isEmpty() && target != null && !target.isEmpty();
  }
}
