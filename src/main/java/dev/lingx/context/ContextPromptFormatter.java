package dev.lingx.context;

import dev.langchain4j.model.input.PromptTemplate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders selected related translations as prompt text for an AI translation call.
 *
 * <p>Two formats: a structured {@code <related_keys>} XML block (current) and a short plain-text
 * list of examples (legacy). Entries missing the source or target value are skipped in both; if
 * none remain the result is the empty string.
 */
@Component
public class ContextPromptFormatter {

  private static final PromptTemplate LEGACY_TEMPLATE =
      PromptTemplate.from(
          "Here are similar translations in this project for context:\n{{examples}}");

  private final int legacyExamples;

  public ContextPromptFormatter(ContextProperties properties) {
    this.legacyExamples = properties.getLegacyExamples();
  }

  /**
   * Builds the structured XML context block.
   *
   * @param related the selected related translations, in ranking order
   * @param sourceLanguage the source locale
   * @param targetLanguage the target locale
   * @return the XML block, or an empty string when no entry has both languages
   */
  public String structured(
      List<AiContextTranslation> related, String sourceLanguage, String targetLanguage) {
    List<AiContextTranslation> withBoth = withBoth(related, sourceLanguage, targetLanguage);
    if (withBoth.isEmpty()) {
      return "";
    }

    StringBuilder xml = new StringBuilder("<related_keys>\n");
    for (AiContextTranslation r : withBoth) {
      xml.append("  <related_key name=\"")
          .append(escapeXml(r.keyName()))
          .append("\" type=\"")
          .append(r.relationshipType().name())
          .append("\" confidence=\"")
          .append(String.format(Locale.ROOT, "%.2f", r.confidence()))
          .append('"');
      if (r.approved()) {
        xml.append(" approved=\"true\"");
      }
      xml.append(">\n");
      xml.append("    <source lang=\"")
          .append(sourceLanguage)
          .append("\">")
          .append(escapeXml(r.valueIn(sourceLanguage)))
          .append("</source>\n");
      xml.append("    <target lang=\"")
          .append(targetLanguage)
          .append("\">")
          .append(escapeXml(r.valueIn(targetLanguage)))
          .append("</target>\n");
      xml.append("  </related_key>\n");
    }
    xml.append("</related_keys>");
    return xml.toString();
  }

  /**
   * Builds the legacy plain-text prompt listing at most {@code lingx.context.legacy-examples}
   * source/target pairs.
   */
  public String legacy(
      List<AiContextTranslation> related, String sourceLanguage, String targetLanguage) {
    List<AiContextTranslation> withBoth = withBoth(related, sourceLanguage, targetLanguage);
    if (withBoth.isEmpty()) {
      return "";
    }
    String examples =
        withBoth.stream()
            .limit(legacyExamples)
            .map(
                r ->
                    "- \"%s\" → \"%s\""
                        .formatted(r.valueIn(sourceLanguage), r.valueIn(targetLanguage)))
            .collect(Collectors.joining("\n"));
    return LEGACY_TEMPLATE.apply(Map.of("examples", examples)).text();
  }

  static String escapeXml(String text) {
    return text.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;")
        .replace("'", "&apos;");
  }

  private static List<AiContextTranslation> withBoth(
      List<AiContextTranslation> related, String sourceLanguage, String targetLanguage) {
    return related.stream().filter(r -> r.hasBoth(sourceLanguage, targetLanguage)).toList();
  }
}
