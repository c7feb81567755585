package dev.lingx.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextPromptFormatterTest {

  private final ContextPromptFormatter formatter =
      new ContextPromptFormatter(new ContextProperties());

  private static AiContextTranslation related(
      String keyName,
      String en,
      String fr,
      RelationshipType type,
      double confidence,
      boolean approved) {
    Map<String, String> translations = new LinkedHashMap<>();
    if (en != null) {
      translations.put("en", en);
    }
    if (fr != null) {
      translations.put("fr", fr);
    }
    return new AiContextTranslation(keyName, translations, type, confidence, approved);
  }

  // --- structured ---

  @Test
  void structuredReturnsEmptyStringForNoEntries() {
    assertThat(formatter.structured(List.of(), "en", "fr")).isEmpty();
  }

  @Test
  void structuredReturnsEmptyStringWhenNoEntryHasBothLanguages() {
    var onlySource = related("a.b", "Save", null, RelationshipType.NEARBY, 0.9, false);
    var onlyTarget = related("a.c", null, "Annuler", RelationshipType.NEARBY, 0.9, false);

    assertThat(formatter.structured(List.of(onlySource, onlyTarget), "en", "fr")).isEmpty();
  }

  @Test
  void structuredRendersSingleRelatedKey() {
    var entry =
        related("checkout.submit", "Submit", "Valider", RelationshipType.NEARBY, 0.95, true);

    String xml = formatter.structured(List.of(entry), "en", "fr");

    assertThat(xml)
        .isEqualTo(
            """
            <related_keys>
              <related_key name="checkout.submit" type="NEARBY" confidence="0.95" approved="true">
                <source lang="en">Submit</source>
                <target lang="fr">Valider</target>
              </related_key>
            </related_keys>""");
  }

  @Test
  void structuredOmitsApprovedAttributeForUnapprovedEntries() {
    var entry = related("a.b", "Save", "Enregistrer", RelationshipType.SAME_FILE, 0.7, false);

    String xml = formatter.structured(List.of(entry), "en", "fr");

    assertThat(xml).contains("type=\"SAME_FILE\" confidence=\"0.70\">");
    assertThat(xml).doesNotContain("approved");
  }

  @Test
  void structuredFormatsConfidenceToTwoDecimals() {
    var entry = related("a.b", "Save", "Enregistrer", RelationshipType.SEMANTIC, 0.876543, false);

    assertThat(formatter.structured(List.of(entry), "en", "fr")).contains("confidence=\"0.88\"");
  }

  @Test
  void structuredEscapesXmlSpecialCharacters() {
    var entry =
        related(
            "a.<b>",
            "Tom & \"Jerry\"",
            "l'<ami>",
            RelationshipType.KEY_PATTERN,
            0.9,
            false);

    String xml = formatter.structured(List.of(entry), "en", "fr");

    assertThat(xml).contains("name=\"a.&lt;b&gt;\"");
    assertThat(xml).contains(">Tom &amp; &quot;Jerry&quot;</source>");
    assertThat(xml).contains(">l&apos;&lt;ami&gt;</target>");
  }

  @Test
  void structuredSkipsEntriesMissingTargetButKeepsOthers() {
    var complete = related("a.one", "One", "Un", RelationshipType.NEARBY, 0.9, false);
    var missing = related("a.two", "Two", null, RelationshipType.NEARBY, 0.9, false);

    String xml = formatter.structured(List.of(complete, missing), "en", "fr");

    assertThat(xml).contains("a.one").doesNotContain("a.two");
  }

  @Test
  void structuredKeepsInputOrderForMultipleKeys() {
    var first = related("k.first", "A", "A-fr", RelationshipType.NEARBY, 0.9, false);
    var second = related("k.second", "B", "B-fr", RelationshipType.SEMANTIC, 0.8, false);

    String xml = formatter.structured(List.of(first, second), "en", "fr");

    assertThat(xml.indexOf("k.first")).isLessThan(xml.indexOf("k.second"));
    assertThat(xml).startsWith("<related_keys>").endsWith("</related_keys>");
  }

  // --- legacy ---

  @Test
  void legacyReturnsEmptyStringWhenNothingUsable() {
    assertThat(formatter.legacy(List.of(), "en", "fr")).isEmpty();
    var onlySource = related("a.b", "Save", null, RelationshipType.NEARBY, 0.9, false);
    assertThat(formatter.legacy(List.of(onlySource), "en", "fr")).isEmpty();
  }

  @Test
  void legacyListsExamples() {
    var entry = related("a.b", "Save", "Enregistrer", RelationshipType.NEARBY, 0.9, false);

    String prompt = formatter.legacy(List.of(entry), "en", "fr");

    assertThat(prompt)
        .isEqualTo(
            "Here are similar translations in this project for context:\n"
                + "- \"Save\" → \"Enregistrer\"");
  }

  @Test
  void legacyLimitsToThreeExamplesByDefault() {
    List<AiContextTranslation> entries =
        List.of(
            related("k1", "One", "Un", RelationshipType.NEARBY, 0.9, false),
            related("k2", "Two", "Deux", RelationshipType.NEARBY, 0.9, false),
            related("k3", "Three", "Trois", RelationshipType.NEARBY, 0.9, false),
            related("k4", "Four", "Quatre", RelationshipType.NEARBY, 0.9, false));

    String prompt = formatter.legacy(entries, "en", "fr");

    assertThat(prompt).contains("\"Three\"").doesNotContain("\"Four\"");
    assertThat(prompt.lines().count()).isEqualTo(4);
  }
}
