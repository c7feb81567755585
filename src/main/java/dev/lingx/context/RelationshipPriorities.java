package dev.lingx.context;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable priority table weighting each {@link RelationshipType} for AI context selection, plus
 * the multiplier applied to candidates that already have an approved target translation.
 *
 * <p>Instances are injected into {@link RelevanceScorer}; the table never changes after
 * construction. Types missing from the table, and a null type, fall back to {@link
 * #FALLBACK_WEIGHT}.
 */
public final class RelationshipPriorities {

  /** Weight used for any relationship type the table does not list. */
  public static final double FALLBACK_WEIGHT = 0.5;

  /** Multiplier for candidates whose target-language translation is approved. */
  public static final double APPROVED_BOOST = 1.2;

  private static final RelationshipPriorities DEFAULTS =
      new RelationshipPriorities(
          Map.of(
              RelationshipType.NEARBY, 1.0,
              RelationshipType.KEY_PATTERN, 0.9,
              RelationshipType.SAME_COMPONENT, 0.8,
              RelationshipType.SAME_FILE, 0.7,
              RelationshipType.SEMANTIC, 0.6),
          APPROVED_BOOST);

  private final Map<RelationshipType, Double> weights;
  private final double approvedBoost;

  public RelationshipPriorities(Map<RelationshipType, Double> weights, double approvedBoost) {
    EnumMap<RelationshipType, Double> copy = new EnumMap<>(RelationshipType.class);
    weights.forEach(
        (type, weight) ->
            copy.put(type, Objects.requireNonNull(weight, () -> "No weight for " + type)));
    this.weights = Collections.unmodifiableMap(copy);
    this.approvedBoost = approvedBoost;
  }

  /** NEARBY 1.0, KEY_PATTERN 0.9, SAME_COMPONENT 0.8, SAME_FILE 0.7, SEMANTIC 0.6; boost 1.2. */
  public static RelationshipPriorities defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the priority weight for a relationship type.
   *
   * @param type the relationship type (nullable)
   * @return the configured weight, or {@link #FALLBACK_WEIGHT} for an unlisted or null type
   */
  public double weightOf(@Nullable RelationshipType type) {
    if (type == null) {
      return FALLBACK_WEIGHT;
    }
    return weights.getOrDefault(type, FALLBACK_WEIGHT);
  }

  public double approvedBoost() {
    return approvedBoost;
  }
}
