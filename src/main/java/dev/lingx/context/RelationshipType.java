package dev.lingx.context;

/**
 * Why two translation keys are considered related. Declaration order is the bucket order used by
 * {@link ContextSelector} and therefore the tie-break precedence between equal scores.
 */
public enum RelationshipType {
  /** Keys within a few lines of each other in the same source file, across components. */
  NEARBY,
  /** Keys whose dotted names share a prefix or segments. */
  KEY_PATTERN,
  /** Keys used by the same UI component. */
  SAME_COMPONENT,
  /** Keys referenced from the same source file. */
  SAME_FILE,
  /** Keys whose source texts are similar. */
  SEMANTIC
}
