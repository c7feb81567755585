package dev.lingx.context;

/** Rendering of the related-key context prompt. */
public enum PromptFormat {
  /** {@code <related_keys>} XML block with type, confidence and approval per key. */
  STRUCTURED,
  /** Short plain-text list of source/target examples. */
  LEGACY
}
