package dev.lingx.quality;

import java.util.List;

/** Thrown when a quality config is rejected at save time. Carries one message per violation. */
public class QualityConfigValidationException extends IllegalArgumentException {

  private final List<String> errors;

  public QualityConfigValidationException(List<String> errors) {
    super("Invalid quality config: " + String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
