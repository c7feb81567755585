package dev.lingx.context;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for AI context building.
 *
 * <p>Properties are bound from {@code lingx.context.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-related} - number of ranked related keys kept for the AI prompt (default 5,
 *       bounded [1, 50])
 *   <li>{@code legacy-examples} - number of examples in the plain-text prompt (default 3, bounded
 *       [1, 10])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "lingx.context")
public class ContextProperties {

  private int maxRelated = 5;
  private int legacyExamples = 3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxRelated < 1 || maxRelated > 50) {
      throw new IllegalStateException(
          "lingx.context.max-related must be in [1, 50], got: " + maxRelated);
    }
    if (legacyExamples < 1 || legacyExamples > 10) {
      throw new IllegalStateException(
          "lingx.context.legacy-examples must be in [1, 10], got: " + legacyExamples);
    }
  }

  public int getMaxRelated() {
    return maxRelated;
  }

  public void setMaxRelated(int maxRelated) {
    this.maxRelated = maxRelated;
  }

  public int getLegacyExamples() {
    return legacyExamples;
  }

  public void setLegacyExamples(int legacyExamples) {
    this.legacyExamples = legacyExamples;
  }
}
