package dev.lingx.config;

import dev.lingx.context.RelationshipPriorities;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the relationship priority table injected into the relevance scorer. The table is fixed;
 * override the bean only in tests or experiments.
 */
@Configuration
public class RelevanceConfig {

  @Bean
  @ConditionalOnMissingBean
  public RelationshipPriorities relationshipPriorities() {
    return RelationshipPriorities.defaults();
  }
}
