package com.polybot.arb.events;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ArbEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix = "arb.events", name = "enabled", havingValue = "false", matchIfMissing = true)
  @ConditionalOnMissingBean(ArbEventPublisher.class)
  public ArbEventPublisher noopArbEventPublisher() {
    return new NoopArbEventPublisher();
  }
}
