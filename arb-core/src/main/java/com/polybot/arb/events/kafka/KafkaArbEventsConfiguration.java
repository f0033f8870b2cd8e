package com.polybot.arb.events.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.events.ArbEventPublisher;
import com.polybot.arb.events.ArbEventsProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(KafkaTemplate.class)
public class KafkaArbEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix = "arb.events", name = "enabled", havingValue = "true")
  public ArbEventPublisher kafkaArbEventPublisher(
      ArbEventsProperties properties,
      KafkaTemplate<String, String> kafkaTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      Environment env
  ) {
    String source = env.getProperty("spring.application.name", "arb-engine");
    return new KafkaArbEventPublisher(properties, kafkaTemplate, objectMapper, clock, source);
  }
}
