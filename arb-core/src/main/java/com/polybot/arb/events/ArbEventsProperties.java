package com.polybot.arb.events;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "arb.events")
public record ArbEventsProperties(
    @NotNull Boolean enabled,
    String topic
) {
  public ArbEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (topic == null || topic.isBlank()) {
      topic = "polybot.arb.events";
    }
  }
}
