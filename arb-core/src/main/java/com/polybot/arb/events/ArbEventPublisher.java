package com.polybot.arb.events;

import java.time.Instant;

public interface ArbEventPublisher {

  boolean isEnabled();

  void publish(Instant ts, String type, String key, Object data);
}
