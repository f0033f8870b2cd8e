package com.polybot.arb.events;

import java.time.Instant;

public final class NoopArbEventPublisher implements ArbEventPublisher {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
  }
}
