package com.polybot.arb.domain;

import java.util.List;

public record OutcomeTokens(String up, String down) {

  public OutcomeTokens {
    if (up == null || up.isBlank()) {
      throw new IllegalArgumentException("up token must not be blank");
    }
    if (down == null || down.isBlank()) {
      throw new IllegalArgumentException("down token must not be blank");
    }
  }

  public String tokenFor(Outcome outcome) {
    return outcome == Outcome.UP ? up : down;
  }

  public List<String> all() {
    return List.of(up, down);
  }
}
