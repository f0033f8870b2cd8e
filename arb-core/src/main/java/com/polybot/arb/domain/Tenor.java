package com.polybot.arb.domain;

import java.time.Duration;

public enum Tenor {
  FIFTEEN_MINUTES(15),
  FIVE_MINUTES(5);

  private final int minutes;

  Tenor(int minutes) {
    this.minutes = minutes;
  }

  public int minutes() {
    return minutes;
  }

  public Duration duration() {
    return Duration.ofMinutes(minutes);
  }

  public String label() {
    return minutes + "m";
  }
}
