package com.polybot.arb.engine;

import java.time.Duration;

/**
 * Blocking wait used by the engine loops, injectable so tests can advance a manual clock instead.
 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return duration -> {
      if (!duration.isNegative() && !duration.isZero()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }
}
