package com.polybot.arb.venue;

import java.time.Instant;

@FunctionalInterface
public interface ReferenceTickListener {

  /**
   * @param symbol lowercase base symbol, e.g. {@code btc}
   */
  void onTick(String symbol, Instant timestamp, double value);
}
