package com.polybot.arb.domain;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.Locale;

@UtilityClass
public class MarketSlugs {

  public static String build(String symbol, int granularityMinutes, long periodStartEpochSeconds) {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol must not be blank");
    }
    return symbol.trim().toLowerCase(Locale.ROOT) + "-updown-" + granularityMinutes + "m-" + periodStartEpochSeconds;
  }

  public static String build(String symbol, Tenor tenor, Instant periodStart) {
    return build(symbol, tenor.minutes(), periodStart.getEpochSecond());
  }
}
