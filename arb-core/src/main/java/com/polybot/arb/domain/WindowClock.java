package com.polybot.arb.domain;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Period alignment for the up/down markets. Periods are aligned on the US Eastern wall clock, so a 15m period
 * always starts at :00, :15, :30 or :45 local time.
 */
@UtilityClass
public class WindowClock {

  public static final ZoneId MARKET_ZONE = ZoneId.of("America/New_York");

  /**
   * Offset into a 15m period at which the overlap window opens (the start of its last 5m sub-period).
   */
  public static final Duration OVERLAP_OFFSET = Duration.ofMinutes(10);

  public static Instant periodStart(Instant instant, int granularityMinutes) {
    if (instant == null) {
      throw new IllegalArgumentException("instant must not be null");
    }
    if (granularityMinutes <= 0 || 60 % granularityMinutes != 0) {
      throw new IllegalArgumentException("granularityMinutes must divide 60, got " + granularityMinutes);
    }
    ZonedDateTime local = instant.atZone(MARKET_ZONE);
    int minute = local.getMinute();
    // withMinute keeps the current offset when the local time is ambiguous (DST fall-back hour)
    return local.withMinute(minute - (minute % granularityMinutes))
        .withSecond(0)
        .withNano(0)
        .toInstant();
  }

  public static Instant periodStart(Instant instant, Tenor tenor) {
    return periodStart(instant, tenor.minutes());
  }

  public static Instant periodEnd(Instant periodStart, Tenor tenor) {
    return periodStart.plus(tenor.duration());
  }

  public static boolean isOverlap(Instant now, Instant period15Start) {
    Duration elapsed = Duration.between(period15Start, now);
    return elapsed.compareTo(OVERLAP_OFFSET) >= 0 && elapsed.compareTo(Tenor.FIFTEEN_MINUTES.duration()) < 0;
  }
}
