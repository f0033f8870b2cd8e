package com.polybot.arb.engine;

import com.polybot.arb.domain.TradeRecord;

import java.util.Optional;

/**
 * Result of acting on one selection.
 *
 * @param legsPlaced number of legs the venue accepted (always 2 for simulated trades)
 */
public record TradeAttempt(TradeRecord record, int legsPlaced) {

  public static TradeAttempt recorded(TradeRecord record) {
    return new TradeAttempt(record, 2);
  }

  public static TradeAttempt partial(int legsPlaced) {
    return new TradeAttempt(null, legsPlaced);
  }

  public Optional<TradeRecord> trade() {
    return Optional.ofNullable(record);
  }

  /**
   * Any accepted leg holds exposure, so the trade interval applies even when the pair is incomplete.
   */
  public boolean startsCooldown() {
    return legsPlaced > 0;
  }
}
