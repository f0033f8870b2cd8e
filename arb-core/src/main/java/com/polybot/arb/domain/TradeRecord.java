package com.polybot.arb.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One executed (or simulated) pair of legs. Immutable once recorded.
 */
public record TradeRecord(
    String symbol,
    Instant period15Start,
    Instant period5Start,
    TradeLeg leg15,
    TradeLeg leg5,
    BigDecimal size,
    Instant executedAt,
    boolean simulated
) {

  public String conditionId15() {
    return leg15.conditionId();
  }

  public String conditionId5() {
    return leg5.conditionId();
  }

  public BigDecimal cost() {
    return leg15.price().add(leg5.price()).multiply(size);
  }
}
