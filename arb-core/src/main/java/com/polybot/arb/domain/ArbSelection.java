package com.polybot.arb.domain;

import java.math.BigDecimal;

/**
 * A pair of opposite outcomes across the two tenors. {@code leg15} always refers to the 15m market.
 */
public record ArbSelection(ArbLeg leg15, ArbLeg leg5) {

  public BigDecimal askSum() {
    return leg15.ask().add(leg5.ask());
  }
}
