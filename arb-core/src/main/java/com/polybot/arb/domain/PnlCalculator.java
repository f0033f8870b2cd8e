package com.polybot.arb.domain;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.util.Objects;

@UtilityClass
public class PnlCalculator {

  /**
   * Each winning leg pays out one unit per share; the cost is both legs' prices times the size.
   */
  public static TradePnl compute(TradeRecord trade, String winnerToken15, String winnerToken5) {
    boolean won15 = Objects.equals(trade.leg15().tokenId(), winnerToken15);
    boolean won5 = Objects.equals(trade.leg5().tokenId(), winnerToken5);
    BigDecimal cost = trade.cost();
    int winningLegs = (won15 ? 1 : 0) + (won5 ? 1 : 0);
    BigDecimal payout = trade.size().multiply(BigDecimal.valueOf(winningLegs));
    return new TradePnl(cost, payout, payout.subtract(cost), won15, won5);
  }
}
