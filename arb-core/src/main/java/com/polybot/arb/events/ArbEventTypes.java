package com.polybot.arb.events;

import lombok.experimental.UtilityClass;

@UtilityClass
public class ArbEventTypes {

  public static final String TRADE_RECORDED = "arb.trade.recorded";
  public static final String ROUND_SETTLED = "arb.round.settled";
  public static final String ROUND_EXPIRED = "arb.round.expired";
  public static final String REDEMPTION = "arb.redemption";
}
