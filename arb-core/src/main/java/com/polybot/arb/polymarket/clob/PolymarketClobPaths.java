package com.polybot.arb.polymarket.clob;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PolymarketClobPaths {

  public static final String TIME = "/time";
  public static final String BOOK = "/book";
  public static final String TICK_SIZE = "/tick-size";
  public static final String NEG_RISK = "/neg-risk";
  public static final String FEE_RATE = "/fee-rate";
  public static final String MARKETS = "/markets";
  public static final String AUTH_API_KEY = "/auth/api-key";
  public static final String AUTH_DERIVE_API_KEY = "/auth/derive-api-key";
  public static final String ORDER = "/order";

  public static String market(String conditionId) {
    return MARKETS + "/" + conditionId;
  }
}
