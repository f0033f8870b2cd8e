package com.polybot.arb.venue;

public enum OrderSide {
  BUY,
  SELL;

  public int toEip712Value() {
    return this == BUY ? 0 : 1;
  }
}
