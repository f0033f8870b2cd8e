package com.polybot.arb.polymarket.model;

public enum ClobOrderType {
  GTC,
  GTD,
  FOK,
  FAK
}
