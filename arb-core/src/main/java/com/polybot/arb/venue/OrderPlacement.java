package com.polybot.arb.venue;

public record OrderPlacement(String orderId, boolean success, String errorMessage) {

  public static OrderPlacement accepted(String orderId) {
    return new OrderPlacement(orderId, true, null);
  }

  public static OrderPlacement rejected(String errorMessage) {
    return new OrderPlacement(null, false, errorMessage);
  }
}
