package com.polybot.arb.venue;

public record RedemptionResult(boolean success, String transactionHash, String message) {

  public static RedemptionResult confirmed(String transactionHash) {
    return new RedemptionResult(true, transactionHash, null);
  }

  public static RedemptionResult failed(String message) {
    return new RedemptionResult(false, null, message);
  }
}
