package com.polybot.arb.domain;

public record RedemptionTarget(String conditionId, Outcome outcome) {

  public RedemptionTarget {
    if (conditionId == null || conditionId.isBlank()) {
      throw new IllegalArgumentException("conditionId must not be blank");
    }
    if (outcome == null) {
      throw new IllegalArgumentException("outcome must not be null");
    }
  }
}
