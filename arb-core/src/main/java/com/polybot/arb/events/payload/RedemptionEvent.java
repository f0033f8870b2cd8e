package com.polybot.arb.events.payload;

public record RedemptionEvent(
    String conditionId,
    String outcome,
    boolean success,
    String transactionHash,
    String message
) {
}
