package com.polybot.arb.events.payload;

import java.time.Instant;

public record RoundExpiredEvent(
    String symbol,
    Instant period15Start,
    String conditionId15,
    String conditionId5,
    int trades,
    long waitedSeconds
) {
}
