package com.polybot.arb.events.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record RoundSettledEvent(
    String symbol,
    Instant period15Start,
    String conditionId15,
    String conditionId5,
    String winnerToken15,
    String winnerToken5,
    int trades,
    BigDecimal periodPnl,
    BigDecimal cumulativePnl
) {
}
