package com.polybot.arb.engine;

import java.time.Instant;

public record SymbolLoopStatus(
    String symbol,
    SymbolLoopState state,
    Instant period15Start,
    Instant period5Start,
    int tradesThisRound,
    String lastError
) {
}
