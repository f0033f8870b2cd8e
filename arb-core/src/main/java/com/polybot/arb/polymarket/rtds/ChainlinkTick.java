package com.polybot.arb.polymarket.rtds;

import java.time.Instant;

public record ChainlinkTick(String symbol, Instant timestamp, double value) {
}
