package com.polybot.arb.engine;

import com.polybot.arb.discovery.DiscoveredMarket;

import java.time.Instant;

/**
 * The 15m market and its final 5m market, both discovered for the current overlap window.
 */
public record OverlapMarkets(
    String symbol,
    Instant period15Start,
    Instant period5Start,
    DiscoveredMarket market15,
    DiscoveredMarket market5
) {
}
