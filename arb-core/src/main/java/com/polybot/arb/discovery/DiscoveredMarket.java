package com.polybot.arb.discovery;

import com.polybot.arb.domain.Tenor;

import java.time.Instant;

/**
 * An active, unclosed up/down market for one (symbol, tenor, period).
 *
 * @param questionReferencePrice price parsed from the question text, {@code null} when the question carries none
 */
public record DiscoveredMarket(
    String symbol,
    Tenor tenor,
    Instant periodStart,
    String conditionId,
    String slug,
    String question,
    Double questionReferencePrice
) {
}
