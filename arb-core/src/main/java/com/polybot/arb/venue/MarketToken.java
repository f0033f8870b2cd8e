package com.polybot.arb.venue;

public record MarketToken(String tokenId, String outcome, boolean winner) {
}
