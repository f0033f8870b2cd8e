package com.polybot.arb.venue;

@FunctionalInterface
public interface QuoteListener {

  void onQuote(String tokenId, Quote quote);
}
