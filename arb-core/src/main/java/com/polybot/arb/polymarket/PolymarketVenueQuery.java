package com.polybot.arb.polymarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.polymarket.clob.PolymarketClobClient;
import com.polybot.arb.polymarket.gamma.PolymarketGammaClient;
import com.polybot.arb.polymarket.model.PolymarketMarketParser;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Slug lookups go to Gamma; condition-id lookups and books go to the CLOB.
 */
@RequiredArgsConstructor
public class PolymarketVenueQuery implements VenueQuery {

  private final @NonNull PolymarketGammaClient gammaClient;
  private final @NonNull PolymarketClobClient clobClient;
  private final @NonNull ObjectMapper objectMapper;

  @Override
  public Optional<VenueMarket> getMarketBySlug(String slug) {
    return gammaClient.marketBySlug(slug).map(market -> PolymarketMarketParser.fromGamma(market, objectMapper));
  }

  @Override
  public VenueMarket getMarketByConditionId(String conditionId) {
    return PolymarketMarketParser.fromClob(clobClient.getMarket(conditionId));
  }

  @Override
  public Quote getOrderBookBestPrices(String tokenId) {
    return PolymarketMarketParser.bestPrices(clobClient.getOrderBook(tokenId));
  }
}
