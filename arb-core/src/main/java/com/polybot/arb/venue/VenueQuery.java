package com.polybot.arb.venue;

import java.util.Optional;

/**
 * Read-only market metadata and book snapshots. Results are never cached by callers.
 */
public interface VenueQuery {

  /**
   * @return empty when no market exists for the slug
   */
  Optional<VenueMarket> getMarketBySlug(String slug);

  VenueMarket getMarketByConditionId(String conditionId);

  Quote getOrderBookBestPrices(String tokenId);
}
