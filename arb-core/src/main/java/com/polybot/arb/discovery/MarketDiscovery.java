package com.polybot.arb.discovery;

import com.polybot.arb.domain.MarketSlugs;
import com.polybot.arb.domain.Outcome;
import com.polybot.arb.domain.OutcomeTokens;
import com.polybot.arb.domain.QuestionParser;
import com.polybot.arb.domain.Tenor;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Resolves the market of a (symbol, tenor, period) through its deterministic slug. Every call hits the venue.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarketDiscovery {

  private final @NonNull VenueQuery venue;

  /**
   * @return empty when the market is missing, inactive, closed, or the lookup failed
   */
  public Optional<DiscoveredMarket> findMarket(String symbol, Tenor tenor, Instant periodStart) {
    String slug = MarketSlugs.build(symbol, tenor, periodStart);
    Optional<VenueMarket> found;
    try {
      found = venue.getMarketBySlug(slug);
    } catch (RuntimeException e) {
      log.warn("Market lookup failed slug={} error={}", slug, e.toString());
      return Optional.empty();
    }
    if (found.isEmpty()) {
      log.debug("No market for slug={}", slug);
      return Optional.empty();
    }
    VenueMarket market = found.get();
    if (!market.active() || market.closed()) {
      log.debug("Market not tradable slug={} active={} closed={}", slug, market.active(), market.closed());
      return Optional.empty();
    }
    if (market.conditionId() == null || market.conditionId().isBlank()) {
      log.warn("Market without condition id slug={}", slug);
      return Optional.empty();
    }
    OptionalDouble reference = QuestionParser.referencePrice(market.question());
    return Optional.of(new DiscoveredMarket(
        symbol.toLowerCase(Locale.ROOT),
        tenor,
        periodStart,
        market.conditionId(),
        slug,
        market.question(),
        reference.isPresent() ? reference.getAsDouble() : null
    ));
  }

  /**
   * @throws IllegalStateException when the market does not expose both an Up and a Down token
   */
  public OutcomeTokens getOutcomeTokens(String conditionId) {
    VenueMarket market = venue.getMarketByConditionId(conditionId);
    String up = null;
    String down = null;
    for (MarketToken token : market.tokens()) {
      Optional<Outcome> outcome = Outcome.classify(token.outcome());
      if (outcome.isEmpty()) {
        continue;
      }
      if (outcome.get() == Outcome.UP && up == null) {
        up = token.tokenId();
      } else if (outcome.get() == Outcome.DOWN && down == null) {
        down = token.tokenId();
      }
    }
    if (up == null || down == null) {
      throw new IllegalStateException("Could not classify Up/Down tokens for condition " + conditionId
          + " (up=" + up + ", down=" + down + ")");
    }
    return new OutcomeTokens(up, down);
  }
}
