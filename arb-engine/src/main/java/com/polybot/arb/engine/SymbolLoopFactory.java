package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.discovery.MarketDiscovery;
import com.polybot.arb.feed.PriceFeedCache;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.VenueQuery;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class SymbolLoopFactory {

  private final @NonNull ArbProperties properties;
  private final @NonNull MarketDiscovery discovery;
  private final @NonNull PriceFeedCache cache;
  private final @NonNull VenueQuery venue;
  private final @NonNull OrderBookStream bookStream;
  private final @NonNull TradeExecutor tradeExecutor;
  private final @NonNull ResolutionCoordinator resolution;
  private final @NonNull ArbMetricsService metrics;
  private final @NonNull Clock clock;
  private final @NonNull Sleeper sleeper;

  public SymbolArbitrageLoop create(String symbol) {
    return new SymbolArbitrageLoop(symbol, properties, discovery, cache, venue, bookStream,
        tradeExecutor, resolution, metrics, clock, sleeper);
  }
}
