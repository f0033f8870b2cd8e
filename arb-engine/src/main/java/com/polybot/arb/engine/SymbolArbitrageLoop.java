package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.discovery.DiscoveredMarket;
import com.polybot.arb.discovery.MarketDiscovery;
import com.polybot.arb.domain.ArbLegSelector;
import com.polybot.arb.domain.ArbSelection;
import com.polybot.arb.domain.OutcomeTokens;
import com.polybot.arb.domain.Tenor;
import com.polybot.arb.domain.TradeRecord;
import com.polybot.arb.domain.WindowClock;
import com.polybot.arb.feed.PriceFeedCache;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.polymarket.auth.MissingCredentialsException;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.StreamSubscription;
import com.polybot.arb.venue.VenueQuery;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One symbol's round cycle: wait for the overlap, check the reference prices, trade until the 15m
 * market closes, then resolve and redeem. Runs on its own thread until stopped.
 */
@Slf4j
public class SymbolArbitrageLoop implements Runnable {

  private final String symbol;
  private final String label;
  private final ArbProperties properties;
  private final MarketDiscovery discovery;
  private final PriceFeedCache cache;
  private final VenueQuery venue;
  private final OrderBookStream bookStream;
  private final TradeExecutor tradeExecutor;
  private final ResolutionCoordinator resolution;
  private final ArbMetricsService metrics;
  private final Clock clock;
  private final Sleeper sleeper;

  private volatile SymbolLoopState state = SymbolLoopState.WAITING_FOR_OVERLAP;
  private volatile Instant period15Start;
  private volatile Instant period5Start;
  private volatile int tradesThisRound;
  private volatile String lastError;
  private volatile boolean stopRequested;

  // 15m period whose overlap was skipped; not retried within the same period
  private Instant abandonedPeriod15;

  public SymbolArbitrageLoop(
      String symbol,
      ArbProperties properties,
      MarketDiscovery discovery,
      PriceFeedCache cache,
      VenueQuery venue,
      OrderBookStream bookStream,
      TradeExecutor tradeExecutor,
      ResolutionCoordinator resolution,
      ArbMetricsService metrics,
      Clock clock,
      Sleeper sleeper
  ) {
    this.symbol = Objects.requireNonNull(symbol, "symbol");
    this.label = symbol.toUpperCase(Locale.ROOT);
    this.properties = Objects.requireNonNull(properties, "properties");
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.venue = Objects.requireNonNull(venue, "venue");
    this.bookStream = Objects.requireNonNull(bookStream, "bookStream");
    this.tradeExecutor = Objects.requireNonNull(tradeExecutor, "tradeExecutor");
    this.resolution = Objects.requireNonNull(resolution, "resolution");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public void run() {
    log.info("[{}] arbitrage loop started (mode={})", label, properties.mode());
    Duration roundPause = Duration.ofMillis(properties.strategy().roundPauseMillis());
    try {
      while (!isStopped()) {
        try {
          runCycle();
        } catch (MissingCredentialsException e) {
          lastError = e.getMessage();
          state = SymbolLoopState.FAILED;
          log.error("[{}] stopping loop, credentials are missing: {}", label, e.getMessage());
          return;
        } catch (RuntimeException e) {
          lastError = e.toString();
          log.error("[{}] round failed", label, e);
        }
        if (!isStopped()) {
          sleeper.sleep(roundPause);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      if (state != SymbolLoopState.FAILED) {
        state = SymbolLoopState.STOPPED;
      }
      log.info("[{}] arbitrage loop stopped", label);
    }
  }

  /**
   * One full round. Returns early, without error, whenever the overlap is skipped or nothing traded.
   */
  public void runCycle() throws InterruptedException {
    tradesThisRound = 0;
    Optional<OverlapMarkets> found = awaitOverlap();
    if (found.isEmpty()) {
      return;
    }
    OverlapMarkets markets = found.get();
    if (!referencePricesAgree(markets)) {
      return;
    }

    OutcomeTokens tokens15 = discovery.getOutcomeTokens(markets.market15().conditionId());
    OutcomeTokens tokens5 = discovery.getOutcomeTokens(markets.market5().conditionId());
    List<TradeRecord> trades = trade(markets, tokens15, tokens5);
    if (trades.isEmpty()) {
      log.info("[{}] overlap closed without a qualifying trade", label);
      return;
    }

    state = SymbolLoopState.RESOLVING;
    Optional<RoundResolution> resolved = resolution.awaitResolution(
        symbol, markets.market15().conditionId(), markets.market5().conditionId());
    if (resolved.isEmpty()) {
      resolution.expire(markets, trades);
      return;
    }
    state = SymbolLoopState.REDEEMING;
    resolution.settle(markets, trades, resolved.get());
  }

  public void stop() {
    stopRequested = true;
  }

  public String symbol() {
    return symbol;
  }

  public SymbolLoopState state() {
    return state;
  }

  public SymbolLoopStatus status() {
    return new SymbolLoopStatus(symbol, state, period15Start, period5Start, tradesThisRound, lastError);
  }

  private boolean isStopped() {
    return stopRequested || Thread.currentThread().isInterrupted();
  }

  private Optional<OverlapMarkets> awaitOverlap() throws InterruptedException {
    state = SymbolLoopState.WAITING_FOR_OVERLAP;
    Duration poll = Duration.ofMillis(properties.strategy().overlapPollMillis());
    while (!isStopped()) {
      Instant now = clock.instant();
      Instant p15 = WindowClock.periodStart(now, Tenor.FIFTEEN_MINUTES);
      if (WindowClock.isOverlap(now, p15) && !p15.equals(abandonedPeriod15)) {
        Instant p5 = WindowClock.periodStart(now, Tenor.FIVE_MINUTES);
        Optional<DiscoveredMarket> market15 = discovery.findMarket(symbol, Tenor.FIFTEEN_MINUTES, p15);
        Optional<DiscoveredMarket> market5 = market15.isPresent()
            ? discovery.findMarket(symbol, Tenor.FIVE_MINUTES, p5)
            : Optional.empty();
        if (market15.isPresent() && market5.isPresent()) {
          period15Start = p15;
          period5Start = p5;
          log.info("[{}] overlap found: {} + {}", label, market15.get().slug(), market5.get().slug());
          return Optional.of(new OverlapMarkets(symbol, p15, p5, market15.get(), market5.get()));
        }
        log.debug("[{}] overlap markets not available yet (15m={}, 5m={})",
            label, market15.isPresent(), market5.isPresent());
      }
      sleeper.sleep(poll);
    }
    return Optional.empty();
  }

  private boolean referencePricesAgree(OverlapMarkets markets) throws InterruptedException {
    state = SymbolLoopState.WAITING_FOR_REFERENCE_PRICES;
    Duration poll = Duration.ofMillis(properties.strategy().referencePricePollMillis());
    Instant period15End = WindowClock.periodEnd(markets.period15Start(), Tenor.FIFTEEN_MINUTES);
    while (!isStopped()) {
      OptionalDouble ref15 = cache.referencePrice(symbol, Tenor.FIFTEEN_MINUTES, markets.period15Start());
      OptionalDouble ref5 = cache.referencePrice(symbol, Tenor.FIVE_MINUTES, markets.period5Start());
      if (ref15.isPresent() && ref5.isPresent()) {
        double diff = Math.abs(ref15.getAsDouble() - ref5.getAsDouble());
        double tolerance = properties.strategy().toleranceFor(symbol);
        if (diff > tolerance) {
          log.info("[{}] reference prices differ by {} (15m={}, 5m={}, tolerance={}), skipping overlap",
              label, diff, ref15.getAsDouble(), ref5.getAsDouble(), tolerance);
          abandon(markets.period15Start(), "reference_mismatch");
          return false;
        }
        log.info("[{}] reference prices agree (15m={}, 5m={}, diff={})",
            label, ref15.getAsDouble(), ref5.getAsDouble(), diff);
        return true;
      }
      if (!clock.instant().isBefore(period15End)) {
        log.warn("[{}] no reference prices captured before the 15m market closed (15m={}, 5m={})",
            label, ref15.isPresent(), ref5.isPresent());
        abandon(markets.period15Start(), "reference_missing");
        return false;
      }
      sleeper.sleep(poll);
    }
    return false;
  }

  private List<TradeRecord> trade(OverlapMarkets markets, OutcomeTokens tokens15, OutcomeTokens tokens5)
      throws InterruptedException {
    state = SymbolLoopState.TRADING;
    ArbProperties.Strategy strategy = properties.strategy();
    Duration poll = Duration.ofMillis(strategy.livePricePollMillis());
    Duration cooldown = Duration.ofSeconds(strategy.tradeIntervalSeconds());
    Instant period15End = WindowClock.periodEnd(markets.period15Start(), Tenor.FIFTEEN_MINUTES);
    List<String> tokenIds = List.of(tokens15.up(), tokens15.down(), tokens5.up(), tokens5.down());
    List<TradeRecord> trades = new ArrayList<>();

    try (StreamSubscription ignored = bookStream.subscribe(tokenIds, cache)) {
      primeQuotes(tokenIds);
      Instant cooldownUntil = null;
      while (!isStopped()) {
        Instant now = clock.instant();
        if (!now.isBefore(period15End)) {
          break;
        }
        if (cooldownUntil == null || !now.isBefore(cooldownUntil)) {
          Optional<ArbSelection> selection = ArbLegSelector.select(tokens15, tokens5, cache::bestAsk, strategy.sumThreshold());
          if (selection.isPresent()) {
            log.info("[{}] opportunity: 15m {} @ {} + 5m {} @ {} = {}", label,
                selection.get().leg15().outcome().label(), selection.get().leg15().ask(),
                selection.get().leg5().outcome().label(), selection.get().leg5().ask(),
                selection.get().askSum());
            TradeAttempt attempt = tradeExecutor.execute(markets, selection.get());
            attempt.trade().ifPresent(t -> {
              trades.add(t);
              tradesThisRound = trades.size();
            });
            if (attempt.startsCooldown()) {
              cooldownUntil = now.plus(cooldown);
            }
          }
        }
        sleeper.sleep(poll);
      }
    } finally {
      cache.evictQuotes(tokenIds);
    }
    return trades;
  }

  private void primeQuotes(List<String> tokenIds) {
    for (String tokenId : tokenIds) {
      try {
        Quote quote = venue.getOrderBookBestPrices(tokenId);
        if (quote != null && !quote.isEmpty()) {
          cache.applyQuote(tokenId, quote);
        }
      } catch (RuntimeException e) {
        log.debug("[{}] could not prime quote for {}: {}", label, tokenId, e.toString());
      }
    }
  }

  private void abandon(Instant p15, String reason) {
    abandonedPeriod15 = p15;
    metrics.recordOverlapSkipped(symbol, reason);
  }
}
