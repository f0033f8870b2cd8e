package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.domain.PnlCalculator;
import com.polybot.arb.domain.RedemptionTarget;
import com.polybot.arb.domain.TradePnl;
import com.polybot.arb.domain.TradeRecord;
import com.polybot.arb.events.ArbEventPublisher;
import com.polybot.arb.events.ArbEventTypes;
import com.polybot.arb.events.payload.RoundExpiredEvent;
import com.polybot.arb.events.payload.RoundSettledEvent;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Waits for both markets of a traded overlap to resolve, then books PnL and hands winners to redemption.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResolutionCoordinator {

  private final @NonNull ArbProperties properties;
  private final @NonNull VenueQuery venue;
  private final @NonNull CumulativePnl cumulativePnl;
  private final @NonNull RedemptionCoordinator redemption;
  private final @NonNull ArbEventPublisher events;
  private final @NonNull ArbMetricsService metrics;
  private final @NonNull Clock clock;
  private final @NonNull Sleeper sleeper;

  /**
   * Sleeps the initial delay, then polls both markets until each reports a winner. The max wait
   * counts from the first poll.
   *
   * @return empty when the max wait elapses first
   */
  public Optional<RoundResolution> awaitResolution(String symbol, String conditionId15, String conditionId5)
      throws InterruptedException {
    ArbProperties.Strategy strategy = properties.strategy();
    sleeper.sleep(Duration.ofSeconds(strategy.resolutionInitialDelaySeconds()));
    Instant deadline = clock.instant().plusSeconds(strategy.resolutionMaxWaitSeconds());
    Duration pollInterval = Duration.ofSeconds(strategy.resolutionPollIntervalSeconds());

    while (true) {
      Optional<String> winner15 = winner(conditionId15);
      Optional<String> winner5 = winner(conditionId5);
      if (winner15.isPresent() && winner5.isPresent()) {
        log.info("[{}] resolved: 15m winner {} / 5m winner {}", label(symbol), winner15.get(), winner5.get());
        return Optional.of(new RoundResolution(winner15.get(), winner5.get()));
      }
      if (!clock.instant().isBefore(deadline)) {
        return Optional.empty();
      }
      log.debug("[{}] waiting for resolution (15m resolved={}, 5m resolved={})",
          label(symbol), winner15.isPresent(), winner5.isPresent());
      sleeper.sleep(pollInterval);
    }
  }

  public RoundSettlement settle(OverlapMarkets markets, List<TradeRecord> trades, RoundResolution resolution) {
    BigDecimal periodPnl = BigDecimal.ZERO;
    Set<RedemptionTarget> targets = new LinkedHashSet<>();
    for (TradeRecord trade : trades) {
      TradePnl pnl = PnlCalculator.compute(trade, resolution.winnerToken15(), resolution.winnerToken5());
      log.info("[{}] trade 15m {} @ {} + 5m {} @ {}: cost {} payout {} pnl {}",
          label(trade.symbol()), trade.leg15().outcome().label(), trade.leg15().price(),
          trade.leg5().outcome().label(), trade.leg5().price(), pnl.cost(), pnl.payout(), pnl.pnl());
      periodPnl = periodPnl.add(pnl.pnl());
      if (pnl.won15()) {
        targets.add(new RedemptionTarget(trade.conditionId15(), trade.leg15().outcome()));
      }
      if (pnl.won5()) {
        targets.add(new RedemptionTarget(trade.conditionId5(), trade.leg5().outcome()));
      }
    }

    BigDecimal total = cumulativePnl.add(periodPnl);
    log.info("[{}] period PnL {} over {} trade(s), cumulative PnL {}", label(markets.symbol()), periodPnl, trades.size(), total);
    metrics.updateLastPeriodPnl(periodPnl);
    metrics.updateCumulativePnl(total);
    if (events.isEnabled()) {
      events.publish(clock.instant(), ArbEventTypes.ROUND_SETTLED, markets.symbol(), new RoundSettledEvent(
          markets.symbol(), markets.period15Start(), markets.market15().conditionId(), markets.market5().conditionId(),
          resolution.winnerToken15(), resolution.winnerToken5(), trades.size(), periodPnl, total));
    }

    List<RedemptionTarget> targetList = new ArrayList<>(targets);
    redemption.redeemAll(targetList);
    return new RoundSettlement(periodPnl, total, List.copyOf(targetList));
  }

  /**
   * The trades of an unresolved round are dropped from PnL; this only makes the loss of tracking visible.
   */
  public void expire(OverlapMarkets markets, List<TradeRecord> trades) {
    long waited = properties.strategy().resolutionInitialDelaySeconds() + properties.strategy().resolutionMaxWaitSeconds();
    log.warn("[{}] markets {} / {} not resolved after ~{}s, dropping {} trade(s) from PnL tracking",
        label(markets.symbol()), markets.market15().conditionId(), markets.market5().conditionId(), waited, trades.size());
    for (TradeRecord trade : trades) {
      log.warn("[{}] untracked trade: 15m {} @ {} + 5m {} @ {} x {}", label(trade.symbol()),
          trade.leg15().outcome().label(), trade.leg15().price(),
          trade.leg5().outcome().label(), trade.leg5().price(), trade.size());
    }
    metrics.recordResolutionTimeout(markets.symbol());
    if (events.isEnabled()) {
      events.publish(clock.instant(), ArbEventTypes.ROUND_EXPIRED, markets.symbol(), new RoundExpiredEvent(
          markets.symbol(), markets.period15Start(), markets.market15().conditionId(), markets.market5().conditionId(),
          trades.size(), waited));
    }
  }

  private Optional<String> winner(String conditionId) {
    try {
      VenueMarket market = venue.getMarketByConditionId(conditionId);
      if (!market.isResolved()) {
        return Optional.empty();
      }
      return market.winner().map(MarketToken::tokenId);
    } catch (RuntimeException e) {
      log.debug("Resolution lookup for {} failed: {}", conditionId, e.toString());
      return Optional.empty();
    }
  }

  private static String label(String symbol) {
    return symbol.toUpperCase(Locale.ROOT);
  }
}
