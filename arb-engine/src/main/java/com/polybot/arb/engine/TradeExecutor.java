package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.domain.ArbLeg;
import com.polybot.arb.domain.ArbSelection;
import com.polybot.arb.domain.TradeLeg;
import com.polybot.arb.domain.TradeRecord;
import com.polybot.arb.events.ArbEventPublisher;
import com.polybot.arb.events.ArbEventTypes;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.polymarket.auth.MissingCredentialsException;
import com.polybot.arb.venue.OrderGateway;
import com.polybot.arb.venue.OrderIntent;
import com.polybot.arb.venue.OrderPlacement;
import com.polybot.arb.venue.OrderSide;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Turns a qualifying selection into a trade: recorded directly in simulation, or as two concurrent
 * BUY limit orders in live mode. No hedging is attempted when only one leg is accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradeExecutor {

  private static final int PRICE_SCALE = 4;

  private final @NonNull ArbProperties properties;
  private final @NonNull OrderGateway orderGateway;
  private final @NonNull ArbEventPublisher events;
  private final @NonNull ArbMetricsService metrics;
  private final @NonNull Clock clock;
  private final @NonNull ExecutorService arbLegExecutor;

  public TradeAttempt execute(OverlapMarkets markets, ArbSelection selection) {
    BigDecimal size = properties.strategy().shares();
    TradeLeg leg15 = toTradeLeg(markets.market15().conditionId(), selection.leg15());
    TradeLeg leg5 = toTradeLeg(markets.market5().conditionId(), selection.leg5());

    if (!properties.isLive()) {
      TradeRecord trade = record(markets, leg15, leg5, size, true);
      log.info("[SIM] [{}] 15m {} @ {} + 5m {} @ {} = {} x {} shares",
          label(markets.symbol()), leg15.outcome().label(), leg15.price(), leg5.outcome().label(), leg5.price(),
          leg15.price().add(leg5.price()), size);
      return TradeAttempt.recorded(trade);
    }

    CompletableFuture<OrderPlacement> first = placeAsync(leg15, size);
    CompletableFuture<OrderPlacement> second = placeAsync(leg5, size);
    OrderPlacement placement15 = await(first);
    OrderPlacement placement5 = await(second);

    int accepted = (placement15.success() ? 1 : 0) + (placement5.success() ? 1 : 0);
    if (!placement15.success()) {
      log.warn("[{}] 15m {} leg failed: {}", label(markets.symbol()), leg15.outcome().label(), placement15.errorMessage());
      metrics.recordLegFailure(markets.symbol());
    }
    if (!placement5.success()) {
      log.warn("[{}] 5m {} leg failed: {}", label(markets.symbol()), leg5.outcome().label(), placement5.errorMessage());
      metrics.recordLegFailure(markets.symbol());
    }
    if (accepted < 2) {
      if (accepted == 1) {
        log.warn("[{}] only one leg accepted, holding unhedged exposure until resolution", label(markets.symbol()));
      }
      return TradeAttempt.partial(accepted);
    }

    TradeRecord trade = record(markets, leg15, leg5, size, false);
    log.info("[LIVE] [{}] 15m {} @ {} (order {}) + 5m {} @ {} (order {}) x {} shares",
        label(markets.symbol()), leg15.outcome().label(), leg15.price(), placement15.orderId(),
        leg5.outcome().label(), leg5.price(), placement5.orderId(), size);
    return TradeAttempt.recorded(trade);
  }

  private TradeRecord record(OverlapMarkets markets, TradeLeg leg15, TradeLeg leg5, BigDecimal size, boolean simulated) {
    Instant now = clock.instant();
    TradeRecord trade = new TradeRecord(markets.symbol(), markets.period15Start(), markets.period5Start(),
        leg15, leg5, size, now, simulated);
    metrics.recordTrade(markets.symbol());
    if (events.isEnabled()) {
      events.publish(now, ArbEventTypes.TRADE_RECORDED, markets.symbol(), trade);
    }
    return trade;
  }

  private CompletableFuture<OrderPlacement> placeAsync(TradeLeg leg, BigDecimal size) {
    OrderIntent intent = new OrderIntent(leg.tokenId(), OrderSide.BUY, size, leg.price());
    return CompletableFuture.supplyAsync(() -> orderGateway.placeOrder(intent), arbLegExecutor);
  }

  private static OrderPlacement await(CompletableFuture<OrderPlacement> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof MissingCredentialsException missing) {
        throw missing;
      }
      log.warn("Order placement raised {}: {}", cause.getClass().getSimpleName(), cause.getMessage());
      return OrderPlacement.rejected(cause.getMessage());
    }
  }

  private static TradeLeg toTradeLeg(String conditionId, ArbLeg leg) {
    return new TradeLeg(conditionId, leg.tokenId(), leg.outcome(),
        leg.ask().setScale(PRICE_SCALE, RoundingMode.HALF_UP));
  }

  private static String label(String symbol) {
    return symbol.toUpperCase(Locale.ROOT);
  }
}
