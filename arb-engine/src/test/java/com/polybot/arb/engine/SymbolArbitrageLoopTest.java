package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.discovery.MarketDiscovery;
import com.polybot.arb.domain.MarketSlugs;
import com.polybot.arb.domain.Tenor;
import com.polybot.arb.events.NoopArbEventPublisher;
import com.polybot.arb.feed.PriceFeedCache;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.metrics.PolybotMetrics;
import com.polybot.arb.polymarket.auth.MissingCredentialsException;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.OrderGateway;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.QuoteListener;
import com.polybot.arb.venue.RedeemablePositions;
import com.polybot.arb.venue.SettlementGateway;
import com.polybot.arb.venue.StreamSubscription;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SymbolArbitrageLoopTest {

  private static final Instant P15 = Instant.parse("2024-01-15T15:00:00Z");
  private static final Instant P5 = P15.plusSeconds(600);
  private static final String CID15 = "0x" + "15".repeat(32);
  private static final String CID5 = "0x" + "05".repeat(32);

  private final ManualClock clock = new ManualClock(P15.plusSeconds(598));
  private final PriceFeedCache cache = new PriceFeedCache(Duration.ofSeconds(2));
  private final FakeVenue venue = new FakeVenue();
  private final FakeBookStream bookStream = new FakeBookStream();
  private final OrderGateway orderGateway = mock(OrderGateway.class);
  private final SettlementGateway settlement = mock(SettlementGateway.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final CumulativePnl cumulativePnl = new CumulativePnl();
  private final ExecutorService legExecutor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    legExecutor.shutdownNow();
  }

  @Test
  void simulatedRoundTradesEveryIntervalThenSettles() throws Exception {
    cache.captureReference("btc", Tenor.FIFTEEN_MINUTES, P15, 97_000.0);
    cache.captureReference("btc", Tenor.FIVE_MINUTES, P5, 97_004.0);
    SymbolArbitrageLoop loop = loop(TestProperties.simulation());

    loop.runCycle();

    // overlap found at 15:10:03, then one trade per 60s until the 15m market closes
    assertThat(loop.status().tradesThisRound()).isEqualTo(5);
    assertThat(loop.status().period15Start()).isEqualTo(P15);
    assertThat(loop.status().period5Start()).isEqualTo(P5);
    assertThat(loop.state()).isEqualTo(SymbolLoopState.REDEEMING);
    // each trade: payout 20 for a cost of 9.20
    assertThat(cumulativePnl.total()).isEqualByComparingTo("54.00");
    assertThat(bookStream.subscribed).containsExactlyInAnyOrder("u15", "d15", "u5", "d5");
    assertThat(bookStream.lastSubscription.isActive()).isFalse();
    assertThat(cache.quoteCount()).isZero();
    verify(orderGateway, never()).placeOrder(any());
    verify(settlement, never()).redeem(any(), any());
  }

  @Test
  void referenceMismatchSkipsOverlapWithoutSubscribing() throws Exception {
    cache.captureReference("btc", Tenor.FIFTEEN_MINUTES, P15, 97_000.0);
    cache.captureReference("btc", Tenor.FIVE_MINUTES, P5, 97_025.0);
    SymbolArbitrageLoop loop = loop(TestProperties.simulation());

    loop.runCycle();

    assertThat(bookStream.lastSubscription).isNull();
    assertThat(cumulativePnl.total()).isEqualByComparingTo("0");
    assertThat(registry.get("arb_overlaps_skipped_total").tag("reason", "reference_mismatch").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void missingReferenceUntilCloseSkipsOverlap() throws Exception {
    cache.captureReference("btc", Tenor.FIFTEEN_MINUTES, P15, 97_000.0);
    SymbolArbitrageLoop loop = loop(TestProperties.simulation());

    loop.runCycle();

    assertThat(clock.instant()).isAfterOrEqualTo(P15.plusSeconds(900));
    assertThat(registry.get("arb_overlaps_skipped_total").tag("reason", "reference_missing").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void missingCredentialsStopTheLoop() {
    cache.captureReference("btc", Tenor.FIFTEEN_MINUTES, P15, 97_000.0);
    cache.captureReference("btc", Tenor.FIVE_MINUTES, P5, 97_000.0);
    when(orderGateway.placeOrder(any())).thenThrow(new MissingCredentialsException("no private key"));
    SymbolArbitrageLoop loop = loop(TestProperties.live());

    loop.run();

    assertThat(loop.state()).isEqualTo(SymbolLoopState.FAILED);
    assertThat(loop.status().lastError()).contains("no private key");
    assertThat(bookStream.lastSubscription.isActive()).isFalse();
  }

  private SymbolArbitrageLoop loop(ArbProperties properties) {
    ArbMetricsService metrics = new ArbMetricsService(new PolybotMetrics(registry), properties);
    metrics.initializeMetrics();
    NoopArbEventPublisher events = new NoopArbEventPublisher();
    RedemptionCoordinator redemption = new RedemptionCoordinator(properties, settlement, venue,
        mock(RedeemablePositions.class), events, metrics, clock);
    ResolutionCoordinator resolution = new ResolutionCoordinator(properties, venue, cumulativePnl, redemption,
        events, metrics, clock, clock.sleeper());
    TradeExecutor executor = new TradeExecutor(properties, orderGateway, events, metrics, clock, legExecutor);
    return new SymbolArbitrageLoop("btc", properties, new MarketDiscovery(venue), cache, venue, bookStream,
        executor, resolution, metrics, clock, clock.sleeper());
  }

  /**
   * Serves the 15:00 15m market and the 15:10 5m market; both resolve one minute after 15:15.
   * The 15m market resolves Up and the 5m market resolves Down.
   */
  private final class FakeVenue implements VenueQuery {

    @Override
    public Optional<VenueMarket> getMarketBySlug(String slug) {
      if (slug.equals(MarketSlugs.build("btc", Tenor.FIFTEEN_MINUTES, P15))) {
        return Optional.of(getMarketByConditionId(CID15));
      }
      if (slug.equals(MarketSlugs.build("btc", Tenor.FIVE_MINUTES, P5))) {
        return Optional.of(getMarketByConditionId(CID5));
      }
      return Optional.empty();
    }

    @Override
    public VenueMarket getMarketByConditionId(String conditionId) {
      boolean resolved = !clock.instant().isBefore(P15.plusSeconds(960));
      if (conditionId.equals(CID15)) {
        return new VenueMarket(CID15, "Bitcoin Up or Down", "s15", !resolved, resolved, List.of(
            new MarketToken("u15", "Up", resolved),
            new MarketToken("d15", "Down", false)));
      }
      return new VenueMarket(CID5, "Bitcoin Up or Down", "s5", !resolved, resolved, List.of(
          new MarketToken("u5", "Up", false),
          new MarketToken("d5", "Down", resolved)));
    }

    @Override
    public Quote getOrderBookBestPrices(String tokenId) {
      return Quote.EMPTY;
    }
  }

  private static final class FakeBookStream implements OrderBookStream {

    private static final Map<String, Quote> BOOK = Map.of(
        "u15", new Quote(new BigDecimal("0.43"), new BigDecimal("0.45")),
        "d15", new Quote(new BigDecimal("0.53"), new BigDecimal("0.56")),
        "u5", new Quote(new BigDecimal("0.51"), new BigDecimal("0.54")),
        "d5", new Quote(new BigDecimal("0.45"), new BigDecimal("0.47")));

    private final List<String> subscribed = new ArrayList<>();
    private FakeSubscription lastSubscription;

    @Override
    public StreamSubscription subscribe(Collection<String> tokenIds, QuoteListener listener) {
      subscribed.addAll(tokenIds);
      tokenIds.forEach(t -> listener.onQuote(t, BOOK.get(t)));
      lastSubscription = new FakeSubscription();
      return lastSubscription;
    }

    @Override
    public int activeSubscriptions() {
      return lastSubscription != null && lastSubscription.isActive() ? 1 : 0;
    }
  }

  private static final class FakeSubscription implements StreamSubscription {
    private boolean active = true;

    @Override
    public boolean isActive() {
      return active;
    }

    @Override
    public void cancel() {
      active = false;
    }
  }
}
