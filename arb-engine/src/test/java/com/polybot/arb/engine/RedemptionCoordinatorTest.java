package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.domain.Outcome;
import com.polybot.arb.domain.RedemptionTarget;
import com.polybot.arb.events.NoopArbEventPublisher;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.metrics.PolybotMetrics;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.RedeemablePositions;
import com.polybot.arb.venue.RedemptionResult;
import com.polybot.arb.venue.SettlementGateway;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedemptionCoordinatorTest {

  private static final String CID_A = "0x" + "aa".repeat(32);
  private static final String CID_B = "0x" + "bb".repeat(32);

  private final SettlementGateway settlement = mock(SettlementGateway.class);
  private final VenueQuery venue = mock(VenueQuery.class);
  private final RedeemablePositions redeemable = mock(RedeemablePositions.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  @Test
  void simulationNeverTouchesTheChain() {
    RedemptionCoordinator coordinator = coordinator(TestProperties.simulation());

    Map<String, RedemptionResult> results = coordinator.redeemAll(List.of(new RedemptionTarget(CID_A, Outcome.UP)));

    assertThat(results).isEmpty();
    verify(settlement, never()).redeem(any(), any());
  }

  @Test
  void autoRedeemDisabledSkips() {
    when(settlement.isConfigured()).thenReturn(true);
    RedemptionCoordinator coordinator = coordinator(TestProperties.of(ArbProperties.TradingMode.LIVE, false));

    coordinator.redeemAll(List.of(new RedemptionTarget(CID_A, Outcome.UP)));

    verify(settlement, never()).redeem(any(), any());
  }

  @Test
  void unconfiguredSettlementSkips() {
    when(settlement.isConfigured()).thenReturn(false);

    coordinator(TestProperties.live()).redeemAll(List.of(new RedemptionTarget(CID_A, Outcome.UP)));

    verify(settlement, never()).redeem(any(), any());
  }

  @Test
  void duplicateTargetsAreRedeemedOnceAndFailuresDoNotBlockOthers() {
    when(settlement.isConfigured()).thenReturn(true);
    when(settlement.redeem(CID_A, Outcome.UP)).thenThrow(new IllegalStateException("rpc down"));
    when(settlement.redeem(CID_B, Outcome.DOWN)).thenReturn(RedemptionResult.confirmed("0xtx"));

    Map<String, RedemptionResult> results = coordinator(TestProperties.live()).redeemAll(List.of(
        new RedemptionTarget(CID_A, Outcome.UP),
        new RedemptionTarget(CID_A, Outcome.UP),
        new RedemptionTarget(CID_B, Outcome.DOWN)));

    verify(settlement, times(1)).redeem(CID_A, Outcome.UP);
    verify(settlement, times(1)).redeem(CID_B, Outcome.DOWN);
    assertThat(results).hasSize(2);
    assertThat(results.get(CID_B + ":Down").transactionHash()).isEqualTo("0xtx");
    assertThat(registry.get("arb_redemptions_total").tag("result", "failure").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("arb_redemptions_total").tag("result", "success").counter().count()).isEqualTo(1.0);
  }

  @Test
  void manualRedeemRequiresResolvedMarket() {
    when(settlement.isConfigured()).thenReturn(true);
    when(venue.getMarketByConditionId(CID_A)).thenReturn(market(CID_A, false, false));

    assertThatThrownBy(() -> coordinator(TestProperties.simulation()).redeemCondition(CID_A))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not resolved");
  }

  @Test
  void manualRedeemUsesWinningOutcomeInAnyMode() {
    when(settlement.isConfigured()).thenReturn(true);
    when(venue.getMarketByConditionId(CID_A)).thenReturn(market(CID_A, true, false));
    when(settlement.redeem(CID_A, Outcome.DOWN)).thenReturn(RedemptionResult.confirmed("0xtx"));

    RedemptionResult result = coordinator(TestProperties.simulation()).redeemCondition(CID_A);

    assertThat(result.success()).isTrue();
    verify(settlement).redeem(CID_A, Outcome.DOWN);
  }

  @Test
  void manualRedeemRejectsBlankConditionId() {
    assertThatThrownBy(() -> coordinator(TestProperties.live()).redeemCondition(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sweepReportsPerConditionResults() {
    when(settlement.isConfigured()).thenReturn(true);
    when(redeemable.redeemableConditionIds()).thenReturn(List.of(CID_A, CID_B));
    when(venue.getMarketByConditionId(CID_A)).thenReturn(market(CID_A, true, true));
    when(venue.getMarketByConditionId(CID_B)).thenReturn(market(CID_B, false, false));
    when(settlement.redeem(CID_A, Outcome.UP)).thenReturn(RedemptionResult.confirmed("0xtx"));

    Map<String, RedemptionResult> results = coordinator(TestProperties.live()).sweepRedeemable();

    assertThat(results).containsOnlyKeys(CID_A, CID_B);
    assertThat(results.get(CID_A).success()).isTrue();
    assertThat(results.get(CID_B).success()).isFalse();
  }

  private RedemptionCoordinator coordinator(ArbProperties properties) {
    ArbMetricsService metrics = new ArbMetricsService(new PolybotMetrics(registry), properties);
    metrics.initializeMetrics();
    return new RedemptionCoordinator(properties, settlement, venue, redeemable, new NoopArbEventPublisher(),
        metrics, Clock.systemUTC());
  }

  private static VenueMarket market(String conditionId, boolean closed, boolean upWins) {
    return new VenueMarket(conditionId, "q", "slug", !closed, closed, List.of(
        new MarketToken("up-" + conditionId, "Up", closed && upWins),
        new MarketToken("down-" + conditionId, "Down", closed && !upWins)));
  }
}
