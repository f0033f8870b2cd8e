package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.domain.Outcome;
import com.polybot.arb.domain.RedemptionTarget;
import com.polybot.arb.events.ArbEventPublisher;
import com.polybot.arb.events.ArbEventTypes;
import com.polybot.arb.events.payload.RedemptionEvent;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.RedeemablePositions;
import com.polybot.arb.venue.RedemptionResult;
import com.polybot.arb.venue.SettlementGateway;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Redeems winning conditional-token positions, both after a settled round and on demand.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedemptionCoordinator {

  private final @NonNull ArbProperties properties;
  private final @NonNull SettlementGateway settlement;
  private final @NonNull VenueQuery venue;
  private final @NonNull RedeemablePositions redeemablePositions;
  private final @NonNull ArbEventPublisher events;
  private final @NonNull ArbMetricsService metrics;
  private final @NonNull Clock clock;

  /**
   * Automatic redemption after a round. Skipped when disabled, in simulation, or without a usable signer;
   * a failing target never blocks the remaining ones.
   *
   * @return results keyed by condition id, empty when skipped
   */
  public Map<String, RedemptionResult> redeemAll(Collection<RedemptionTarget> targets) {
    Set<RedemptionTarget> unique = new LinkedHashSet<>(targets);
    if (unique.isEmpty()) {
      return Map.of();
    }
    if (!properties.strategy().autoRedeem()) {
      log.info("Auto-redeem disabled, leaving {} winning position(s) unredeemed", unique.size());
      return Map.of();
    }
    if (!properties.isLive()) {
      unique.forEach(t -> log.info("[SIM] would redeem {} on condition {}", t.outcome().label(), t.conditionId()));
      return Map.of();
    }
    if (!settlement.isConfigured()) {
      log.warn("Settlement is not configured ({}), skipping redemption of {} position(s)", unavailableReason(), unique.size());
      return Map.of();
    }

    Map<String, RedemptionResult> results = new LinkedHashMap<>();
    for (RedemptionTarget target : unique) {
      RedemptionResult result;
      try {
        result = redeem(target);
      } catch (RuntimeException e) {
        log.warn("Redemption of {} on {} raised: {}", target.outcome().label(), target.conditionId(), e.toString());
        metrics.recordRedemption(false);
        result = RedemptionResult.failed(e.getMessage());
      }
      results.put(target.conditionId() + ":" + target.outcome().label(), result);
    }
    return results;
  }

  /**
   * Manual redemption of one resolved condition, regardless of trading mode.
   *
   * @throws IllegalArgumentException for a blank condition id
   * @throws IllegalStateException when the market is not resolved or no signer is configured
   */
  public RedemptionResult redeemCondition(String conditionId) {
    if (conditionId == null || conditionId.isBlank()) {
      throw new IllegalArgumentException("conditionId must not be blank");
    }
    if (!settlement.isConfigured()) {
      throw new IllegalStateException("settlement is not configured: " + unavailableReason());
    }
    VenueMarket market = venue.getMarketByConditionId(conditionId);
    if (!market.isResolved()) {
      throw new IllegalStateException("market " + conditionId + " is not resolved yet");
    }
    MarketToken winner = market.winner().orElseThrow();
    Outcome outcome = Outcome.classify(winner.outcome())
        .orElseThrow(() -> new IllegalStateException("unrecognised winning outcome '" + winner.outcome() + "'"));
    return redeem(new RedemptionTarget(conditionId, outcome));
  }

  /**
   * Redeems every condition the data API reports as redeemable for the funder wallet.
   */
  public Map<String, RedemptionResult> sweepRedeemable() {
    Map<String, RedemptionResult> results = new LinkedHashMap<>();
    for (String conditionId : redeemablePositions.redeemableConditionIds()) {
      try {
        results.put(conditionId, redeemCondition(conditionId));
      } catch (RuntimeException e) {
        log.warn("Sweep could not redeem {}: {}", conditionId, e.getMessage());
        results.put(conditionId, RedemptionResult.failed(e.getMessage()));
      }
    }
    log.info("Redemption sweep finished: {} condition(s) processed", results.size());
    return results;
  }

  private RedemptionResult redeem(RedemptionTarget target) {
    log.info("Redeeming {} on condition {}", target.outcome().label(), target.conditionId());
    RedemptionResult result = settlement.redeem(target.conditionId(), target.outcome());
    if (result.success()) {
      log.info("Redeemed {} on {} tx={}", target.outcome().label(), target.conditionId(), result.transactionHash());
    } else {
      log.warn("Redemption of {} on {} failed: {}", target.outcome().label(), target.conditionId(), result.message());
    }
    metrics.recordRedemption(result.success());
    if (events.isEnabled()) {
      events.publish(clock.instant(), ArbEventTypes.REDEMPTION, target.conditionId(), new RedemptionEvent(
          target.conditionId(), target.outcome().label(), result.success(), result.transactionHash(), result.message()));
    }
    return result;
  }

  private String unavailableReason() {
    return settlement.unavailableReason().orElse("unknown");
  }
}
