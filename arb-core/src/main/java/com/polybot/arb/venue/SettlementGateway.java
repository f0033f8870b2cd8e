package com.polybot.arb.venue;

import com.polybot.arb.domain.Outcome;

import java.util.Optional;

public interface SettlementGateway {

  boolean isConfigured();

  /**
   * Why redemption cannot run with the current wallet setup; empty when {@link #isConfigured()}.
   */
  default Optional<String> unavailableReason() {
    return isConfigured() ? Optional.empty() : Optional.of("settlement not configured");
  }

  RedemptionResult redeem(String conditionId, Outcome outcome);
}
