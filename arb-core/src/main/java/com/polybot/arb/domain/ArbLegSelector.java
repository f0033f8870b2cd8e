package com.polybot.arb.domain;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

@UtilityClass
public class ArbLegSelector {

  /**
   * Looks for an opposite-outcome pair whose asks sum strictly below {@code threshold}.
   * 15m Up + 5m Down is checked first; 15m Down + 5m Up only when the first pair does not qualify.
   *
   * @param askLookup best ask per token id, or {@code null} when the token has no ask
   */
  public static Optional<ArbSelection> select(
      OutcomeTokens market15,
      OutcomeTokens market5,
      Function<String, BigDecimal> askLookup,
      BigDecimal threshold
  ) {
    Optional<ArbSelection> upDown = pair(market15, Outcome.UP, market5, askLookup, threshold);
    if (upDown.isPresent()) {
      return upDown;
    }
    return pair(market15, Outcome.DOWN, market5, askLookup, threshold);
  }

  private static Optional<ArbSelection> pair(
      OutcomeTokens market15,
      Outcome outcome15,
      OutcomeTokens market5,
      Function<String, BigDecimal> askLookup,
      BigDecimal threshold
  ) {
    Outcome outcome5 = outcome15.opposite();
    String token15 = market15.tokenFor(outcome15);
    String token5 = market5.tokenFor(outcome5);
    BigDecimal ask15 = askLookup.apply(token15);
    BigDecimal ask5 = askLookup.apply(token5);
    if (ask15 == null || ask5 == null) {
      return Optional.empty();
    }
    if (ask15.add(ask5).compareTo(threshold) >= 0) {
      return Optional.empty();
    }
    return Optional.of(new ArbSelection(new ArbLeg(token15, outcome15, ask15), new ArbLeg(token5, outcome5, ask5)));
  }
}
