package com.polybot.arb.venue;

import java.util.List;
import java.util.Optional;

public record VenueMarket(
    String conditionId,
    String question,
    String slug,
    boolean active,
    boolean closed,
    List<MarketToken> tokens
) {

  public VenueMarket {
    tokens = tokens == null ? List.of() : List.copyOf(tokens);
  }

  /**
   * The single token flagged as winner; empty when none or more than one is flagged.
   */
  public Optional<MarketToken> winner() {
    List<MarketToken> winners = tokens.stream().filter(MarketToken::winner).toList();
    return winners.size() == 1 ? Optional.of(winners.get(0)) : Optional.empty();
  }

  /**
   * Closed with exactly one winning token reported.
   */
  public boolean isResolved() {
    return closed && winner().isPresent();
  }
}
