package com.polybot.arb.venue;

import java.math.BigDecimal;

/**
 * Best bid/ask of one outcome token. Either side may be {@code null} when the book has no level on it.
 */
public record Quote(BigDecimal bid, BigDecimal ask) {

  public static final Quote EMPTY = new Quote(null, null);

  public boolean isEmpty() {
    return bid == null && ask == null;
  }

  /**
   * Field-wise merge: sides present in {@code update} replace this quote's sides.
   */
  public Quote merge(Quote update) {
    if (update == null) {
      return this;
    }
    return new Quote(update.bid != null ? update.bid : bid, update.ask != null ? update.ask : ask);
  }
}
