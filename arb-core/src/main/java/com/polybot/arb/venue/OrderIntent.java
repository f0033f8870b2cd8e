package com.polybot.arb.venue;

import java.math.BigDecimal;

public record OrderIntent(String tokenId, OrderSide side, BigDecimal size, BigDecimal price) {

  public OrderIntent {
    if (tokenId == null || tokenId.isBlank()) {
      throw new IllegalArgumentException("tokenId must not be blank");
    }
    if (side == null) {
      throw new IllegalArgumentException("side must not be null");
    }
    if (size == null || size.signum() <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
    if (price == null || price.signum() <= 0) {
      throw new IllegalArgumentException("price must be > 0");
    }
  }

  public BigDecimal notional() {
    return size.multiply(price);
  }
}
