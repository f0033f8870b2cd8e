package com.polybot.arb.venue;

public interface OrderGateway {

  /**
   * Submits a good-till-cancelled limit order. Venue rejections are reported through
   * {@link OrderPlacement#success()}; missing credentials are thrown.
   */
  OrderPlacement placeOrder(OrderIntent intent);
}
