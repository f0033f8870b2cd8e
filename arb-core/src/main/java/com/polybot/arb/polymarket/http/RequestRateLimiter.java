package com.polybot.arb.polymarket.http;

public interface RequestRateLimiter {

  /**
   * Blocks until the caller may issue one request.
   */
  void acquire();

  static RequestRateLimiter unlimited() {
    return () -> {
    };
  }
}
