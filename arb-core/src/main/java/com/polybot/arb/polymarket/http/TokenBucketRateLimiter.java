package com.polybot.arb.polymarket.http;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class TokenBucketRateLimiter implements RequestRateLimiter {

  private final double permitsPerSecond;
  private final double capacity;
  private final Clock clock;

  private double tokens;
  private long lastRefillNanos;

  public TokenBucketRateLimiter(double permitsPerSecond, int capacity, Clock clock) {
    if (permitsPerSecond <= 0) {
      throw new IllegalArgumentException("permitsPerSecond must be > 0");
    }
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.permitsPerSecond = permitsPerSecond;
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.tokens = capacity;
    this.lastRefillNanos = nowNanos();
  }

  @Override
  public void acquire() {
    while (true) {
      long waitMillis;
      synchronized (this) {
        refill();
        if (tokens >= 1.0) {
          tokens -= 1.0;
          return;
        }
        waitMillis = Math.max(1L, (long) Math.ceil((1.0 - tokens) / permitsPerSecond * 1000.0));
      }
      try {
        TimeUnit.MILLISECONDS.sleep(waitMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for a request permit", e);
      }
    }
  }

  private void refill() {
    long now = nowNanos();
    long elapsed = now - lastRefillNanos;
    if (elapsed <= 0) {
      return;
    }
    tokens = Math.min(capacity, tokens + elapsed / 1_000_000_000.0 * permitsPerSecond);
    lastRefillNanos = now;
  }

  private long nowNanos() {
    return TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }
}
