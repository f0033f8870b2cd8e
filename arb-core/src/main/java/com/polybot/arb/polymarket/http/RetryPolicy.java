package com.polybot.arb.polymarket.http;

import java.util.Optional;

/**
 * Exponential backoff for idempotent requests. A numeric {@code Retry-After} header takes precedence.
 */
public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  public int attemptsFor(boolean idempotent) {
    return (enabled && idempotent) ? Math.max(1, maxAttempts) : 1;
  }

  public boolean isRetryableStatus(int statusCode) {
    return statusCode == 408 || statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
  }

  public long delayMillis(int attempt, Optional<String> retryAfterHeader) {
    long retryAfterSeconds = retryAfterHeader.map(RetryPolicy::parseSeconds).orElse(0L);
    if (retryAfterSeconds > 0) {
      return retryAfterSeconds * 1000L;
    }
    long base = Math.max(0, initialBackoffMillis);
    long cap = Math.max(base, maxBackoffMillis);
    long delay = base;
    for (int i = 1; i < attempt && delay < cap; i++) {
      delay = Math.min(cap, delay * 2);
    }
    return delay;
  }

  private static long parseSeconds(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0L;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      return 0L;
    }
  }
}
