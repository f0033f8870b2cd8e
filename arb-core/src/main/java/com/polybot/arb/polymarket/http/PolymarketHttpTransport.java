package com.polybot.arb.polymarket.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Rate-limited HTTP calls with retries. Only GET/HEAD are retried (on 408, 429, 5xx and I/O errors).
 */
@Slf4j
public final class PolymarketHttpTransport {

  private static final long MAX_JITTER_MILLIS = 250;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;

  public PolymarketHttpTransport(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RequestRateLimiter rateLimiter,
      RetryPolicy retryPolicy
  ) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  public JsonNode sendJson(HttpRequest request) {
    return decode(request, send(request));
  }

  /**
   * Like {@link #sendJson(HttpRequest)}, but a 404 yields empty instead of an exception.
   */
  public Optional<JsonNode> sendJsonIfFound(HttpRequest request) {
    try {
      return Optional.of(sendJson(request));
    } catch (PolymarketHttpException e) {
      if (e.isNotFound()) {
        return Optional.empty();
      }
      throw e;
    }
  }

  public String send(HttpRequest request) {
    boolean idempotent = "GET".equalsIgnoreCase(request.method()) || "HEAD".equalsIgnoreCase(request.method());
    int maxAttempts = retryPolicy.attemptsFor(idempotent);

    for (int attempt = 1; ; attempt++) {
      rateLimiter.acquire();
      HttpResponse<String> response;
      try {
        response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("HTTP request interrupted: " + request.uri(), e);
      } catch (IOException e) {
        if (attempt >= maxAttempts) {
          throw new UncheckedIOException("HTTP request failed: " + request.method() + " " + request.uri(), e);
        }
        log.debug("Retrying {} {} after I/O error (attempt {}/{}): {}",
            request.method(), request.uri(), attempt, maxAttempts, e.toString());
        pause(retryPolicy.delayMillis(attempt, Optional.empty()));
        continue;
      }

      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        return response.body();
      }
      if (attempt < maxAttempts && retryPolicy.isRetryableStatus(status)) {
        log.debug("Retrying {} {} after HTTP {} (attempt {}/{})",
            request.method(), request.uri(), status, attempt, maxAttempts);
        pause(retryPolicy.delayMillis(attempt, response.headers().firstValue("retry-after")));
        continue;
      }
      throw new PolymarketHttpException(request.method(), request.uri(), status, response.body());
    }
  }

  private JsonNode decode(HttpRequest request, String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode JSON response from " + request.uri(), e);
    }
  }

  private static void pause(long delayMillis) {
    if (delayMillis <= 0) {
      return;
    }
    long withJitter = delayMillis + ThreadLocalRandom.current().nextLong(0, Math.min(MAX_JITTER_MILLIS, delayMillis) + 1);
    try {
      TimeUnit.MILLISECONDS.sleep(withJitter);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during HTTP retry backoff", e);
    }
  }
}
