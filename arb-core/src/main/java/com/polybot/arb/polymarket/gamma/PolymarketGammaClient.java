package com.polybot.arb.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.polybot.arb.polymarket.http.HttpRequestFactory;
import com.polybot.arb.polymarket.http.PolymarketHttpTransport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Gamma (metadata) API. Up/down markets are published as single-market events addressed by slug.
 */
public final class PolymarketGammaClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final HttpRequestFactory requests;
  private final PolymarketHttpTransport transport;

  public PolymarketGammaClient(URI baseUri, PolymarketHttpTransport transport) {
    this.requests = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"), HTTP_TIMEOUT);
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /**
   * @return the event document, or empty on 404
   */
  public Optional<JsonNode> eventBySlug(String slug) {
    return transport.sendJsonIfFound(requests.get(PolymarketGammaPaths.eventBySlug(slug), Map.of(), Map.of()));
  }

  /**
   * First market of the event with the given slug.
   */
  public Optional<JsonNode> marketBySlug(String slug) {
    return eventBySlug(slug)
        .map(event -> event.path("markets"))
        .filter(markets -> markets.isArray() && markets.size() > 0)
        .map(markets -> markets.get(0));
  }
}
