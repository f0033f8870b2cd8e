package com.polybot.arb.polymarket.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.polybot.arb.polymarket.auth.PolymarketAuthContext;
import com.polybot.arb.polymarket.http.HttpRequestFactory;
import com.polybot.arb.polymarket.http.PolymarketHttpTransport;
import com.polybot.arb.venue.RedeemablePositions;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Data API position lookups for the funder wallet.
 */
@Slf4j
public final class PolymarketDataApiClient implements RedeemablePositions {

  static final String POSITIONS = "/positions";
  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(15);
  private static final int PAGE_LIMIT = 500;

  private final HttpRequestFactory requests;
  private final PolymarketHttpTransport transport;
  private final PolymarketAuthContext authContext;

  public PolymarketDataApiClient(URI baseUri, PolymarketHttpTransport transport, PolymarketAuthContext authContext) {
    this.requests = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"), HTTP_TIMEOUT);
    this.transport = Objects.requireNonNull(transport, "transport");
    this.authContext = Objects.requireNonNull(authContext, "authContext");
  }

  @Override
  public List<String> redeemableConditionIds() {
    String user = authContext.funderAddress()
        .orElseThrow(() -> new IllegalStateException("No funder or signer address configured"));
    JsonNode positions = transport.sendJson(requests.get(POSITIONS, Map.of(
        "user", user,
        "redeemable", "true",
        "limit", Integer.toString(PAGE_LIMIT)
    ), Map.of()));
    List<String> ids = conditionIdsWithSize(positions);
    log.info("Found {} redeemable conditions for {}", ids.size(), user);
    return ids;
  }

  static List<String> conditionIdsWithSize(JsonNode positions) {
    Set<String> ids = new LinkedHashSet<>();
    if (positions == null || !positions.isArray()) {
      return List.of();
    }
    for (JsonNode position : positions) {
      if (position.path("size").asDouble(0.0) <= 0.0) {
        continue;
      }
      String conditionId = position.path("conditionId").asText("").trim();
      if (conditionId.isEmpty()) {
        continue;
      }
      ids.add(conditionId.startsWith("0x") ? conditionId : "0x" + conditionId);
    }
    return new ArrayList<>(ids);
  }
}
