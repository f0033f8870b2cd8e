package com.polybot.arb.polymarket.clob;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.polymarket.auth.PolymarketAuthHeaders;
import com.polybot.arb.polymarket.http.HttpRequestFactory;
import com.polybot.arb.polymarket.http.PolymarketHttpTransport;
import com.polybot.arb.polymarket.model.ApiCreds;
import com.polybot.arb.polymarket.model.ClobOrderType;
import com.polybot.arb.polymarket.model.SignedOrder;
import org.springframework.http.HttpMethod;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * REST client for the CLOB: market metadata, books, order parameters, API-key management and order placement.
 */
public final class PolymarketClobClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration SERVER_TIME_TTL = Duration.ofSeconds(30);

  private final HttpRequestFactory requests;
  private final PolymarketHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final int chainId;
  private final boolean useServerTime;

  private final AtomicLong serverTimeOffsetSeconds = new AtomicLong(0);
  private volatile Instant lastServerTimeSync = Instant.EPOCH;

  public PolymarketClobClient(
      URI baseUri,
      PolymarketHttpTransport transport,
      ObjectMapper objectMapper,
      Clock clock,
      int chainId,
      boolean useServerTime
  ) {
    this.requests = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"), HTTP_TIMEOUT);
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.chainId = chainId;
    this.useServerTime = useServerTime;
  }

  public int chainId() {
    return chainId;
  }

  public long getServerTimeSeconds() {
    String raw = transport.send(requests.get(PolymarketClobPaths.TIME, Map.of(), Map.of()));
    return Long.parseLong(raw.trim());
  }

  /**
   * {@code {condition_id, question, tokens: [{token_id, outcome, winner}], active, closed, ...}}
   */
  public JsonNode getMarket(String conditionId) {
    return transport.sendJson(requests.get(PolymarketClobPaths.market(conditionId), Map.of(), Map.of()));
  }

  public JsonNode getOrderBook(String tokenId) {
    return transport.sendJson(requests.get(PolymarketClobPaths.BOOK, Map.of("token_id", tokenId), Map.of()));
  }

  public BigDecimal getMinimumTickSize(String tokenId) {
    JsonNode node = transport.sendJson(requests.get(PolymarketClobPaths.TICK_SIZE, Map.of("token_id", tokenId), Map.of()));
    return node.path("minimum_tick_size").decimalValue();
  }

  public boolean isNegRisk(String tokenId) {
    JsonNode node = transport.sendJson(requests.get(PolymarketClobPaths.NEG_RISK, Map.of("token_id", tokenId), Map.of()));
    return node.path("neg_risk").asBoolean(false);
  }

  public int getBaseFeeBps(String tokenId) {
    JsonNode node = transport.sendJson(requests.get(PolymarketClobPaths.FEE_RATE, Map.of("token_id", tokenId), Map.of()));
    return node.path("base_fee").asInt(0);
  }

  public ApiCreds createApiCreds(Credentials signer, long nonce) {
    Map<String, String> headers = PolymarketAuthHeaders.l1(signer, chainId, authTimestampSeconds(), nonce);
    return toCreds(transport.sendJson(requests.withJsonBody("POST", PolymarketClobPaths.AUTH_API_KEY, headers, "")));
  }

  public ApiCreds deriveApiCreds(Credentials signer, long nonce) {
    Map<String, String> headers = PolymarketAuthHeaders.l1(signer, chainId, authTimestampSeconds(), nonce);
    return toCreds(transport.sendJson(requests.get(PolymarketClobPaths.AUTH_DERIVE_API_KEY, Map.of(), headers)));
  }

  /**
   * Posts a signed order. The response carries {@code success}, {@code orderID} and {@code errorMsg}.
   */
  public JsonNode postOrder(Credentials signer, ApiCreds apiCreds, SignedOrder order, ClobOrderType orderType) {
    Objects.requireNonNull(order, "order");
    if (!order.isSigned()) {
      throw new IllegalArgumentException("order must be signed before posting");
    }
    Map<String, Object> orderJson = new LinkedHashMap<>();
    orderJson.put("salt", Long.parseLong(order.salt()));
    orderJson.put("maker", order.maker());
    orderJson.put("signer", order.signer());
    orderJson.put("taker", order.taker());
    orderJson.put("tokenId", order.tokenId());
    orderJson.put("makerAmount", order.makerAmount());
    orderJson.put("takerAmount", order.takerAmount());
    orderJson.put("expiration", order.expiration());
    orderJson.put("nonce", order.nonce());
    orderJson.put("feeRateBps", order.feeRateBps());
    orderJson.put("side", order.side().name());
    orderJson.put("signatureType", order.signatureType());
    orderJson.put("signature", order.signature());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("order", orderJson);
    payload.put("owner", apiCreds.key());
    payload.put("orderType", orderType.name());

    String body = writeJson(payload);
    Map<String, String> headers = PolymarketAuthHeaders.l2(
        signer, apiCreds, authTimestampSeconds(), HttpMethod.POST, PolymarketClobPaths.ORDER, body);
    return transport.sendJson(requests.withJsonBody("POST", PolymarketClobPaths.ORDER, headers, body));
  }

  private long authTimestampSeconds() {
    Instant now = Instant.now(clock);
    if (!useServerTime) {
      return now.getEpochSecond();
    }
    if (Duration.between(lastServerTimeSync, now).compareTo(SERVER_TIME_TTL) > 0) {
      serverTimeOffsetSeconds.set(getServerTimeSeconds() - now.getEpochSecond());
      lastServerTimeSync = now;
    }
    return now.getEpochSecond() + serverTimeOffsetSeconds.get();
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode JSON", e);
    }
  }

  private static ApiCreds toCreds(JsonNode node) {
    return new ApiCreds(
        node.path("apiKey").asText(""),
        node.path("secret").asText(""),
        node.path("passphrase").asText("")
    );
  }
}
