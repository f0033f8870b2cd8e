package com.polybot.arb.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.polymarket.auth.PolymarketAuthContext;
import com.polybot.arb.polymarket.clob.PolymarketClobClient;
import com.polybot.arb.polymarket.http.PolymarketHttpException;
import com.polybot.arb.polymarket.model.ApiCreds;
import com.polybot.arb.polymarket.model.ClobOrderType;
import com.polybot.arb.polymarket.model.SignedOrder;
import com.polybot.arb.polymarket.order.PolymarketOrderBuilder;
import com.polybot.arb.venue.OrderGateway;
import com.polybot.arb.venue.OrderIntent;
import com.polybot.arb.venue.OrderPlacement;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Places GTC limit orders on the CLOB after the kill-switch and size/notional limits.
 * Venue and HTTP failures come back as rejected placements; missing credentials are thrown.
 */
@Slf4j
@RequiredArgsConstructor
public class PolymarketOrderGateway implements OrderGateway {

  private final @NonNull ArbProperties properties;
  private final @NonNull PolymarketClobClient clobClient;
  private final @NonNull PolymarketAuthContext authContext;
  private final @NonNull Clock clock;

  @Override
  public OrderPlacement placeOrder(OrderIntent intent) {
    String riskRejection = checkRisk(intent);
    if (riskRejection != null) {
      log.warn("Order rejected by risk checks token={} reason={}", intent.tokenId(), riskRejection);
      return OrderPlacement.rejected(riskRejection);
    }

    Credentials signer = authContext.requireSignerCredentials();
    ApiCreds apiCreds = authContext.requireApiCreds();

    try {
      BigDecimal tickSize = clobClient.getMinimumTickSize(intent.tokenId());
      boolean negRisk = clobClient.isNegRisk(intent.tokenId());
      int feeRateBps = clobClient.getBaseFeeBps(intent.tokenId());

      PolymarketOrderBuilder builder = new PolymarketOrderBuilder(
          clobClient.chainId(),
          signer,
          authContext.signatureType(),
          authContext.funderAddress().orElse(null),
          clock
      );
      SignedOrder order = builder.buildLimitOrder(
          intent.tokenId(), intent.side(), intent.price(), intent.size(), tickSize, negRisk, feeRateBps);

      JsonNode response = clobClient.postOrder(signer, apiCreds, order, ClobOrderType.GTC);
      return toPlacement(response);
    } catch (PolymarketHttpException e) {
      log.warn("Order post failed token={} status={} body={}", intent.tokenId(), e.statusCode(), e.responseSnippet());
      return OrderPlacement.rejected("HTTP " + e.statusCode() + ": " + e.responseSnippet());
    } catch (IllegalArgumentException e) {
      log.warn("Order build failed token={} error={}", intent.tokenId(), e.getMessage());
      return OrderPlacement.rejected(e.getMessage());
    }
  }

  static OrderPlacement toPlacement(JsonNode response) {
    boolean success = response.path("success").asBoolean(false);
    String orderId = response.path("orderID").asText("");
    String errorMsg = response.path("errorMsg").asText("");
    if (success && !orderId.isBlank()) {
      return OrderPlacement.accepted(orderId);
    }
    return OrderPlacement.rejected(errorMsg.isBlank() ? "order not accepted" : errorMsg);
  }

  private String checkRisk(OrderIntent intent) {
    ArbProperties.Risk risk = properties.risk();
    if (risk.killSwitch()) {
      return "kill switch active";
    }
    if (risk.maxOrderSize().signum() > 0 && intent.size().compareTo(risk.maxOrderSize()) > 0) {
      return "size " + intent.size() + " exceeds max " + risk.maxOrderSize();
    }
    if (risk.maxOrderNotionalUsd().signum() > 0 && intent.notional().compareTo(risk.maxOrderNotionalUsd()) > 0) {
      return "notional " + intent.notional() + " exceeds max " + risk.maxOrderNotionalUsd();
    }
    return null;
  }
}
