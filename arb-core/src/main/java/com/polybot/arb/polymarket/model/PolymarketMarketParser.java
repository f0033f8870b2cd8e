package com.polybot.arb.polymarket.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.VenueMarket;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps Gamma and CLOB JSON documents onto venue types.
 */
@UtilityClass
public class PolymarketMarketParser {

  /**
   * Gamma market: {@code conditionId}, {@code question}, {@code slug}, {@code active}, {@code closed}, and
   * {@code outcomes}/{@code clobTokenIds} as JSON-encoded string arrays.
   */
  public static VenueMarket fromGamma(JsonNode market, ObjectMapper objectMapper) {
    List<String> outcomes = stringArray(market.get("outcomes"), objectMapper);
    List<String> tokenIds = stringArray(market.get("clobTokenIds"), objectMapper);
    List<MarketToken> tokens = new ArrayList<>();
    for (int i = 0; i < Math.min(outcomes.size(), tokenIds.size()); i++) {
      tokens.add(new MarketToken(tokenIds.get(i), outcomes.get(i), false));
    }
    return new VenueMarket(
        text(market, "conditionId"),
        text(market, "question"),
        text(market, "slug"),
        market.path("active").asBoolean(false),
        market.path("closed").asBoolean(false),
        tokens
    );
  }

  /**
   * CLOB market: {@code condition_id}, {@code question}, {@code market_slug}, {@code active}, {@code closed},
   * {@code tokens[{token_id, outcome, winner}]}.
   */
  public static VenueMarket fromClob(JsonNode market) {
    List<MarketToken> tokens = new ArrayList<>();
    for (JsonNode token : market.path("tokens")) {
      String tokenId = text(token, "token_id");
      if (tokenId == null || tokenId.isBlank()) {
        continue;
      }
      tokens.add(new MarketToken(tokenId, text(token, "outcome"), token.path("winner").asBoolean(false)));
    }
    return new VenueMarket(
        text(market, "condition_id"),
        text(market, "question"),
        text(market, "market_slug"),
        market.path("active").asBoolean(false),
        market.path("closed").asBoolean(false),
        tokens
    );
  }

  /**
   * Best levels of a book document ({@code bids}/{@code asks}, or {@code buys}/{@code sells}).
   */
  public static Quote bestPrices(JsonNode book) {
    JsonNode bids = book.has("bids") ? book.get("bids") : book.get("buys");
    JsonNode asks = book.has("asks") ? book.get("asks") : book.get("sells");
    return new Quote(bestPrice(bids, true), bestPrice(asks, false));
  }

  public static BigDecimal bestPrice(JsonNode levels, boolean highest) {
    if (levels == null || !levels.isArray()) {
      return null;
    }
    BigDecimal best = null;
    for (JsonNode level : levels) {
      BigDecimal price = decimal(level.path("price").asText(null));
      if (price == null) {
        continue;
      }
      if (best == null || (highest ? price.compareTo(best) > 0 : price.compareTo(best) < 0)) {
        best = price;
      }
    }
    return best;
  }

  public static BigDecimal decimal(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(raw.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static List<String> stringArray(JsonNode node, ObjectMapper objectMapper) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    JsonNode array = node;
    if (node.isTextual()) {
      try {
        array = objectMapper.readTree(node.asText());
      } catch (IOException e) {
        return List.of();
      }
    }
    if (!array.isArray()) {
      return List.of();
    }
    List<String> values = new ArrayList<>();
    array.forEach(v -> values.add(v.asText()));
    return values;
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }
}
