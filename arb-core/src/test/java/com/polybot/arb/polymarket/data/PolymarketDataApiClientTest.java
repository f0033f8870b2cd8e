package com.polybot.arb.polymarket.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PolymarketDataApiClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void keepsDistinctConditionsWithPositiveSize() throws Exception {
    JsonNode positions = objectMapper.readTree("""
        [
          {"conditionId": "0xaaa", "size": 10.0},
          {"conditionId": "bbb", "size": "3.5"},
          {"conditionId": "0xaaa", "size": 2},
          {"conditionId": "0xccc", "size": 0},
          {"conditionId": "", "size": 4}
        ]
        """);

    assertThat(PolymarketDataApiClient.conditionIdsWithSize(positions)).containsExactly("0xaaa", "0xbbb");
  }

  @Test
  void nonArrayResponseYieldsNothing() throws Exception {
    assertThat(PolymarketDataApiClient.conditionIdsWithSize(objectMapper.readTree("{\"error\": \"x\"}"))).isEmpty();
  }
}
