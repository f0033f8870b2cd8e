package com.polybot.arb.polymarket.rtds;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RtdsChainlinkStreamClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final HttpClient httpClient = mock(HttpClient.class);
  private final RtdsChainlinkStreamClient client = new RtdsChainlinkStreamClient(
      httpClient, objectMapper, "wss://ws-live-data.polymarket.com", 5_000, 5_000);

  @AfterEach
  void tearDown() {
    client.stop();
  }

  @Test
  void parsesMillisecondTimestampAndNumericValue() throws Exception {
    Optional<ChainlinkTick> tick = RtdsChainlinkStreamClient.parseTick(objectMapper.readTree("""
        {"topic": "crypto_prices_chainlink", "payload": {"symbol": "BTC/USD", "timestamp": 1705330800500, "value": 97012.5}}
        """));

    assertThat(tick).isPresent();
    assertThat(tick.get().symbol()).isEqualTo("btc");
    assertThat(tick.get().timestamp()).isEqualTo(Instant.ofEpochMilli(1_705_330_800_500L));
    assertThat(tick.get().value()).isEqualTo(97_012.5);
  }

  @Test
  void parsesSecondTimestampAndStringValue() throws Exception {
    Optional<ChainlinkTick> tick = RtdsChainlinkStreamClient.parseTick(objectMapper.readTree("""
        {"topic": "crypto_prices_chainlink", "payload": {"symbol": "xrp/usd", "timestamp": 1705330800.25, "value": "0.5123"}}
        """));

    assertThat(tick).isPresent();
    assertThat(tick.get().timestamp()).isEqualTo(Instant.ofEpochMilli(1_705_330_800_250L));
    assertThat(tick.get().value()).isEqualTo(0.5123);
  }

  @Test
  void rejectsOtherTopicsAndMalformedPayloads() throws Exception {
    assertThat(RtdsChainlinkStreamClient.parseTick(objectMapper.readTree("""
        {"topic": "crypto_prices", "payload": {"symbol": "btcusdt", "timestamp": 1705330800500, "value": 1}}
        """))).isEmpty();
    assertThat(RtdsChainlinkStreamClient.parseTick(objectMapper.readTree("""
        {"topic": "crypto_prices_chainlink", "payload": {"symbol": "btc/usd", "timestamp": 1705330800500, "value": "n/a"}}
        """))).isEmpty();
  }

  @Test
  void forwardsOnlyConfiguredSymbols() {
    WebSocket.Builder builder = mock(WebSocket.Builder.class);
    when(builder.buildAsync(any(), any())).thenReturn(new CompletableFuture<>());
    when(httpClient.newWebSocketBuilder()).thenReturn(builder);
    List<String> seen = new ArrayList<>();

    client.start(List.of("btc"), (symbol, ts, value) -> seen.add(symbol + "@" + value));
    client.handleMessage("""
        {"topic": "crypto_prices_chainlink", "payload": {"symbol": "btc/usd", "timestamp": 1705330800500, "value": 97000}}
        """);
    client.handleMessage("""
        {"topic": "crypto_prices_chainlink", "payload": {"symbol": "eth/usd", "timestamp": 1705330800500, "value": 3100}}
        """);
    client.handleMessage("PONG");

    assertThat(seen).containsExactly("btc@97000.0");
    assertThat(client.isConnected()).isFalse();
  }
}
