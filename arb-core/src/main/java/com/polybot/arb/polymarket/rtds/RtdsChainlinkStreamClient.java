package com.polybot.arb.polymarket.rtds;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.venue.ReferencePriceStream;
import com.polybot.arb.venue.ReferenceTickListener;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Real-time data service feed of Chainlink crypto prices ({@code crypto_prices_chainlink} topic).
 * One socket serves every symbol; it is text-pinged and reopened after any close or error until stopped.
 */
@Slf4j
public class RtdsChainlinkStreamClient implements ReferencePriceStream {

  static final String SUBSCRIBE_MESSAGE =
      "{\"action\":\"subscribe\",\"subscriptions\":[{\"topic\":\"crypto_prices_chainlink\",\"type\":\"*\",\"filters\":\"\"}]}";
  private static final String TOPIC = "crypto_prices_chainlink";
  private static final double MILLIS_THRESHOLD = 1e12;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI wsUri;
  private final long pingIntervalMillis;
  private final long reconnectDelayMillis;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean reconnectPending = new AtomicBoolean(false);
  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "rtds-ws");
    t.setDaemon(true);
    return t;
  });

  private volatile Set<String> symbols = Set.of();
  private volatile ReferenceTickListener listener;
  private volatile WebSocket webSocket;

  public RtdsChainlinkStreamClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      String wsUrl,
      long pingIntervalMillis,
      long reconnectDelayMillis
  ) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.wsUri = URI.create(wsUrl);
    this.pingIntervalMillis = pingIntervalMillis;
    this.reconnectDelayMillis = reconnectDelayMillis;
  }

  @Override
  public void start(Collection<String> symbols, ReferenceTickListener listener) {
    if (!running.compareAndSet(false, true)) {
      log.debug("RTDS stream already running");
      return;
    }
    this.symbols = symbols.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    this.listener = listener;
    scheduler.scheduleAtFixedRate(this::ping, pingIntervalMillis, pingIntervalMillis, TimeUnit.MILLISECONDS);
    connect();
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    WebSocket ws = webSocket;
    webSocket = null;
    if (ws != null) {
      ws.abort();
    }
    scheduler.shutdownNow();
    log.info("RTDS stream stopped");
  }

  @Override
  public boolean isConnected() {
    return webSocket != null;
  }

  /**
   * Parses a topic message. Payload symbols look like {@code btc/usd}; timestamps above 1e12 are milliseconds;
   * values may be numbers or numeric strings.
   */
  static Optional<ChainlinkTick> parseTick(JsonNode node) {
    if (node == null || !TOPIC.equals(node.path("topic").asText(""))) {
      return Optional.empty();
    }
    JsonNode payload = node.path("payload");
    String rawSymbol = payload.path("symbol").asText("");
    if (rawSymbol.isBlank()) {
      return Optional.empty();
    }
    int slash = rawSymbol.indexOf('/');
    String symbol = (slash > 0 ? rawSymbol.substring(0, slash) : rawSymbol).trim().toLowerCase(Locale.ROOT);

    JsonNode tsNode = payload.path("timestamp");
    if (!tsNode.isNumber() && !tsNode.isTextual()) {
      return Optional.empty();
    }
    double ts = tsNode.asDouble(0.0);
    if (ts <= 0.0) {
      return Optional.empty();
    }
    Instant timestamp = ts > MILLIS_THRESHOLD
        ? Instant.ofEpochMilli((long) ts)
        : Instant.ofEpochMilli(Math.round(ts * 1000.0));

    JsonNode valueNode = payload.path("value");
    double value;
    if (valueNode.isNumber()) {
      value = valueNode.asDouble();
    } else if (valueNode.isTextual()) {
      try {
        value = Double.parseDouble(valueNode.asText().trim());
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    } else {
      return Optional.empty();
    }
    return Optional.of(new ChainlinkTick(symbol, timestamp, value));
  }

  void handleMessage(String message) {
    if (message.isBlank() || "PONG".equalsIgnoreCase(message.trim())) {
      return;
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(message);
    } catch (JsonProcessingException e) {
      log.debug("Ignoring non-JSON RTDS frame: {}", message);
      return;
    }
    ReferenceTickListener target = listener;
    if (target == null) {
      return;
    }
    parseTick(node)
        .filter(tick -> symbols.contains(tick.symbol()))
        .ifPresent(tick -> target.onTick(tick.symbol(), tick.timestamp(), tick.value()));
  }

  private void connect() {
    if (!running.get()) {
      return;
    }
    log.info("Connecting RTDS websocket {}", wsUri);
    httpClient.newWebSocketBuilder()
        .buildAsync(wsUri, new Listener())
        .whenComplete((ws, error) -> {
          if (error != null) {
            log.warn("RTDS connect failed: {}", error.toString());
            scheduleReconnect();
          }
        });
  }

  private void scheduleReconnect() {
    if (!running.get() || !reconnectPending.compareAndSet(false, true)) {
      return;
    }
    scheduler.schedule(() -> {
      reconnectPending.set(false);
      connect();
    }, reconnectDelayMillis, TimeUnit.MILLISECONDS);
  }

  private void ping() {
    WebSocket ws = webSocket;
    if (ws != null && !ws.isOutputClosed()) {
      ws.sendText("PING", true).exceptionally(e -> {
        log.debug("RTDS ping failed: {}", e.toString());
        return null;
      });
    }
  }

  private final class Listener implements WebSocket.Listener {
    private final StringBuilder buf = new StringBuilder(4096);

    @Override
    public void onOpen(WebSocket ws) {
      webSocket = ws;
      ws.sendText(SUBSCRIBE_MESSAGE, true);
      log.info("RTDS websocket opened, subscribed to {} for {}", TOPIC, symbols);
      ws.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
      buf.append(data);
      if (last) {
        String message = buf.toString();
        buf.setLength(0);
        handleMessage(message);
      }
      ws.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
      if (webSocket == ws) {
        webSocket = null;
      }
      if (running.get()) {
        log.warn("RTDS websocket closed (status={}, reason={}), reconnecting", statusCode, reason);
        scheduleReconnect();
      }
      return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
      if (webSocket == ws) {
        webSocket = null;
      }
      if (running.get()) {
        log.warn("RTDS websocket error: {}, reconnecting", error.toString());
        scheduleReconnect();
      }
    }
  }
}
