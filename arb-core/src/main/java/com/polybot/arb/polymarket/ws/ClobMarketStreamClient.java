package com.polybot.arb.polymarket.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.polymarket.model.PolymarketMarketParser;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.QuoteListener;
import com.polybot.arb.venue.StreamSubscription;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CLOB market channel. Each subscription owns its own socket so a finished trading round can drop its
 * tokens by closing it. Sockets are pinged every 10s and reopened after a close, an error, or a stale period.
 */
@Slf4j
public class ClobMarketStreamClient implements OrderBookStream {

  private static final long PING_INTERVAL_SECONDS = 10;
  private static final long MAINTENANCE_INTERVAL_SECONDS = 5;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final URI wsUri;
  private final long staleTimeoutMillis;
  private final long reconnectDelayMillis;

  private final Set<MarketSubscription> subscriptions = ConcurrentHashMap.newKeySet();
  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "clob-ws-maintenance");
    t.setDaemon(true);
    return t;
  });

  public ClobMarketStreamClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      String baseWsUrl,
      long staleTimeoutMillis,
      long reconnectDelayMillis
  ) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.wsUri = marketUri(baseWsUrl);
    this.staleTimeoutMillis = staleTimeoutMillis;
    this.reconnectDelayMillis = reconnectDelayMillis;
  }

  static URI marketUri(String baseWsUrl) {
    String base = baseWsUrl.endsWith("/") ? baseWsUrl.substring(0, baseWsUrl.length() - 1) : baseWsUrl;
    return URI.create(base + "/ws/market");
  }

  @Override
  public StreamSubscription subscribe(Collection<String> tokenIds, QuoteListener listener) {
    List<String> tokens = tokenIds.stream().filter(s -> s != null && !s.isBlank()).distinct().toList();
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("tokenIds must not be empty");
    }
    MarketSubscription subscription = new MarketSubscription(tokens, listener);
    subscriptions.add(subscription);
    subscription.start();
    return subscription;
  }

  @Override
  public int activeSubscriptions() {
    return subscriptions.size();
  }

  public void shutdown() {
    subscriptions.forEach(MarketSubscription::cancel);
    scheduler.shutdownNow();
  }

  String subscribeMessage(List<String> tokens) {
    try {
      return objectMapper.writeValueAsString(Map.of("assets_ids", tokens, "type", "market"));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to build market subscribe message", e);
    }
  }

  /**
   * Dispatches {@code book} and {@code price_change} events (single or batched in an array) for the given tokens.
   */
  void dispatch(String message, Set<String> tokens, QuoteListener listener) {
    JsonNode node;
    try {
      node = objectMapper.readTree(message);
    } catch (JsonProcessingException e) {
      log.debug("Ignoring non-JSON market ws frame: {}", message);
      return;
    }
    dispatch(node, tokens, listener);
  }

  private void dispatch(JsonNode node, Set<String> tokens, QuoteListener listener) {
    if (node == null || node.isNull()) {
      return;
    }
    if (node.isArray()) {
      node.forEach(n -> dispatch(n, tokens, listener));
      return;
    }
    switch (node.path("event_type").asText("")) {
      case "book" -> {
        String assetId = node.path("asset_id").asText(null);
        if (assetId != null && tokens.contains(assetId)) {
          listener.onQuote(assetId, PolymarketMarketParser.bestPrices(node));
        }
      }
      case "price_change" -> {
        for (JsonNode change : node.path("price_changes")) {
          String assetId = change.path("asset_id").asText(null);
          if (assetId == null || !tokens.contains(assetId)) {
            continue;
          }
          BigDecimal bid = PolymarketMarketParser.decimal(change.path("best_bid").asText(null));
          BigDecimal ask = PolymarketMarketParser.decimal(change.path("best_ask").asText(null));
          Quote quote = new Quote(bid, ask);
          if (!quote.isEmpty()) {
            listener.onQuote(assetId, quote);
          }
        }
      }
      default -> {
      }
    }
  }

  private final class MarketSubscription implements StreamSubscription {

    private final List<String> tokens;
    private final Set<String> tokenSet;
    private final QuoteListener listener;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean reconnectPending = new AtomicBoolean(false);
    private final AtomicLong lastMessageAtMillis = new AtomicLong(0);

    private volatile WebSocket webSocket;
    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> maintenanceTask;

    private MarketSubscription(List<String> tokens, QuoteListener listener) {
      this.tokens = tokens;
      this.tokenSet = Set.copyOf(tokens);
      this.listener = listener;
    }

    void start() {
      pingTask = scheduler.scheduleAtFixedRate(this::ping, PING_INTERVAL_SECONDS, PING_INTERVAL_SECONDS, TimeUnit.SECONDS);
      maintenanceTask = scheduler.scheduleAtFixedRate(this::checkStale,
          MAINTENANCE_INTERVAL_SECONDS, MAINTENANCE_INTERVAL_SECONDS, TimeUnit.SECONDS);
      connect();
    }

    private void connect() {
      if (cancelled.get()) {
        return;
      }
      log.info("Connecting market ws {} for {} tokens", wsUri, tokens.size());
      httpClient.newWebSocketBuilder()
          .buildAsync(wsUri, new Listener())
          .whenComplete((ws, error) -> {
            if (error != null) {
              log.warn("Market ws connect failed: {}", error.toString());
              scheduleReconnect();
            }
          });
    }

    private void scheduleReconnect() {
      if (cancelled.get() || !reconnectPending.compareAndSet(false, true)) {
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
        ws.sendPing(ByteBuffer.wrap(new byte[]{1})).exceptionally(e -> {
          log.debug("Market ws ping failed: {}", e.toString());
          return null;
        });
      }
    }

    private void checkStale() {
      WebSocket ws = webSocket;
      long last = lastMessageAtMillis.get();
      if (ws == null || staleTimeoutMillis <= 0 || last == 0) {
        return;
      }
      long silentFor = clock.millis() - last;
      if (silentFor > staleTimeoutMillis) {
        log.warn("Market ws stale for {}ms, reconnecting", silentFor);
        webSocket = null;
        ws.abort();
        scheduleReconnect();
      }
    }

    @Override
    public boolean isActive() {
      return !cancelled.get();
    }

    @Override
    public void cancel() {
      if (!cancelled.compareAndSet(false, true)) {
        return;
      }
      subscriptions.remove(this);
      ScheduledFuture<?> ping = pingTask;
      ScheduledFuture<?> maintenance = maintenanceTask;
      if (ping != null) {
        ping.cancel(false);
      }
      if (maintenance != null) {
        maintenance.cancel(false);
      }
      WebSocket ws = webSocket;
      webSocket = null;
      if (ws != null) {
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "unsubscribe").exceptionally(e -> {
          ws.abort();
          return null;
        });
      }
      log.info("Market ws subscription closed ({} tokens)", tokens.size());
    }

    private final class Listener implements WebSocket.Listener {
      private final StringBuilder buf = new StringBuilder(8192);

      @Override
      public void onOpen(WebSocket ws) {
        if (cancelled.get()) {
          ws.abort();
          return;
        }
        webSocket = ws;
        lastMessageAtMillis.set(clock.millis());
        ws.sendText(subscribeMessage(tokens), true);
        log.info("Market ws opened, subscribed {} tokens", tokens.size());
        ws.request(1);
      }

      @Override
      public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        buf.append(data);
        if (last) {
          String message = buf.toString();
          buf.setLength(0);
          lastMessageAtMillis.set(clock.millis());
          if (!cancelled.get() && !"PONG".equalsIgnoreCase(message)) {
            dispatch(message, tokenSet, listener);
          }
        }
        ws.request(1);
        return null;
      }

      @Override
      public CompletionStage<?> onPong(WebSocket ws, ByteBuffer message) {
        lastMessageAtMillis.set(clock.millis());
        ws.request(1);
        return null;
      }

      @Override
      public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        if (webSocket == ws) {
          webSocket = null;
        }
        if (!cancelled.get()) {
          log.warn("Market ws closed (status={}, reason={}), reconnecting", statusCode, reason);
          scheduleReconnect();
        }
        return null;
      }

      @Override
      public void onError(WebSocket ws, Throwable error) {
        if (webSocket == ws) {
          webSocket = null;
        }
        if (!cancelled.get()) {
          log.warn("Market ws error: {}, reconnecting", error.toString());
          scheduleReconnect();
        }
      }
    }
  }
}
