package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.feed.PriceFeedCache;
import com.polybot.arb.metrics.ArbMetricsService;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.ReferencePriceStream;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts the reference-price stream, then one independent loop thread per configured symbol.
 * Loops share nothing mutable except the price cache and the cumulative PnL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArbitrageOrchestrator implements SmartLifecycle {

  private final @NonNull ArbProperties properties;
  private final @NonNull ReferencePriceStream referencePriceStream;
  private final @NonNull PriceFeedCache cache;
  private final @NonNull OrderBookStream bookStream;
  private final @NonNull ArbMetricsService metrics;
  private final @NonNull SymbolLoopFactory loopFactory;
  private final @NonNull Sleeper sleeper;

  private final Map<String, SymbolArbitrageLoop> loops = new ConcurrentHashMap<>();
  private final List<Thread> threads = new ArrayList<>();
  private volatile boolean running;

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    List<String> symbols = properties.strategy().symbols();
    log.info("Starting cross-tenor arbitrage mode={} symbols={} threshold={} shares={}",
        properties.mode(), symbols, properties.strategy().sumThreshold(), properties.strategy().shares());
    running = true;
    metrics.registerFeedGauges(cache::quoteCount, bookStream::activeSubscriptions);
    referencePriceStream.start(symbols, cache);
    try {
      sleeper.sleep(Duration.ofMillis(properties.strategy().startupDelayMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted during startup delay, loops not started");
      return;
    }

    for (String symbol : symbols) {
      SymbolArbitrageLoop loop = loopFactory.create(symbol);
      Thread thread = new Thread(loop, "arb-" + symbol);
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler((t, e) -> log.error("[{}] loop thread died", symbol, e));
      loops.put(symbol, loop);
      threads.add(thread);
      thread.start();
    }
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    log.info("Stopping cross-tenor arbitrage ({} loops)", loops.size());
    loops.values().forEach(SymbolArbitrageLoop::stop);
    threads.forEach(Thread::interrupt);
    threads.clear();
    referencePriceStream.stop();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public List<SymbolLoopStatus> statuses() {
    List<SymbolLoopStatus> out = new ArrayList<>();
    for (String symbol : properties.strategy().symbols()) {
      SymbolArbitrageLoop loop = loops.get(symbol);
      if (loop != null) {
        out.add(loop.status());
      }
    }
    return out;
  }
}
