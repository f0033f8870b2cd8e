package com.polybot.arb.metrics;

import com.polybot.arb.engine.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ArbMetricsServiceTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ArbMetricsService metrics = new ArbMetricsService(new PolybotMetrics(registry), TestProperties.simulation());

  @Test
  void feedGaugesSampleOnRead() {
    AtomicInteger quotes = new AtomicInteger(4);
    AtomicInteger subscriptions = new AtomicInteger(1);
    metrics.registerFeedGauges(quotes::get, subscriptions::get);

    assertThat(registry.get("arb_cached_quotes").gauge().value()).isEqualTo(4.0);
    quotes.set(0);
    subscriptions.set(0);
    assertThat(registry.get("arb_cached_quotes").gauge().value()).isEqualTo(0.0);
    assertThat(registry.get("arb_order_book_subscriptions").gauge().value()).isEqualTo(0.0);
  }

  @Test
  void pnlGaugesAndTaggedCounters() {
    metrics.initializeMetrics();
    metrics.updateCumulativePnl(new BigDecimal("54.00"));
    metrics.recordTrade("btc");
    metrics.recordOverlapSkipped("eth", "reference_mismatch");

    assertThat(registry.get("arb_cumulative_pnl_usd").gauge().value()).isEqualTo(54.0);
    assertThat(registry.get("arb_trades_recorded_total").tags("symbol", "btc", "mode", "simulation").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("arb_overlaps_skipped_total").tags("symbol", "eth", "reason", "reference_mismatch")
        .counter().count()).isEqualTo(1.0);
  }
}
