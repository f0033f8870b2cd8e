package com.polybot.arb.metrics;

import com.polybot.arb.config.ArbProperties;
import io.micrometer.core.instrument.Tag;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Metrics for the cross-tenor engine.
 * Tracks cumulative PnL plus per-symbol trade, skip and failure counts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArbMetricsService {

    private final PolybotMetrics metrics;
    private final ArbProperties properties;

    private AtomicReference<BigDecimal> cumulativePnl;
    private AtomicReference<BigDecimal> lastPeriodPnl;

    @PostConstruct
    public void initializeMetrics() {
        log.info("Initializing arb metrics...");

        cumulativePnl = metrics.registerAtomicBigDecimalGauge(
                "arb_cumulative_pnl_usd",
                "Realized PnL in USD since service start",
                BigDecimal.ZERO
        );

        lastPeriodPnl = metrics.registerAtomicBigDecimalGauge(
                "arb_last_period_pnl_usd",
                "Realized PnL in USD of the most recently settled round",
                BigDecimal.ZERO
        );

        log.info("Arb metrics initialized");
    }

    public void updateCumulativePnl(BigDecimal value) {
        if (cumulativePnl != null && value != null) {
            cumulativePnl.set(value);
        }
    }

    public void updateLastPeriodPnl(BigDecimal value) {
        if (lastPeriodPnl != null && value != null) {
            lastPeriodPnl.set(value);
        }
    }

    /**
     * Live feed sizes, sampled on scrape.
     */
    public void registerFeedGauges(Supplier<Number> cachedQuotes, Supplier<Number> orderBookSubscriptions) {
        metrics.registerGauge("arb_cached_quotes", "Order-book quotes currently held in the price cache", cachedQuotes);
        metrics.registerGauge("arb_order_book_subscriptions", "Open order-book websocket subscriptions",
                orderBookSubscriptions);
    }

    public void recordTrade(String symbol) {
        metrics.counter("arb_trades_recorded_total", "Trades recorded (simulated or live)",
                Tag.of("symbol", symbol), Tag.of("mode", properties.mode().name().toLowerCase())).increment();
    }

    public void recordLegFailure(String symbol) {
        metrics.counter("arb_leg_failures_total", "Order legs that were not accepted",
                Tag.of("symbol", symbol)).increment();
    }

    public void recordOverlapSkipped(String symbol, String reason) {
        metrics.counter("arb_overlaps_skipped_total", "Overlap windows skipped before trading",
                Tag.of("symbol", symbol), Tag.of("reason", reason)).increment();
    }

    public void recordResolutionTimeout(String symbol) {
        metrics.counter("arb_resolution_timeouts_total", "Rounds whose markets did not resolve in time",
                Tag.of("symbol", symbol)).increment();
    }

    public void recordRedemption(boolean success) {
        metrics.counter("arb_redemptions_total", "On-chain redemption attempts",
                Tag.of("result", success ? "success" : "failure")).increment();
    }
}
