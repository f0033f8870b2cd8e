package com.polybot.arb.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Thin helpers over the Micrometer registry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolybotMetrics {

    private final MeterRegistry registry;

    /**
     * Register a gauge backed by a mutable BigDecimal and return the holder.
     */
    public AtomicReference<BigDecimal> registerAtomicBigDecimalGauge(String name, String description, BigDecimal initialValue, Tag... tags) {
        AtomicReference<BigDecimal> ref = new AtomicReference<>(initialValue != null ? initialValue : BigDecimal.ZERO);
        Gauge.builder(name, ref, r -> {
            BigDecimal value = r.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Registered gauge: {}", name);
        return ref;
    }

    /**
     * Register a gauge that samples a numeric supplier on scrape.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, s -> {
            Number value = s.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .strongReference(true)
                .register(registry);
        log.debug("Registered gauge: {}", name);
    }

    /**
     * Counter lookup-or-create; repeated calls with the same name and tags return the same counter.
     */
    public Counter counter(String name, String description, Tag... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(List.of(tags))
                .register(registry);
    }
}
