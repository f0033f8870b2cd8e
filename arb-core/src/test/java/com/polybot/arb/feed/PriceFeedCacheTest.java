package com.polybot.arb.feed;

import com.polybot.arb.domain.Tenor;
import com.polybot.arb.venue.Quote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriceFeedCacheTest {

  private static final Instant P15 = Instant.parse("2024-01-15T15:00:00Z");

  private final PriceFeedCache cache = new PriceFeedCache(Duration.ofSeconds(2));

  @Test
  void mergesPartialQuoteUpdates() {
    cache.applyQuote("t1", new Quote(new BigDecimal("0.44"), new BigDecimal("0.46")));
    cache.applyQuote("t1", new Quote(null, new BigDecimal("0.45")));

    assertThat(cache.quote("t1")).contains(new Quote(new BigDecimal("0.44"), new BigDecimal("0.45")));
    assertThat(cache.bestAsk("t1")).isEqualByComparingTo("0.45");
    assertThat(cache.bestAsk("unknown")).isNull();
  }

  @Test
  void dropsPlaceholderQuotes() {
    boolean stored = cache.applyQuote("t1", new Quote(new BigDecimal("0.01"), new BigDecimal("0.99")));

    assertThat(stored).isFalse();
    assertThat(cache.quote("t1")).isEmpty();
    assertThat(PriceFeedCache.isPlaceholder(new Quote(null, new BigDecimal("0.99")))).isTrue();
    assertThat(PriceFeedCache.isPlaceholder(new Quote(new BigDecimal("0.01"), new BigDecimal("0.50")))).isFalse();
  }

  @Test
  void evictsTokensOfFinishedRound() {
    cache.applyQuote("t1", new Quote(new BigDecimal("0.40"), new BigDecimal("0.42")));
    cache.applyQuote("t2", new Quote(new BigDecimal("0.50"), new BigDecimal("0.52")));

    cache.evictQuotes(List.of("t1"));

    assertThat(cache.quoteCount()).isEqualTo(1);
    assertThat(cache.quote("t1")).isEmpty();
  }

  @Test
  void capturesTickWithinWindowForEveryTenorStartingThen() {
    cache.onTick("btc", P15.plusMillis(800), 97_000.0);

    assertThat(cache.referencePrice("btc", Tenor.FIFTEEN_MINUTES, P15)).hasValue(97_000.0);
    assertThat(cache.referencePrice("BTC", Tenor.FIVE_MINUTES, P15)).hasValue(97_000.0);
  }

  @Test
  void ignoresTicksOutsideCaptureWindow() {
    cache.onTick("btc", P15.plusSeconds(2), 97_000.0);
    cache.onTick("btc", P15.minusMillis(1), 96_999.0);

    assertThat(cache.referencePrice("btc", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();
  }

  @Test
  void fiveMinuteBoundaryInsideFifteenMinutePeriodOnlyCapturesFiveMinuteReference() {
    Instant p5 = P15.plusSeconds(600);
    cache.onTick("eth", p5.plusMillis(500), 3_100.5);

    assertThat(cache.referencePrice("eth", Tenor.FIVE_MINUTES, p5)).hasValue(3_100.5);
    assertThat(cache.referencePrice("eth", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();
  }

  @Test
  void firstCapturedValueWins() {
    cache.onTick("sol", P15.plusMillis(100), 150.10);
    cache.onTick("sol", P15.plusMillis(900), 150.90);

    assertThat(cache.referencePrice("sol", Tenor.FIFTEEN_MINUTES, P15)).hasValue(150.10);
    assertThat(cache.captureReference("sol", Tenor.FIFTEEN_MINUTES, P15, 1.0)).isFalse();
  }

  @Test
  void prunesReferencesOlderThanRetention() {
    cache.captureReference("xrp", Tenor.FIFTEEN_MINUTES, P15, 0.51);
    cache.captureReference("xrp", Tenor.FIFTEEN_MINUTES, P15.plus(Duration.ofHours(3)), 0.52);

    assertThat(cache.referencePrice("xrp", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();
  }

  @Test
  void pruningOnlyTouchesTheCapturedSeries() {
    for (int i = 0; i < 12; i++) {
      cache.captureReference("btc", Tenor.FIFTEEN_MINUTES, P15.plus(Duration.ofMinutes(15L * i)), 97_000.0 + i);
    }
    cache.captureReference("eth", Tenor.FIFTEEN_MINUTES, P15, 3_100.0);

    assertThat(cache.retainedReferences("btc", Tenor.FIFTEEN_MINUTES)).isEqualTo(9);
    assertThat(cache.referencePrice("btc", Tenor.FIFTEEN_MINUTES, P15.plus(Duration.ofMinutes(45)))).hasValue(97_003.0);
    assertThat(cache.referencePrice("btc", Tenor.FIFTEEN_MINUTES, P15.plus(Duration.ofMinutes(30)))).isEmpty();
    assertThat(cache.referencePrice("eth", Tenor.FIFTEEN_MINUTES, P15)).hasValue(3_100.0);
  }
}
