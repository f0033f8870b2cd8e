package com.polybot.arb.feed;

import com.polybot.arb.domain.Tenor;
import com.polybot.arb.domain.WindowClock;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.QuoteListener;
import com.polybot.arb.venue.ReferenceTickListener;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared cache of live best prices per outcome token and of reference ("price to beat") values per
 * (symbol, tenor, period start).
 *
 * <p>Quotes are overwritten in place, except that updates looking like an empty-book placeholder
 * (bid under 0.05 and/or ask over 0.95) are dropped. Reference values are first-write-wins.
 * Each map has its own read/write lock, held only for the map access.
 */
@Slf4j
public class PriceFeedCache implements QuoteListener, ReferenceTickListener {

  public static final BigDecimal PLACEHOLDER_BID_FLOOR = new BigDecimal("0.05");
  public static final BigDecimal PLACEHOLDER_ASK_CEILING = new BigDecimal("0.95");

  private static final Duration REFERENCE_RETENTION = Duration.ofHours(2);

  private final Duration captureWindow;

  private final ReentrantReadWriteLock quoteLock = new ReentrantReadWriteLock();
  private final Map<String, Quote> quotes = new HashMap<>();

  private final ReentrantReadWriteLock referenceLock = new ReentrantReadWriteLock();
  private final Map<SeriesKey, NavigableMap<Instant, Double>> references = new HashMap<>();

  public PriceFeedCache(Duration captureWindow) {
    if (captureWindow == null || captureWindow.isNegative() || captureWindow.isZero()) {
      throw new IllegalArgumentException("captureWindow must be > 0");
    }
    this.captureWindow = captureWindow;
  }

  public static boolean isPlaceholder(Quote quote) {
    BigDecimal bid = quote.bid();
    BigDecimal ask = quote.ask();
    boolean lowBid = bid != null && bid.compareTo(PLACEHOLDER_BID_FLOOR) < 0;
    boolean highAsk = ask != null && ask.compareTo(PLACEHOLDER_ASK_CEILING) > 0;
    if (bid != null && ask != null) {
      return lowBid && highAsk;
    }
    return lowBid || highAsk;
  }

  @Override
  public void onQuote(String tokenId, Quote quote) {
    applyQuote(tokenId, quote);
  }

  /**
   * @return whether the update was stored
   */
  public boolean applyQuote(String tokenId, Quote update) {
    if (tokenId == null || tokenId.isBlank() || update == null || update.isEmpty()) {
      return false;
    }
    if (isPlaceholder(update)) {
      log.trace("Dropping placeholder quote token={} bid={} ask={}", tokenId, update.bid(), update.ask());
      return false;
    }
    quoteLock.writeLock().lock();
    try {
      quotes.merge(tokenId, update, Quote::merge);
    } finally {
      quoteLock.writeLock().unlock();
    }
    return true;
  }

  public Optional<Quote> quote(String tokenId) {
    quoteLock.readLock().lock();
    try {
      return Optional.ofNullable(quotes.get(tokenId));
    } finally {
      quoteLock.readLock().unlock();
    }
  }

  /**
   * @return the cached best ask, or {@code null} when unknown
   */
  public BigDecimal bestAsk(String tokenId) {
    return quote(tokenId).map(Quote::ask).orElse(null);
  }

  public void evictQuotes(Collection<String> tokenIds) {
    if (tokenIds == null || tokenIds.isEmpty()) {
      return;
    }
    quoteLock.writeLock().lock();
    try {
      quotes.keySet().removeAll(tokenIds);
    } finally {
      quoteLock.writeLock().unlock();
    }
  }

  public int quoteCount() {
    quoteLock.readLock().lock();
    try {
      return quotes.size();
    } finally {
      quoteLock.readLock().unlock();
    }
  }

  @Override
  public void onTick(String symbol, Instant timestamp, double value) {
    offerReferenceTick(symbol, timestamp, value);
  }

  /**
   * Captures a tick as the reference of every tenor whose current period started no more than the capture
   * window before the tick.
   */
  public void offerReferenceTick(String symbol, Instant timestamp, double value) {
    if (symbol == null || symbol.isBlank() || timestamp == null || !Double.isFinite(value)) {
      return;
    }
    for (Tenor tenor : Tenor.values()) {
      Instant start = WindowClock.periodStart(timestamp, tenor);
      if (!timestamp.isBefore(start) && timestamp.isBefore(start.plus(captureWindow))) {
        if (captureReference(symbol, tenor, start, value)) {
          log.info("Captured {} {} reference price {} for period {}",
              symbol.toUpperCase(Locale.ROOT), tenor.label(), value, start);
        }
      }
    }
  }

  /**
   * @return {@code true} when the value was stored, {@code false} when the slot was already filled
   */
  public boolean captureReference(String symbol, Tenor tenor, Instant periodStart, double value) {
    SeriesKey key = new SeriesKey(normalize(symbol), tenor);
    referenceLock.writeLock().lock();
    try {
      NavigableMap<Instant, Double> series = references.computeIfAbsent(key, k -> new TreeMap<>());
      if (series.putIfAbsent(periodStart, value) != null) {
        return false;
      }
      // drop periods older than the retention window
      series.headMap(periodStart.minus(REFERENCE_RETENTION), false).clear();
      return true;
    } finally {
      referenceLock.writeLock().unlock();
    }
  }

  public OptionalDouble referencePrice(String symbol, Tenor tenor, Instant periodStart) {
    SeriesKey key = new SeriesKey(normalize(symbol), tenor);
    referenceLock.readLock().lock();
    try {
      NavigableMap<Instant, Double> series = references.get(key);
      Double value = series == null ? null : series.get(periodStart);
      return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    } finally {
      referenceLock.readLock().unlock();
    }
  }

  int retainedReferences(String symbol, Tenor tenor) {
    referenceLock.readLock().lock();
    try {
      NavigableMap<Instant, Double> series = references.get(new SeriesKey(normalize(symbol), tenor));
      return series == null ? 0 : series.size();
    } finally {
      referenceLock.readLock().unlock();
    }
  }

  private static String normalize(String symbol) {
    return symbol == null ? "" : symbol.trim().toLowerCase(Locale.ROOT);
  }

  private record SeriesKey(String symbol, Tenor tenor) {
  }
}
