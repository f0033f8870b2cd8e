package com.polybot.arb.discovery;

import com.polybot.arb.domain.OutcomeTokens;
import com.polybot.arb.domain.Tenor;
import com.polybot.arb.venue.MarketToken;
import com.polybot.arb.venue.Quote;
import com.polybot.arb.venue.VenueMarket;
import com.polybot.arb.venue.VenueQuery;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketDiscoveryTest {

  private static final Instant P15 = Instant.ofEpochSecond(1_705_330_800L);
  private static final String SLUG = "btc-updown-15m-1705330800";

  private final FakeVenue venue = new FakeVenue();
  private final MarketDiscovery discovery = new MarketDiscovery(venue);

  @Test
  void findsActiveMarketBySlug() {
    venue.bySlug.put(SLUG, market("0xabc", true, false, "Will Bitcoin be above $97,000 at 10:15 ET?"));

    Optional<DiscoveredMarket> found = discovery.findMarket("BTC", Tenor.FIFTEEN_MINUTES, P15);

    assertThat(found).isPresent();
    assertThat(found.get().symbol()).isEqualTo("btc");
    assertThat(found.get().conditionId()).isEqualTo("0xabc");
    assertThat(found.get().slug()).isEqualTo(SLUG);
    assertThat(found.get().questionReferencePrice()).isEqualTo(97_000.0);
  }

  @Test
  void skipsMissingClosedOrInactiveMarkets() {
    assertThat(discovery.findMarket("btc", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();

    venue.bySlug.put(SLUG, market("0xabc", true, true, "q"));
    assertThat(discovery.findMarket("btc", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();

    venue.bySlug.put(SLUG, market("0xabc", false, false, "q"));
    assertThat(discovery.findMarket("btc", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();
  }

  @Test
  void lookupFailureIsTreatedAsNotFound() {
    venue.failLookups = true;

    assertThat(discovery.findMarket("btc", Tenor.FIFTEEN_MINUTES, P15)).isEmpty();
  }

  @Test
  void classifiesOutcomeTokens() {
    venue.byCondition.put("0xabc", new VenueMarket("0xabc", "q", SLUG, true, false, List.of(
        new MarketToken("222", "Down", false),
        new MarketToken("111", "Up", false))));

    OutcomeTokens tokens = discovery.getOutcomeTokens("0xabc");

    assertThat(tokens.up()).isEqualTo("111");
    assertThat(tokens.down()).isEqualTo("222");
  }

  @Test
  void failsWhenAnOutcomeIsMissing() {
    venue.byCondition.put("0xabc", new VenueMarket("0xabc", "q", SLUG, true, false, List.of(
        new MarketToken("111", "Up", false),
        new MarketToken("333", "Maybe", false))));

    assertThatThrownBy(() -> discovery.getOutcomeTokens("0xabc")).isInstanceOf(IllegalStateException.class);
  }

  private static VenueMarket market(String conditionId, boolean active, boolean closed, String question) {
    return new VenueMarket(conditionId, question, SLUG, active, closed, List.of());
  }

  private static final class FakeVenue implements VenueQuery {
    private final Map<String, VenueMarket> bySlug = new HashMap<>();
    private final Map<String, VenueMarket> byCondition = new HashMap<>();
    private boolean failLookups;

    @Override
    public Optional<VenueMarket> getMarketBySlug(String slug) {
      if (failLookups) {
        throw new IllegalStateException("gamma down");
      }
      return Optional.ofNullable(bySlug.get(slug));
    }

    @Override
    public VenueMarket getMarketByConditionId(String conditionId) {
      VenueMarket market = byCondition.get(conditionId);
      if (market == null) {
        throw new IllegalArgumentException("unknown condition " + conditionId);
      }
      return market;
    }

    @Override
    public Quote getOrderBookBestPrices(String tokenId) {
      return Quote.EMPTY;
    }
  }
}
