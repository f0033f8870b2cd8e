package com.polybot.arb.web;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.engine.ArbitrageOrchestrator;
import com.polybot.arb.engine.CumulativePnl;
import com.polybot.arb.engine.RedemptionCoordinator;
import com.polybot.arb.engine.SymbolLoopState;
import com.polybot.arb.engine.SymbolLoopStatus;
import com.polybot.arb.feed.PriceFeedCache;
import com.polybot.arb.polymarket.http.PolymarketHttpException;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.ReferencePriceStream;
import com.polybot.arb.venue.RedemptionResult;
import com.polybot.arb.venue.SettlementGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ArbStatusController.class, ArbRedemptionController.class})
@Import(ArbControllersTest.PropertiesConfig.class)
class ArbControllersTest {

  @TestConfiguration
  @EnableConfigurationProperties(ArbProperties.class)
  static class PropertiesConfig {
  }

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private ArbitrageOrchestrator orchestrator;
  @MockBean
  private CumulativePnl cumulativePnl;
  @MockBean
  private PriceFeedCache cache;
  @MockBean
  private OrderBookStream bookStream;
  @MockBean
  private ReferencePriceStream referencePriceStream;
  @MockBean
  private RedemptionCoordinator redemption;
  @MockBean
  private SettlementGateway settlement;

  @Test
  void statusReportsModeLoopsAndPnl() throws Exception {
    when(orchestrator.isRunning()).thenReturn(true);
    when(orchestrator.statuses()).thenReturn(List.of(new SymbolLoopStatus(
        "btc", SymbolLoopState.TRADING, Instant.parse("2024-01-15T15:00:00Z"), Instant.parse("2024-01-15T15:10:00Z"), 2, null)));
    when(cumulativePnl.total()).thenReturn(new BigDecimal("12.40"));
    when(referencePriceStream.isConnected()).thenReturn(true);
    when(bookStream.activeSubscriptions()).thenReturn(1);

    mockMvc.perform(get("/api/arb/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.mode").value("SIMULATION"))
        .andExpect(jsonPath("$.running").value(true))
        .andExpect(jsonPath("$.cumulativePnlUsd").value(12.40))
        .andExpect(jsonPath("$.orderBookSubscriptions").value(1))
        .andExpect(jsonPath("$.loops[0].symbol").value("btc"))
        .andExpect(jsonPath("$.loops[0].state").value("TRADING"))
        .andExpect(jsonPath("$.loops[0].tradesThisRound").value(2));
  }

  @Test
  void statusExplainsWhySettlementIsUnavailable() throws Exception {
    when(settlement.isConfigured()).thenReturn(false);
    when(settlement.unavailableReason())
        .thenReturn(Optional.of("Gnosis Safe wallets (signature type 2) are not supported for redemption"));

    mockMvc.perform(get("/api/arb/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.autoRedeem").value(true))
        .andExpect(jsonPath("$.settlementConfigured").value(false))
        .andExpect(jsonPath("$.settlementUnavailableReason")
            .value("Gnosis Safe wallets (signature type 2) are not supported for redemption"));
  }

  @Test
  void redeemReturnsSettlementResult() throws Exception {
    when(redemption.redeemCondition("0xabc")).thenReturn(RedemptionResult.confirmed("0xtx"));

    mockMvc.perform(post("/api/arb/redeem/0xabc"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.transactionHash").value("0xtx"));
  }

  @Test
  void unresolvedMarketMapsToConflict() throws Exception {
    when(redemption.redeemCondition("0xabc")).thenThrow(new IllegalStateException("market 0xabc is not resolved yet"));

    mockMvc.perform(post("/api/arb/redeem/0xabc"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("market 0xabc is not resolved yet"));
  }

  @Test
  void upstreamFailureMapsToBadGateway() throws Exception {
    when(redemption.sweepRedeemable()).thenThrow(new PolymarketHttpException(
        "GET", URI.create("https://data-api.polymarket.com/positions"), 503, "unavailable"));

    mockMvc.perform(post("/api/arb/redeem"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.status").value(503));
  }

  @Test
  void sweepListsResultsPerCondition() throws Exception {
    when(redemption.sweepRedeemable()).thenReturn(Map.of("0xabc", RedemptionResult.failed("not resolved")));

    mockMvc.perform(post("/api/arb/redeem"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$['0xabc'].success").value(false));
  }
}
