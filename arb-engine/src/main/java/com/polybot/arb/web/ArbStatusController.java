package com.polybot.arb.web;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.engine.ArbitrageOrchestrator;
import com.polybot.arb.engine.CumulativePnl;
import com.polybot.arb.engine.SymbolLoopStatus;
import com.polybot.arb.feed.PriceFeedCache;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.ReferencePriceStream;
import com.polybot.arb.venue.SettlementGateway;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/arb")
@RequiredArgsConstructor
public class ArbStatusController {

  private final @NonNull ArbProperties properties;
  private final @NonNull ArbitrageOrchestrator orchestrator;
  private final @NonNull CumulativePnl cumulativePnl;
  private final @NonNull PriceFeedCache cache;
  private final @NonNull OrderBookStream bookStream;
  private final @NonNull ReferencePriceStream referencePriceStream;
  private final @NonNull SettlementGateway settlement;

  @GetMapping("/status")
  public ResponseEntity<ArbStatusResponse> status() {
    ArbProperties.Strategy strategy = properties.strategy();
    return ResponseEntity.ok(new ArbStatusResponse(properties.mode().name(), orchestrator.isRunning(), strategy.symbols(),
        strategy.sumThreshold(), strategy.shares(), cumulativePnl.total(), referencePriceStream.isConnected(),
        bookStream.activeSubscriptions(), cache.quoteCount(), properties.strategy().autoRedeem(), settlement.isConfigured(),
        settlement.unavailableReason().orElse(null), orchestrator.statuses()));
  }

  public record ArbStatusResponse(String mode, boolean running, List<String> symbols, BigDecimal sumThreshold,
                                  BigDecimal shares, BigDecimal cumulativePnlUsd, boolean referenceStreamConnected,
                                  int orderBookSubscriptions, int cachedQuotes, boolean autoRedeem,
                                  boolean settlementConfigured, String settlementUnavailableReason,
                                  List<SymbolLoopStatus> loops) {
  }
}
