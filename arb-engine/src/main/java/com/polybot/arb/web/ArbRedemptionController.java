package com.polybot.arb.web;

import com.polybot.arb.engine.RedemptionCoordinator;
import com.polybot.arb.venue.RedemptionResult;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual redemption, for positions left behind by a disabled auto-redeem or a failed transaction.
 */
@RestController
@RequestMapping("/api/arb/redeem")
@RequiredArgsConstructor
@Slf4j
public class ArbRedemptionController {

  private final @NonNull RedemptionCoordinator redemption;

  @PostMapping("/{conditionId}")
  public ResponseEntity<RedemptionResult> redeem(@PathVariable String conditionId) {
    log.info("api /redeem conditionId={}", conditionId);
    return ResponseEntity.ok(redemption.redeemCondition(conditionId));
  }

  @PostMapping
  public ResponseEntity<Map<String, RedemptionResult>> sweep() {
    log.info("api /redeem sweep");
    return ResponseEntity.ok(redemption.sweepRedeemable());
  }
}
