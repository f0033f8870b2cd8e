package com.polybot.arb.engine;

import com.polybot.arb.domain.RedemptionTarget;

import java.math.BigDecimal;
import java.util.List;

public record RoundSettlement(BigDecimal periodPnl, BigDecimal cumulativePnl, List<RedemptionTarget> redemptionTargets) {
}
