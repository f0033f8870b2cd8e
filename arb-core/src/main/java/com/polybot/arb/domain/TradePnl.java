package com.polybot.arb.domain;

import java.math.BigDecimal;

public record TradePnl(BigDecimal cost, BigDecimal payout, BigDecimal pnl, boolean won15, boolean won5) {
}
