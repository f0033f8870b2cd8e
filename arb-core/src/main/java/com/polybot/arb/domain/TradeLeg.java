package com.polybot.arb.domain;

import java.math.BigDecimal;

public record TradeLeg(String conditionId, String tokenId, Outcome outcome, BigDecimal price) {
}
