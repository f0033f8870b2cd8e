package com.polybot.arb.domain;

import java.math.BigDecimal;

public record ArbLeg(String tokenId, Outcome outcome, BigDecimal ask) {
}
