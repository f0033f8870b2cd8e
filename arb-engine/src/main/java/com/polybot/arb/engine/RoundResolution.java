package com.polybot.arb.engine;

/**
 * Winning token of each market in a traded overlap.
 */
public record RoundResolution(String winnerToken15, String winnerToken5) {
}
