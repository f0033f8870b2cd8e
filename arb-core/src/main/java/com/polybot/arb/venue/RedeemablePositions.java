package com.polybot.arb.venue;

import java.util.List;

/**
 * Lists conditions in which the funder wallet holds redeemable positions.
 */
public interface RedeemablePositions {

  List<String> redeemableConditionIds();
}
