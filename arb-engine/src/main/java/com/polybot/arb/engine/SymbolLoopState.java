package com.polybot.arb.engine;

public enum SymbolLoopState {
  WAITING_FOR_OVERLAP,
  WAITING_FOR_REFERENCE_PRICES,
  TRADING,
  RESOLVING,
  REDEEMING,
  STOPPED,
  FAILED
}
