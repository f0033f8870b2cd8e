package com.polybot.arb.domain;

import java.util.Locale;
import java.util.Optional;

public enum Outcome {
  UP("Up", 1),
  DOWN("Down", 2);

  private final String label;
  private final int indexSet;

  Outcome(String label, int indexSet) {
    this.label = label;
    this.indexSet = indexSet;
  }

  public String label() {
    return label;
  }

  /**
   * Conditional-tokens index set of this outcome slot (Up is slot 0, Down is slot 1).
   */
  public int indexSet() {
    return indexSet;
  }

  public Outcome opposite() {
    return this == UP ? DOWN : UP;
  }

  /**
   * Classifies a venue outcome label. Numeric labels "1"/"0" are also accepted.
   */
  public static Optional<Outcome> classify(String rawLabel) {
    if (rawLabel == null) {
      return Optional.empty();
    }
    String normalized = rawLabel.trim().toUpperCase(Locale.ROOT);
    if (normalized.contains("UP") || normalized.equals("1")) {
      return Optional.of(UP);
    }
    if (normalized.contains("DOWN") || normalized.equals("0")) {
      return Optional.of(DOWN);
    }
    return Optional.empty();
  }
}
