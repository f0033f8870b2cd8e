package com.polybot.arb.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeTest {

  @Test
  void classifiesVenueLabels() {
    assertThat(Outcome.classify("Up")).contains(Outcome.UP);
    assertThat(Outcome.classify(" down ")).contains(Outcome.DOWN);
    assertThat(Outcome.classify("1")).contains(Outcome.UP);
    assertThat(Outcome.classify("0")).contains(Outcome.DOWN);
    assertThat(Outcome.classify("Yes")).isEmpty();
  }

  @Test
  void indexSetsMatchOutcomeSlots() {
    assertThat(Outcome.UP.indexSet()).isEqualTo(1);
    assertThat(Outcome.DOWN.indexSet()).isEqualTo(2);
    assertThat(Outcome.UP.opposite()).isEqualTo(Outcome.DOWN);
  }
}
