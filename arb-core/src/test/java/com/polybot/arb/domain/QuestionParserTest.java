package com.polybot.arb.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionParserTest {

  @Test
  void readsPriceAfterAbove() {
    assertThat(QuestionParser.referencePrice("Will Bitcoin be above $97,500.25 at 10:15 ET?"))
        .hasValue(97_500.25);
  }

  @Test
  void fallsBackToFirstDollarAmount() {
    assertThat(QuestionParser.referencePrice("XRP Up or Down from $0.5123?")).hasValue(0.5123);
  }

  @Test
  void emptyWhenNoPriceIsPresent() {
    assertThat(QuestionParser.referencePrice("Bitcoin Up or Down - January 15, 10:00AM-10:15AM ET")).isEmpty();
    assertThat(QuestionParser.referencePrice(null)).isEmpty();
  }
}
