package com.polybot.arb.domain;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Extracts the "price to beat" from a market question such as
 * {@code "Will Bitcoin be above $97,500 at 10:15 ET?"}.
 */
@UtilityClass
public class QuestionParser {

  private static final String ABOVE_MARKER = "above ";

  public static OptionalDouble referencePrice(String question) {
    if (question == null || question.isBlank()) {
      return OptionalDouble.empty();
    }
    int marker = question.toLowerCase(Locale.ROOT).indexOf(ABOVE_MARKER);
    if (marker < 0) {
      marker = question.indexOf('$');
    }
    if (marker < 0) {
      return OptionalDouble.empty();
    }

    int pos = marker;
    while (pos < question.length()) {
      char c = question.charAt(pos);
      if (c == '$' || Character.isDigit(c)) {
        break;
      }
      pos++;
    }
    if (pos >= question.length()) {
      return OptionalDouble.empty();
    }
    if (question.charAt(pos) == '$') {
      pos++;
    }

    StringBuilder digits = new StringBuilder();
    while (pos < question.length()) {
      char c = question.charAt(pos);
      if (Character.isDigit(c) || c == '.') {
        digits.append(c);
      } else if (c != ',') {
        break;
      }
      pos++;
    }
    if (digits.length() == 0) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(digits.toString()));
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }
}
