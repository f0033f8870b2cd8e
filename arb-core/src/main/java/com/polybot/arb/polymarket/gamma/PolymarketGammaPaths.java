package com.polybot.arb.polymarket.gamma;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PolymarketGammaPaths {

  public static final String EVENTS_BY_SLUG = "/events/slug/";

  public static String eventBySlug(String slug) {
    return EVENTS_BY_SLUG + slug;
  }
}
