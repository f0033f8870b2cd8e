package com.polybot.arb.venue;

import java.util.Collection;

/**
 * Live best bid/ask updates. Implementations reconnect on their own until the subscription is cancelled.
 */
public interface OrderBookStream {

  StreamSubscription subscribe(Collection<String> tokenIds, QuoteListener listener);

  int activeSubscriptions();
}
