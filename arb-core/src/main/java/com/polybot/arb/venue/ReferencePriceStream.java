package com.polybot.arb.venue;

import java.util.Collection;

public interface ReferencePriceStream {

  void start(Collection<String> symbols, ReferenceTickListener listener);

  void stop();

  boolean isConnected();
}
