package com.polybot.arb.venue;

public interface StreamSubscription extends AutoCloseable {

  boolean isActive();

  void cancel();

  @Override
  default void close() {
    cancel();
  }
}
