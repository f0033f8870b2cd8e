package com.polybot.arb.engine;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Realized PnL across all symbols since startup.
 */
@Component
public class CumulativePnl {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private BigDecimal total = BigDecimal.ZERO;

  /**
   * @return the new total
   */
  public BigDecimal add(BigDecimal delta) {
    lock.writeLock().lock();
    try {
      if (delta != null) {
        total = total.add(delta);
      }
      return total;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public BigDecimal total() {
    lock.readLock().lock();
    try {
      return total;
    } finally {
      lock.readLock().unlock();
    }
  }
}
