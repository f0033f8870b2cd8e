package com.polybot.arb.engine;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.feed.PriceFeedCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration(proxyBeanMethods = false)
public class EngineConfiguration {

  @Bean
  public PriceFeedCache priceFeedCache(ArbProperties properties) {
    return new PriceFeedCache(Duration.ofSeconds(properties.strategy().referenceCaptureWindowSeconds()));
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.threadSleeper();
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService arbLegExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "arb-leg-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }
}
