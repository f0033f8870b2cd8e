package com.polybot.arb.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ArbPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    runner.run(context -> {
      ArbProperties properties = context.getBean(ArbProperties.class);

      assertThat(properties.mode()).isEqualTo(ArbProperties.TradingMode.SIMULATION);
      assertThat(properties.isLive()).isFalse();
      assertThat(properties.strategy().symbols()).containsExactly("btc", "eth", "sol", "xrp");
      assertThat(properties.strategy().sumThreshold()).isEqualByComparingTo("0.99");
      assertThat(properties.strategy().shares()).isEqualByComparingTo("10");
      assertThat(properties.strategy().tradeIntervalSeconds()).isEqualTo(60L);
      assertThat(properties.strategy().toleranceFor("btc")).isEqualTo(10.0);
      assertThat(properties.strategy().toleranceFor("xrp")).isEqualTo(0.0003);
      assertThat(properties.polymarket().chainId()).isEqualTo(137);
      assertThat(properties.polymarket().clobRestUrl()).isEqualTo("https://clob.polymarket.com");
      assertThat(properties.risk().killSwitch()).isFalse();
      assertThat(properties.settlement().gasLimitMultiplier()).isEqualTo(1.25);
    });
  }

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "arb.mode=LIVE",
        "arb.strategy.symbols=BTC, doge ,btc",
        "arb.strategy.sum-threshold=0.97",
        "arb.strategy.price-to-beat-tolerance.doge=0.001",
        "arb.strategy.auto-redeem=false",
        "arb.polymarket.auth.signature-type=1",
        "arb.polymarket.rest.retry.max-attempts=5",
        "arb.risk.max-order-size=25"
    ).run(context -> {
      ArbProperties properties = context.getBean(ArbProperties.class);

      assertThat(properties.isLive()).isTrue();
      assertThat(properties.strategy().symbols()).containsExactly("btc", "doge");
      assertThat(properties.strategy().sumThreshold()).isEqualByComparingTo("0.97");
      assertThat(properties.strategy().toleranceFor("DOGE")).isEqualTo(0.001);
      assertThat(properties.strategy().toleranceFor("eth")).isEqualTo(1.0);
      assertThat(properties.strategy().toleranceFor("ada")).isEqualTo(0.0);
      assertThat(properties.strategy().autoRedeem()).isFalse();
      assertThat(properties.polymarket().auth().signatureType()).isEqualTo(1);
      assertThat(properties.polymarket().rest().retry().maxAttempts()).isEqualTo(5);
      assertThat(properties.risk().maxOrderSize()).isEqualByComparingTo("25");
    });
  }

  @Test
  void rejectsOutOfRangeThreshold() {
    runner.withPropertyValues("arb.strategy.sum-threshold=3.5")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ArbProperties.class)
  static class TestConfig {
  }
}
