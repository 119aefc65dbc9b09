package com.swapbot.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class SwapBotPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "swapbot.mode=LIVE",
        "swapbot.jupiter.slippage-bps=100",
        "swapbot.jupiter.token-decimals.[MintA]=6",
        "swapbot.jupiter.rest.retry.max-attempts=5",
        "swapbot.solana.wallet-public-key=Wallet111",
        "swapbot.solana.confirmation.max-holdings-reads=4",
        "swapbot.trading.auto-trade-enabled=true",
        "swapbot.trading.buy-amount=0.25",
        "swapbot.monitor.interval-millis=5000",
        "swapbot.notifications.webhook-url=http://localhost:9000/hook"
    ).run(context -> {
      SwapBotProperties properties = context.getBean(SwapBotProperties.class);

      assertThat(properties.mode()).isEqualTo(SwapBotProperties.TradingMode.LIVE);
      assertThat(properties.jupiter().slippageBps()).isEqualTo(100);
      assertThat(properties.jupiter().tokenDecimals()).containsEntry("MintA", 6);
      assertThat(properties.jupiter().rest().retry().maxAttempts()).isEqualTo(5);
      assertThat(properties.jupiter().rest().rateLimit().enabled()).isTrue();
      assertThat(properties.solana().walletPublicKey()).isEqualTo("Wallet111");
      assertThat(properties.solana().confirmation().maxHoldingsReads()).isEqualTo(4);
      assertThat(properties.solana().confirmation().maxStatusPolls()).isEqualTo(30);
      assertThat(properties.trading().autoTradeEnabled()).isTrue();
      assertThat(properties.trading().buyAmount()).isEqualByComparingTo("0.25");
      assertThat(properties.monitor().intervalMillis()).isEqualTo(5_000L);
      assertThat(properties.notifications().webhookEnabled()).isTrue();
    });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    runner.run(context -> {
      SwapBotProperties properties = context.getBean(SwapBotProperties.class);

      assertThat(properties.mode()).isEqualTo(SwapBotProperties.TradingMode.PAPER);
      assertThat(properties.jupiter().baseUrl()).isEqualTo("https://quote-api.jup.ag/v6");
      assertThat(properties.jupiter().slippageBps()).isEqualTo(50);
      assertThat(properties.jupiter().defaultTokenDecimals()).isEqualTo(9);
      assertThat(properties.solana().confirmation().maxStatusPolls()).isEqualTo(30);
      assertThat(properties.solana().confirmation().pollIntervalMillis()).isEqualTo(1_000L);
      assertThat(properties.trading().autoTradeEnabled()).isFalse();
      assertThat(properties.trading().buyAmount()).isEqualByComparingTo(new BigDecimal("0.1"));
      assertThat(properties.trading().targetMultiplier()).isEqualByComparingTo("2.0");
      assertThat(properties.trading().sellFraction()).isEqualByComparingTo("80");
      assertThat(properties.monitor().intervalMillis()).isEqualTo(30_000L);
      assertThat(properties.notifications().rateLimit().burst()).isEqualTo(20);
      assertThat(properties.notifications().retry().baseDelayMillis()).isEqualTo(5_000L);
      assertThat(properties.notifications().webhookEnabled()).isFalse();
    });
  }

  @Test
  void rejectsOutOfRangeTradingDefaults() {
    runner.withPropertyValues("swapbot.trading.target-multiplier=1.0")
        .run(context -> assertThat(context).hasFailed());
    runner.withPropertyValues("swapbot.trading.sell-fraction=150")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(SwapBotProperties.class)
  static class TestConfig {
  }
}
