package com.swapbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

@Validated
@ConfigurationProperties(prefix="swapbot")
public record SwapBotProperties(
    TradingMode mode,
    @Valid Jupiter jupiter,
    @Valid Solana solana,
    @Valid Trading trading,
    @Valid Monitor monitor,
    @Valid Signals signals,
    @Valid Notifications notifications,
    @Valid Paper paper
) {

  public SwapBotProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (jupiter == null) {
      jupiter = new Jupiter(null, null, null, null, null, null);
    }
    if (solana == null) {
      solana = new Solana(null, null, null, null, null);
    }
    if (trading == null) {
      trading = new Trading(null, null, null, null);
    }
    if (monitor == null) {
      monitor = new Monitor(null, null);
    }
    if (signals == null) {
      signals = new Signals(null);
    }
    if (notifications == null) {
      notifications = new Notifications(null, null, null, null);
    }
    if (paper == null) {
      paper = new Paper(null);
    }
  }

  private static Rest defaultRest() {
    return new Rest(null, null);
  }

  private static Map<String, Integer> sanitizeDecimals(Map<String, Integer> values) {
    if (values == null || values.isEmpty()) {
      return Map.of();
    }
    return values.entrySet().stream()
        .filter(e -> e.getKey() != null && !e.getKey().isBlank())
        .filter(e -> e.getValue() != null && e.getValue() >= 0)
        .collect(Collectors.toUnmodifiableMap(e -> e.getKey().trim(), Map.Entry::getValue));
  }

  public enum TradingMode {
    /**
     * Real quotes, simulated settlement against an in-memory wallet.
     */
    PAPER,
    /**
     * Signed transactions submitted to the configured RPC node.
     */
    LIVE,
  }

  public record Jupiter(
      String baseUrl,
      @NotNull @Min(1) @Max(10_000) Integer slippageBps,
      /**
       * Decimal precision assumed for mints whose precision is not known from the wallet,
       * a signal source or {@code tokenDecimals}. A warning is logged the first time it is used per mint.
       */
      @NotNull @Min(0) @Max(18) Integer defaultTokenDecimals,
      /**
       * Explicit per-mint decimal overrides.
       */
      Map<String, Integer> tokenDecimals,
      @NotNull @Min(100) Long requestTimeoutMillis,
      @Valid Rest rest
  ) {
    public Jupiter {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://quote-api.jup.ag/v6";
      }
      if (slippageBps == null) {
        slippageBps = 50;
      }
      if (defaultTokenDecimals == null) {
        defaultTokenDecimals = 9;
      }
      tokenDecimals = sanitizeDecimals(tokenDecimals);
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 10_000L;
      }
      if (rest == null) {
        rest = defaultRest();
      }
    }
  }

  public record Solana(
      String rpcUrl,
      /**
       * Public key of the trading wallet (base58). Required in LIVE mode.
       */
      String walletPublicKey,
      @NotNull @Min(100) Long requestTimeoutMillis,
      @Valid Rest rest,
      @Valid Confirmation confirmation
  ) {
    public Solana {
      if (rpcUrl == null || rpcUrl.isBlank()) {
        rpcUrl = "https://api.mainnet-beta.solana.com";
      }
      if (walletPublicKey == null) {
        walletPublicKey = "";
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 15_000L;
      }
      if (rest == null) {
        rest = defaultRest();
      }
      if (confirmation == null) {
        confirmation = new Confirmation(null, null, null);
      }
    }
  }

  /**
   * How long a submitted swap is followed before its outcome is decided.
   */
  public record Confirmation(
      /**
       * Signature status checks before giving up on a confirmation.
       */
      @NotNull @Min(1) Integer maxStatusPolls,
      /**
       * Wallet reads while waiting for holdings to reflect a landed swap.
       */
      @NotNull @Min(1) Integer maxHoldingsReads,
      @NotNull @PositiveOrZero Long pollIntervalMillis
  ) {
    public Confirmation {
      if (maxStatusPolls == null) {
        maxStatusPolls = 30;
      }
      if (maxHoldingsReads == null) {
        maxHoldingsReads = 10;
      }
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 1_000L;
      }
    }
  }

  public record Rest(@Valid RateLimit rateLimit, @Valid Retry retry) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = new RateLimit(null, null, null);
      }
      if (retry == null) {
        retry = new Retry(null, null, null, null);
      }
    }
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 5.0;
      }
      if (burst == null) {
        burst = 10;
      }
    }
  }

  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      /**
       * Constant delay between attempts for transient failures.
       */
      @NotNull @PositiveOrZero Long baseDelayMillis,
      /**
       * Wait applied to a throttled response that does not say how long to wait.
       */
      @NotNull @PositiveOrZero Long defaultThrottleWaitMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (baseDelayMillis == null) {
        baseDelayMillis = 1_000L;
      }
      if (defaultThrottleWaitMillis == null) {
        defaultThrottleWaitMillis = 60_000L;
      }
    }
  }

  /**
   * Startup values of the runtime-adjustable trading parameters.
   */
  public record Trading(
      @NotNull Boolean autoTradeEnabled,
      /**
       * Amount of the base currency (SOL) spent per buy.
       */
      @NotNull @Positive BigDecimal buyAmount,
      @NotNull @DecimalMin(value = "1.0", inclusive = false) BigDecimal targetMultiplier,
      @NotNull @Positive @DecimalMax("100") BigDecimal sellFraction
  ) {
    public Trading {
      if (autoTradeEnabled == null) {
        autoTradeEnabled = false;
      }
      if (buyAmount == null) {
        buyAmount = new BigDecimal("0.1");
      }
      if (targetMultiplier == null) {
        targetMultiplier = new BigDecimal("2.0");
      }
      if (sellFraction == null) {
        sellFraction = new BigDecimal("80");
      }
    }
  }

  public record Monitor(
      @NotNull Boolean enabled,
      @NotNull @Min(100) Long intervalMillis
  ) {
    public Monitor {
      if (enabled == null) {
        enabled = true;
      }
      if (intervalMillis == null) {
        intervalMillis = 30_000L;
      }
    }
  }

  public record Signals(@Valid TokenFeed tokenFeed) {
    public Signals {
      if (tokenFeed == null) {
        tokenFeed = new TokenFeed(null, null, null, null);
      }
    }
  }

  /**
   * HTTP token feed polled for candidate assets.
   */
  public record TokenFeed(
      @NotNull Boolean enabled,
      String url,
      @NotNull @Min(1_000) Long pollIntervalMillis,
      @Valid Rest rest
  ) {
    public TokenFeed {
      if (enabled == null) {
        enabled = false;
      }
      if (url == null || url.isBlank()) {
        url = "https://tokens.jup.ag/tokens?tags=birdeye-trending";
      }
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 60_000L;
      }
      if (rest == null) {
        rest = defaultRest();
      }
    }
  }

  public record Notifications(
      /**
       * Webhook receiving JSON alerts. When blank, alerts are only logged.
       */
      String webhookUrl,
      @NotNull @Min(1) Integer queueCapacity,
      @Valid RateLimit rateLimit,
      @Valid Retry retry
  ) {
    public Notifications {
      if (webhookUrl == null) {
        webhookUrl = "";
      }
      if (queueCapacity == null) {
        queueCapacity = 1_000;
      }
      if (rateLimit == null) {
        // 20 messages per minute
        rateLimit = new RateLimit(true, 20.0 / 60.0, 20);
      }
      if (retry == null) {
        retry = new Retry(true, 3, 5_000L, 60_000L);
      }
    }

    public boolean webhookEnabled() {
      return !Objects.requireNonNullElse(webhookUrl, "").isBlank();
    }
  }

  public record Paper(
      /**
       * Starting base-currency balance of the simulated wallet.
       */
      @NotNull @PositiveOrZero BigDecimal initialBaseBalance
  ) {
    public Paper {
      if (initialBaseBalance == null) {
        initialBaseBalance = new BigDecimal("10");
      }
    }
  }
}
