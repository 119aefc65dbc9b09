package com.swapbot.trader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swapbot.config.SwapBotProperties;
import com.swapbot.http.ErrorClassifier;
import com.swapbot.http.RequestRateLimiter;
import com.swapbot.http.ResilientExecutor;
import com.swapbot.http.RetryPolicy;
import com.swapbot.http.Sleeper;
import com.swapbot.http.SwapBotHttpTransport;
import com.swapbot.http.TokenBucketRateLimiter;
import com.swapbot.jupiter.JupiterClient;
import com.swapbot.jupiter.TokenDecimals;
import com.swapbot.solana.SolanaRpcClient;
import com.swapbot.trader.control.TradingControlService;
import com.swapbot.trader.control.TradingSettings;
import com.swapbot.trader.engine.TradingEngine;
import com.swapbot.trader.execution.ConfirmationPolicy;
import com.swapbot.trader.execution.PaperTradingVenue;
import com.swapbot.trader.execution.RpcTransactionSubmitter;
import com.swapbot.trader.execution.TradeExecutor;
import com.swapbot.trader.execution.TransactionSigner;
import com.swapbot.trader.execution.TransactionSubmitter;
import com.swapbot.trader.notify.LoggingTradeNotifier;
import com.swapbot.trader.notify.NotificationDispatcher;
import com.swapbot.trader.notify.TradeNotifier;
import com.swapbot.trader.notify.WebhookTradeNotifier;
import com.swapbot.trader.position.PositionMonitor;
import com.swapbot.trader.signal.CandidatePollingDriver;
import com.swapbot.trader.signal.JupiterTokenFeedSource;
import com.swapbot.trader.wallet.SolanaRpcWalletGateway;
import com.swapbot.trader.wallet.WalletGateway;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class TraderConfiguration {

  private static final Duration BUY_WAIT = Duration.ofSeconds(90);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public TokenDecimals tokenDecimals(SwapBotProperties properties) {
    SwapBotProperties.Jupiter jupiter = properties.jupiter();
    return new TokenDecimals(jupiter.defaultTokenDecimals(), jupiter.tokenDecimals());
  }

  @Bean
  public JupiterClient jupiterClient(
      SwapBotProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry,
      TokenDecimals tokenDecimals
  ) {
    SwapBotProperties.Jupiter jupiter = properties.jupiter();
    SwapBotHttpTransport transport = transport("jupiter", jupiter.rest().rateLimit(), jupiter.rest().retry(),
        httpClient, objectMapper, clock, meterRegistry);
    return new JupiterClient(URI.create(jupiter.baseUrl()), Duration.ofMillis(jupiter.requestTimeoutMillis()), transport, tokenDecimals);
  }

  @Bean
  public SolanaRpcClient solanaRpcClient(
      SwapBotProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    SwapBotProperties.Solana solana = properties.solana();
    SwapBotHttpTransport transport = transport("solana", solana.rest().rateLimit(), solana.rest().retry(),
        httpClient, objectMapper, clock, meterRegistry);
    return new SolanaRpcClient(URI.create(solana.rpcUrl()), Duration.ofMillis(solana.requestTimeoutMillis()), transport);
  }

  @Bean
  public TradingSettings tradingSettings(SwapBotProperties properties) {
    TradingSettings settings = TradingSettings.from(properties);
    log.info("trading defaults: {}", settings.current());
    return settings;
  }

  @Bean(destroyMethod = "shutdown")
  public NotificationDispatcher notificationDispatcher(
      SwapBotProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    SwapBotProperties.Notifications notifications = properties.notifications();
    List<TradeNotifier> notifiers = new ArrayList<>();
    notifiers.add(new LoggingTradeNotifier());
    if (notifications.webhookEnabled()) {
      SwapBotHttpTransport transport = transport("webhook", notifications.rateLimit(), notifications.retry(),
          httpClient, objectMapper, clock, meterRegistry);
      notifiers.add(new WebhookTradeNotifier(URI.create(notifications.webhookUrl()), Duration.ofSeconds(10), transport));
      log.info("webhook notifications enabled");
    }
    return new NotificationDispatcher(notifiers, notifications.queueCapacity(), meterRegistry);
  }

  @Bean
  public TradeExecutor tradeExecutor(
      SwapBotProperties properties,
      JupiterClient jupiterClient,
      TransactionSubmitter submitter,
      WalletGateway wallet
  ) {
    ConfirmationPolicy confirmation = ConfirmationPolicy.from(properties.solana().confirmation());
    return new TradeExecutor(jupiterClient, submitter, wallet, confirmation, Sleeper.system());
  }

  @Bean(destroyMethod = "stop")
  public PositionMonitor positionMonitor(
      SwapBotProperties properties,
      TradeExecutor tradeExecutor,
      TradingSettings settings,
      NotificationDispatcher notifications,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    SwapBotProperties.Monitor monitor = properties.monitor();
    PositionMonitor positionMonitor = new PositionMonitor(tradeExecutor, settings, notifications, clock,
        Duration.ofMillis(monitor.intervalMillis()), meterRegistry);
    if (monitor.enabled()) {
      positionMonitor.start();
    } else {
      log.info("position monitor is disabled");
    }
    return positionMonitor;
  }

  @Bean
  public TradingEngine tradingEngine(
      PositionMonitor monitor,
      TradingSettings settings,
      TokenDecimals tokenDecimals,
      NotificationDispatcher notifications,
      Clock clock
  ) {
    return new TradingEngine(monitor, settings, tokenDecimals, notifications, clock);
  }

  @Bean
  public TradingControlService tradingControlService(
      SwapBotProperties properties,
      TradingSettings settings,
      PositionMonitor monitor,
      WalletGateway wallet,
      NotificationDispatcher notifications,
      Clock clock
  ) {
    return new TradingControlService(properties.mode(), settings, monitor, wallet, notifications, clock, BUY_WAIT);
  }

  @Bean(destroyMethod = "stop")
  @ConditionalOnProperty(prefix = "swapbot.signals.token-feed", name = "enabled", havingValue = "true")
  public CandidatePollingDriver tokenFeedDriver(
      SwapBotProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry,
      TokenDecimals tokenDecimals,
      TradingEngine engine
  ) {
    SwapBotProperties.TokenFeed feed = properties.signals().tokenFeed();
    SwapBotHttpTransport transport = transport("token-feed", feed.rest().rateLimit(), feed.rest().retry(),
        httpClient, objectMapper, clock, meterRegistry);
    JupiterTokenFeedSource source = new JupiterTokenFeedSource(URI.create(feed.url()), Duration.ofSeconds(15),
        Duration.ofMillis(feed.pollIntervalMillis()), transport, tokenDecimals);
    CandidatePollingDriver driver = new CandidatePollingDriver(source, engine, meterRegistry);
    driver.start();
    return driver;
  }

  @Configuration
  @ConditionalOnProperty(prefix = "swapbot", name = "mode", havingValue = "PAPER", matchIfMissing = true)
  static class PaperVenueConfiguration {

    @Bean
    public PaperTradingVenue paperTradingVenue(SwapBotProperties properties) {
      log.info("PAPER mode: swaps settle against a simulated wallet ({} SOL)", properties.paper().initialBaseBalance());
      return new PaperTradingVenue(properties.paper().initialBaseBalance());
    }
  }

  @Configuration
  @ConditionalOnProperty(prefix = "swapbot", name = "mode", havingValue = "LIVE")
  static class LiveVenueConfiguration {

    @Bean
    public WalletGateway walletGateway(SwapBotProperties properties, SolanaRpcClient rpc, TokenDecimals tokenDecimals) {
      String publicKey = properties.solana().walletPublicKey();
      if (publicKey.isBlank()) {
        throw new IllegalStateException("LIVE mode requires swapbot.solana.wallet-public-key");
      }
      return new SolanaRpcWalletGateway(rpc, publicKey, tokenDecimals);
    }

    @Bean
    public TransactionSubmitter transactionSubmitter(
        SwapBotProperties properties,
        SolanaRpcClient rpc,
        ObjectProvider<TransactionSigner> signer
    ) {
      TransactionSigner available = signer.getIfAvailable();
      if (available == null) {
        throw new IllegalStateException("LIVE mode requires a TransactionSigner bean");
      }
      log.warn("LIVE mode: swaps are signed and submitted to the Solana RPC node");
      ConfirmationPolicy confirmation = ConfirmationPolicy.from(properties.solana().confirmation());
      return new RpcTransactionSubmitter(rpc, available, confirmation, Sleeper.system());
    }
  }

  static SwapBotHttpTransport transport(
      String name,
      SwapBotProperties.RateLimit rateLimit,
      SwapBotProperties.Retry retry,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    RetryPolicy retryPolicy = buildRetryPolicy(retry);
    ResilientExecutor executor = new ResilientExecutor(
        name,
        buildRateLimiter(rateLimit, clock),
        retryPolicy,
        new ErrorClassifier(retryPolicy.defaultThrottleWait(), clock),
        Sleeper.system(),
        meterRegistry
    );
    return new SwapBotHttpTransport(httpClient, objectMapper, executor);
  }

  static RequestRateLimiter buildRateLimiter(SwapBotProperties.RateLimit cfg, Clock clock) {
    if (cfg == null || !cfg.enabled()) {
      return RequestRateLimiter.noop();
    }
    if (cfg.requestsPerSecond() <= 0 || cfg.burst() <= 0) {
      return RequestRateLimiter.noop();
    }
    return new TokenBucketRateLimiter(cfg.requestsPerSecond(), cfg.burst(), clock);
  }

  static RetryPolicy buildRetryPolicy(SwapBotProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.disabled();
    }
    return new RetryPolicy(
        cfg.enabled(),
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.baseDelayMillis()),
        Math.max(0, cfg.defaultThrottleWaitMillis())
    );
  }
}
