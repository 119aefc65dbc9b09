package com.swapbot.trader.control;

import com.swapbot.config.SwapBotProperties;
import com.swapbot.http.ExternalCallException;
import com.swapbot.trader.notify.TradeAlert;
import com.swapbot.trader.notify.TradeAlertPublisher;
import com.swapbot.trader.position.BuyResult;
import com.swapbot.trader.position.PositionMonitor;
import com.swapbot.trader.position.PositionSnapshot;
import com.swapbot.trader.wallet.WalletGateway;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operator commands: inspect positions and settings, change trading defaults, trigger a buy.
 *
 * Results carry a readable message and never an exception.
 */
@Slf4j
@RequiredArgsConstructor
public class TradingControlService {

    private final @NonNull SwapBotProperties.TradingMode mode;
    private final @NonNull TradingSettings settings;
    private final @NonNull PositionMonitor monitor;
    private final @NonNull WalletGateway wallet;
    private final @NonNull TradeAlertPublisher alerts;
    private final @NonNull Clock clock;
    private final @NonNull Duration buyTimeout;

    public List<PositionSnapshot> getSnapshot() {
        return monitor.snapshot();
    }

    public TradeParameters getSettings() {
        return settings.current();
    }

    public TradingStatus getStatus() {
        BigDecimal balance = null;
        try {
            balance = wallet.baseBalance();
        } catch (ExternalCallException e) {
            log.warn("wallet balance unavailable: {}", e.getMessage());
        }
        return new TradingStatus(
                mode.name(),
                monitor.isRunning(),
                settings.current().autoTradeEnabled(),
                monitor.openPositionCount(),
                wallet.publicKey(),
                balance
        );
    }

    public ControlResult setBuyAmount(BigDecimal amount) {
        return announce(settings.setBuyAmount(amount));
    }

    public ControlResult setTargetMultiplier(BigDecimal multiplier) {
        return announce(settings.setTargetMultiplier(multiplier));
    }

    public ControlResult setSellFraction(BigDecimal fraction) {
        return announce(settings.setSellFraction(fraction));
    }

    public ControlResult setAutoTradeEnabled(boolean enabled) {
        return announce(settings.setAutoTradeEnabled(enabled));
    }

    /**
     * Buys through the position monitor and waits up to the configured timeout for the outcome.
     */
    public BuyResult buy(String symbol, String address) {
        try {
            return monitor.submitBuy(symbol, address).get(buyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return BuyResult.of(BuyResult.BuyStatus.PENDING, symbol,
                    "buy of " + symbol + " is queued behind the current monitor cycle, the outcome will be notified");
        } catch (ExecutionException e) {
            log.error("buy of {} failed unexpectedly", symbol, e.getCause());
            return BuyResult.of(BuyResult.BuyStatus.FAILED, symbol, "buy of " + symbol + " failed: unexpected error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BuyResult.of(BuyResult.BuyStatus.REJECTED, symbol, "interrupted while waiting for the buy");
        }
    }

    public boolean triggerBuy(String symbol, String address) {
        return buy(symbol, address).success();
    }

    private ControlResult announce(ControlResult result) {
        if (result.accepted()) {
            alerts.publish(TradeAlert.of(TradeAlert.Type.SETTINGS_CHANGED, null, result.message(), clock.instant()));
        } else {
            log.info("settings change rejected: {}", result.message());
        }
        return result;
    }
}
