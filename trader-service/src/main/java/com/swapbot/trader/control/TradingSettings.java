package com.swapbot.trader.control;

import com.swapbot.config.SwapBotProperties;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Runtime-adjustable trading defaults shared by the control surface and the position monitor.
 *
 * Readers get an immutable {@link TradeParameters}; a change is visible from the next buy on. Setters validate
 * and leave the settings untouched when the value is out of range.
 */
@Slf4j
public class TradingSettings {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AtomicReference<TradeParameters> current;

    public TradingSettings(TradeParameters initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public static TradingSettings from(SwapBotProperties properties) {
        SwapBotProperties.Trading trading = properties.trading();
        return new TradingSettings(new TradeParameters(
                trading.autoTradeEnabled(),
                trading.buyAmount(),
                trading.targetMultiplier(),
                trading.sellFraction(),
                properties.jupiter().slippageBps()
        ));
    }

    public TradeParameters current() {
        return current.get();
    }

    public ControlResult setAutoTradeEnabled(boolean enabled) {
        update(p -> p.withAutoTradeEnabled(enabled));
        return ControlResult.accepted("auto-trading " + (enabled ? "enabled" : "disabled"));
    }

    public ControlResult setBuyAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return ControlResult.rejected("buy amount must be greater than 0");
        }
        update(p -> p.withBuyAmount(amount));
        return ControlResult.accepted("buy amount set to " + amount.toPlainString() + " SOL");
    }

    public ControlResult setTargetMultiplier(BigDecimal multiplier) {
        if (multiplier == null || multiplier.compareTo(BigDecimal.ONE) <= 0) {
            return ControlResult.rejected("target multiplier must be greater than 1");
        }
        update(p -> p.withTargetMultiplier(multiplier));
        return ControlResult.accepted("target multiplier set to " + multiplier.toPlainString() + "x");
    }

    public ControlResult setSellFraction(BigDecimal fraction) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(HUNDRED) > 0) {
            return ControlResult.rejected("sell percentage must be greater than 0 and at most 100");
        }
        update(p -> p.withSellFraction(fraction));
        return ControlResult.accepted("sell percentage set to " + fraction.toPlainString() + "%");
    }

    private void update(UnaryOperator<TradeParameters> change) {
        TradeParameters updated = current.updateAndGet(change);
        log.info("trading settings updated: {}", updated);
    }
}
