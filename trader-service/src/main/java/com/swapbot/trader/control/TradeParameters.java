package com.swapbot.trader.control;

import java.math.BigDecimal;

/**
 * Global trading defaults. New positions snapshot the multiplier and sell fraction at entry.
 *
 * @param buyAmount   base currency spent per buy
 * @param slippageBps slippage tolerance for buys, sells and price quotes
 */
public record TradeParameters(
        boolean autoTradeEnabled,
        BigDecimal buyAmount,
        BigDecimal targetMultiplier,
        BigDecimal sellFraction,
        int slippageBps
) {

    TradeParameters withAutoTradeEnabled(boolean enabled) {
        return new TradeParameters(enabled, buyAmount, targetMultiplier, sellFraction, slippageBps);
    }

    TradeParameters withBuyAmount(BigDecimal amount) {
        return new TradeParameters(autoTradeEnabled, amount, targetMultiplier, sellFraction, slippageBps);
    }

    TradeParameters withTargetMultiplier(BigDecimal multiplier) {
        return new TradeParameters(autoTradeEnabled, buyAmount, multiplier, sellFraction, slippageBps);
    }

    TradeParameters withSellFraction(BigDecimal fraction) {
        return new TradeParameters(autoTradeEnabled, buyAmount, targetMultiplier, fraction, slippageBps);
    }
}
