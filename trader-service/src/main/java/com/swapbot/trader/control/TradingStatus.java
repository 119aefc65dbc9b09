package com.swapbot.trader.control;

import java.math.BigDecimal;

/**
 * @param baseBalance wallet base currency balance, {@code null} when the wallet could not be read
 */
public record TradingStatus(
        String mode,
        boolean monitorRunning,
        boolean autoTradeEnabled,
        int openPositions,
        String walletPublicKey,
        BigDecimal baseBalance
) {
}
