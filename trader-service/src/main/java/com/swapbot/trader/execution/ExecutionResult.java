package com.swapbot.trader.execution;

import java.math.BigDecimal;

/**
 * Result of one buy or sell.
 *
 * @param tokenAmount amount of the traded asset confirmed by the wallet (bought or sold)
 * @param price       base currency per unit of the traded asset, from the executed quote
 */
public record ExecutionResult(boolean success, BigDecimal tokenAmount, BigDecimal price, String signature, String reason) {

    public static ExecutionResult success(BigDecimal tokenAmount, BigDecimal price, String signature) {
        return new ExecutionResult(true, tokenAmount, price, signature, null);
    }

    public static ExecutionResult failure(String reason) {
        return new ExecutionResult(false, BigDecimal.ZERO, null, null, reason);
    }
}
