package com.swapbot.trader.execution;

import com.swapbot.config.SwapBotProperties;

import java.time.Duration;

/**
 * Bounds on following a submitted swap: signature status checks, then wallet reads until holdings move.
 */
public record ConfirmationPolicy(int maxStatusPolls, int maxHoldingsReads, Duration pollInterval) {

    public ConfirmationPolicy {
        if (maxStatusPolls < 1 || maxHoldingsReads < 1) {
            throw new IllegalArgumentException("confirmation polls must be positive");
        }
        if (pollInterval == null || pollInterval.isNegative()) {
            pollInterval = Duration.ZERO;
        }
    }

    /** A single status check and a single wallet read. */
    public static ConfirmationPolicy immediate() {
        return new ConfirmationPolicy(1, 1, Duration.ZERO);
    }

    public static ConfirmationPolicy from(SwapBotProperties.Confirmation properties) {
        return new ConfirmationPolicy(properties.maxStatusPolls(), properties.maxHoldingsReads(),
                Duration.ofMillis(properties.pollIntervalMillis()));
    }
}
