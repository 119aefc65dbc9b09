package com.swapbot.trader.position;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable copy of a {@link Position} handed to readers outside the monitor loop.
 */
public record PositionSnapshot(
        String symbol,
        String address,
        BigDecimal heldAmount,
        BigDecimal entryPrice,
        BigDecimal currentPrice,
        BigDecimal entryValue,
        BigDecimal currentValue,
        BigDecimal profitPercent,
        BigDecimal targetMultiplier,
        BigDecimal sellFraction,
        PositionStatus status,
        Instant openedAt,
        Instant lastUpdatedAt
) {
}
