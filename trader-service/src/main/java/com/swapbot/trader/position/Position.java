package com.swapbot.trader.position;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Objects;

/**
 * A held amount of one asset bought with the base currency.
 *
 * Target multiplier and sell fraction are fixed when the position opens. Values are expressed in the base
 * currency. After each partial exit the entry value is re-based to {@code currentPrice * heldAmount}, so the
 * profit target applies to the remaining holding from the exit price onwards.
 *
 * Not thread-safe: only the position monitor loop mutates positions.
 */
public final class Position {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final MathContext MC = MathContext.DECIMAL64;

    private final String symbol;
    private final String address;
    private final BigDecimal entryPrice;
    private final BigDecimal targetMultiplier;
    private final BigDecimal sellFraction;
    private final Instant openedAt;

    private BigDecimal heldAmount;
    private BigDecimal currentPrice;
    private BigDecimal entryValue;
    private BigDecimal currentValue;
    private BigDecimal profitPercent;
    private PositionStatus status;
    private Instant lastUpdatedAt;

    private Position(
            String symbol,
            String address,
            BigDecimal heldAmount,
            BigDecimal entryPrice,
            BigDecimal targetMultiplier,
            BigDecimal sellFraction,
            Instant openedAt
    ) {
        this.symbol = symbol;
        this.address = address;
        this.heldAmount = heldAmount;
        this.entryPrice = entryPrice;
        this.targetMultiplier = targetMultiplier;
        this.sellFraction = sellFraction;
        this.openedAt = openedAt;
        this.currentPrice = entryPrice;
        this.entryValue = entryPrice.multiply(heldAmount, MC);
        this.currentValue = entryValue;
        this.profitPercent = BigDecimal.ZERO;
        this.status = PositionStatus.ACTIVE;
        this.lastUpdatedAt = openedAt;
    }

    /**
     * Opens a position after a confirmed buy.
     *
     * @throws IllegalArgumentException if amount or price are not positive, the multiplier is not above 1
     *                                  or the fraction is outside (0, 100]
     */
    public static Position open(
            String symbol,
            String address,
            BigDecimal heldAmount,
            BigDecimal entryPrice,
            BigDecimal targetMultiplier,
            BigDecimal sellFraction,
            Instant now
    ) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        requirePositive(heldAmount, "heldAmount");
        requirePositive(entryPrice, "entryPrice");
        Objects.requireNonNull(targetMultiplier, "targetMultiplier");
        Objects.requireNonNull(sellFraction, "sellFraction");
        if (targetMultiplier.compareTo(BigDecimal.ONE) <= 0) {
            throw new IllegalArgumentException("targetMultiplier must be > 1, was " + targetMultiplier);
        }
        if (sellFraction.signum() <= 0 || sellFraction.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException("sellFraction must be in (0, 100], was " + sellFraction);
        }
        return new Position(symbol, address, heldAmount, entryPrice, targetMultiplier, sellFraction,
                Objects.requireNonNull(now, "now"));
    }

    /**
     * Re-values the position at {@code newPrice}. Ignored for non-positive prices and completed positions.
     *
     * @return whether the price was applied
     */
    public boolean updatePrice(BigDecimal newPrice, Instant now) {
        if (newPrice == null || newPrice.signum() <= 0 || status == PositionStatus.COMPLETED) {
            return false;
        }
        currentPrice = newPrice;
        currentValue = newPrice.multiply(heldAmount, MC);
        profitPercent = computeProfitPercent();
        lastUpdatedAt = now;
        return true;
    }

    public boolean isTargetReached() {
        if (status != PositionStatus.ACTIVE) {
            return false;
        }
        BigDecimal targetPercent = targetMultiplier.subtract(BigDecimal.ONE).multiply(HUNDRED);
        return profitPercent.compareTo(targetPercent) >= 0;
    }

    /**
     * Amount to sell when the target is reached: {@code sellFraction} percent of the current holding.
     */
    public BigDecimal exitAmount() {
        BigDecimal amount = heldAmount.multiply(sellFraction, MC).divide(HUNDRED, MC);
        return amount.compareTo(heldAmount) > 0 ? heldAmount : amount;
    }

    /**
     * Records a confirmed sale of {@code soldAmount}.
     *
     * @throws IllegalStateException if the position is already completed
     */
    public void applyPartialExit(BigDecimal soldAmount, Instant now) {
        if (status == PositionStatus.COMPLETED) {
            throw new IllegalStateException("position " + symbol + " is completed");
        }
        requirePositive(soldAmount, "soldAmount");

        BigDecimal remaining = heldAmount.subtract(soldAmount);
        lastUpdatedAt = now;
        if (remaining.signum() <= 0) {
            heldAmount = BigDecimal.ZERO;
            entryValue = BigDecimal.ZERO;
            currentValue = BigDecimal.ZERO;
            profitPercent = BigDecimal.ZERO;
            status = PositionStatus.COMPLETED;
            return;
        }
        heldAmount = remaining;
        entryValue = currentPrice.multiply(heldAmount, MC);
        currentValue = entryValue;
        profitPercent = computeProfitPercent();
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(
                symbol,
                address,
                heldAmount,
                entryPrice,
                currentPrice,
                entryValue,
                currentValue,
                profitPercent,
                targetMultiplier,
                sellFraction,
                status,
                openedAt,
                lastUpdatedAt
        );
    }

    private BigDecimal computeProfitPercent() {
        if (entryValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return currentValue.divide(entryValue, MC).subtract(BigDecimal.ONE).multiply(HUNDRED, MC);
    }

    private static void requirePositive(BigDecimal value, String name) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, was " + value);
        }
    }

    public String symbol() {
        return symbol;
    }

    public String address() {
        return address;
    }

    public BigDecimal heldAmount() {
        return heldAmount;
    }

    public BigDecimal entryPrice() {
        return entryPrice;
    }

    public BigDecimal currentPrice() {
        return currentPrice;
    }

    public BigDecimal entryValue() {
        return entryValue;
    }

    public BigDecimal currentValue() {
        return currentValue;
    }

    public BigDecimal profitPercent() {
        return profitPercent;
    }

    public BigDecimal targetMultiplier() {
        return targetMultiplier;
    }

    public BigDecimal sellFraction() {
        return sellFraction;
    }

    public PositionStatus status() {
        return status;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public Instant lastUpdatedAt() {
        return lastUpdatedAt;
    }
}
