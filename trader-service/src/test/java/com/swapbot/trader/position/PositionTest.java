package com.swapbot.trader.position;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionTest {

    private static final Instant OPENED = Instant.parse("2026-01-10T09:00:00Z");
    private static final Instant LATER = OPENED.plusSeconds(30);

    private static Position position(String held, String price, String multiplier, String fraction) {
        return Position.open("BONK", "BonkMint", new BigDecimal(held), new BigDecimal(price),
                new BigDecimal(multiplier), new BigDecimal(fraction), OPENED);
    }

    @Test
    void opensAtEntryWithZeroProfit() {
        Position position = position("50", "0.002", "2.0", "80");

        assertThat(position.status()).isEqualTo(PositionStatus.ACTIVE);
        assertThat(position.entryValue()).isEqualByComparingTo("0.1");
        assertThat(position.currentValue()).isEqualByComparingTo("0.1");
        assertThat(position.profitPercent()).isEqualByComparingTo("0");
        assertThat(position.isTargetReached()).isFalse();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> position("0", "0.1", "2.0", "80")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> position("1", "0", "2.0", "80")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> position("1", "0.1", "1.0", "80")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> position("1", "0.1", "2.0", "0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> position("1", "0.1", "2.0", "100.5")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updatePriceRevaluesAndIgnoresNonPositivePrices() {
        Position position = position("10", "0.1", "2.0", "50");

        assertThat(position.updatePrice(new BigDecimal("0.15"), LATER)).isTrue();
        assertThat(position.currentValue()).isEqualByComparingTo("1.5");
        assertThat(position.profitPercent()).isEqualByComparingTo("50");
        assertThat(position.lastUpdatedAt()).isEqualTo(LATER);

        assertThat(position.updatePrice(BigDecimal.ZERO, LATER.plusSeconds(30))).isFalse();
        assertThat(position.updatePrice(new BigDecimal("-1"), LATER.plusSeconds(30))).isFalse();
        assertThat(position.currentPrice()).isEqualByComparingTo("0.15");
        assertThat(position.lastUpdatedAt()).isEqualTo(LATER);
    }

    @Test
    void targetReachedIsMonotonicInPrice() {
        Position position = position("10", "0.1", "2.0", "50");
        boolean reached = false;
        for (int cents = 1; cents <= 40; cents++) {
            position.updatePrice(new BigDecimal(cents).movePointLeft(2), LATER);
            if (reached) {
                assertThat(position.isTargetReached()).as("price %s", position.currentPrice()).isTrue();
            }
            reached = position.isTargetReached();
        }
        assertThat(reached).isTrue();
    }

    @Test
    void targetIsReachedExactlyAtTheMultiplier() {
        Position position = position("10", "0.1", "2.0", "50");

        position.updatePrice(new BigDecimal("0.1999"), LATER);
        assertThat(position.isTargetReached()).isFalse();

        position.updatePrice(new BigDecimal("0.2"), LATER);
        assertThat(position.isTargetReached()).isTrue();
    }

    @Test
    void partialExitHalvesHoldingAndRebasesEntryValue() {
        Position position = position("10", "0.1", "2.0", "50");
        position.updatePrice(new BigDecimal("0.2"), LATER);
        assertThat(position.profitPercent()).isEqualByComparingTo("100");

        BigDecimal exit = position.exitAmount();
        assertThat(exit).isEqualByComparingTo("5");
        position.applyPartialExit(exit, LATER);

        assertThat(position.heldAmount()).isEqualByComparingTo("5");
        assertThat(position.status()).isEqualTo(PositionStatus.ACTIVE);
        assertThat(position.entryValue()).isEqualByComparingTo("1.0");
        assertThat(position.profitPercent()).isEqualByComparingTo("0");
        assertThat(position.isTargetReached()).isFalse();
        assertThat(position.exitAmount()).isEqualByComparingTo("2.5");
    }

    @Test
    void soldAmountsPlusRemainderEqualPurchase() {
        BigDecimal purchased = new BigDecimal("123.456789");
        Position position = Position.open("WIF", "WifMint", purchased, new BigDecimal("0.01"),
                new BigDecimal("1.5"), new BigDecimal("80"), OPENED);
        BigDecimal sold = BigDecimal.ZERO;
        BigDecimal price = new BigDecimal("0.01");

        for (int i = 0; i < 5; i++) {
            price = price.multiply(new BigDecimal("2"));
            position.updatePrice(price, LATER);
            assertThat(position.isTargetReached()).isTrue();
            BigDecimal exit = position.exitAmount();
            assertThat(exit).isLessThanOrEqualTo(position.heldAmount());
            position.applyPartialExit(exit, LATER);
            sold = sold.add(exit);
            assertThat(position.heldAmount()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
        }

        assertThat(sold.add(position.heldAmount())).isEqualByComparingTo(purchased);
    }

    @Test
    void fullExitCompletesAndFreezesThePosition() {
        Position position = position("10", "0.1", "2.0", "100");
        position.updatePrice(new BigDecimal("0.3"), LATER);

        position.applyPartialExit(position.exitAmount(), LATER);

        assertThat(position.status()).isEqualTo(PositionStatus.COMPLETED);
        assertThat(position.heldAmount()).isEqualByComparingTo("0");
        assertThat(position.isTargetReached()).isFalse();
        assertThat(position.updatePrice(new BigDecimal("1"), LATER.plusSeconds(60))).isFalse();
        assertThat(position.currentPrice()).isEqualByComparingTo("0.3");
        assertThatThrownBy(() -> position.applyPartialExit(BigDecimal.ONE, LATER))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void oversellClampsHoldingAtZero() {
        Position position = position("10", "0.1", "2.0", "50");

        position.applyPartialExit(new BigDecimal("11"), LATER);

        assertThat(position.heldAmount()).isEqualByComparingTo("0");
        assertThat(position.status()).isEqualTo(PositionStatus.COMPLETED);
    }

    @Test
    void snapshotIsDetachedFromLaterUpdates() {
        Position position = position("10", "0.1", "2.0", "50");
        PositionSnapshot before = position.snapshot();

        position.updatePrice(new BigDecimal("0.5"), LATER);

        assertThat(before.currentPrice()).isEqualByComparingTo("0.1");
        assertThat(position.snapshot().currentPrice()).isEqualByComparingTo("0.5");
    }
}
