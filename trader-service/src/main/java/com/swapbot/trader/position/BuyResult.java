package com.swapbot.trader.position;

/**
 * Outcome of a buy request. {@code message} is meant for the operator and never carries raw error text.
 */
public record BuyResult(BuyStatus status, String symbol, String message, PositionSnapshot position) {

    public enum BuyStatus {
        OPENED,
        ALREADY_TRADING,
        AUTO_TRADE_DISABLED,
        /**
         * Quote, swap or submission failed, or the bought amount could not be confirmed.
         */
        FAILED,
        /**
         * Invalid request or the monitor is not accepting buys.
         */
        REJECTED,
        /**
         * Still queued behind the current monitor cycle.
         */
        PENDING
    }

    public static BuyResult opened(PositionSnapshot position) {
        return new BuyResult(BuyStatus.OPENED, position.symbol(),
                "bought %s %s at %s".formatted(position.heldAmount().toPlainString(), position.symbol(),
                        position.entryPrice().toPlainString()),
                position);
    }

    public static BuyResult of(BuyStatus status, String symbol, String message) {
        return new BuyResult(status, symbol, message, null);
    }

    public boolean success() {
        return status == BuyStatus.OPENED;
    }
}
