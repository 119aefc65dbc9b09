package com.swapbot.trader.position;

public enum PositionStatus {
    ACTIVE,
    /**
     * Nothing left to sell. Terminal.
     */
    COMPLETED
}
