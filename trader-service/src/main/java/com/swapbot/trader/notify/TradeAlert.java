package com.swapbot.trader.notify;

import java.time.Instant;
import java.util.Map;

public record TradeAlert(Type type, String symbol, String message, Instant at, Map<String, String> details) {

    public TradeAlert {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static TradeAlert of(Type type, String symbol, String message, Instant at) {
        return new TradeAlert(type, symbol, message, at, Map.of());
    }

    public enum Type {
        CANDIDATE_DETECTED,
        BUY_EXECUTED,
        BUY_FAILED,
        TARGET_REACHED,
        EXIT_EXECUTED,
        EXIT_FAILED,
        POSITION_CLOSED,
        SETTINGS_CHANGED
    }
}
