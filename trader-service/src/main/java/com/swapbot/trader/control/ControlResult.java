package com.swapbot.trader.control;

public record ControlResult(boolean accepted, String message) {

    public static ControlResult accepted(String message) {
        return new ControlResult(true, message);
    }

    public static ControlResult rejected(String message) {
        return new ControlResult(false, message);
    }
}
