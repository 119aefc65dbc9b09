package com.swapbot.trader.notify;

/**
 * Fire-and-forget alert sink. Implementations must not block the caller on delivery.
 */
@FunctionalInterface
public interface TradeAlertPublisher {

    void publish(TradeAlert alert);
}
