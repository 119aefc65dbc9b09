package com.swapbot.trader.notify;

/**
 * Delivers alerts to one channel. Called from the notification dispatcher thread only.
 */
public interface TradeNotifier {

    String name();

    void send(TradeAlert alert);
}
