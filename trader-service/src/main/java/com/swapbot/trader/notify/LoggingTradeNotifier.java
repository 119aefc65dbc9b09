package com.swapbot.trader.notify;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingTradeNotifier implements TradeNotifier {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(TradeAlert alert) {
        switch (alert.type()) {
            case BUY_FAILED, EXIT_FAILED -> log.warn("[{}] {}: {}", alert.type(), alert.symbol(), alert.message());
            default -> log.info("[{}] {}: {}", alert.type(), alert.symbol(), alert.message());
        }
    }
}
