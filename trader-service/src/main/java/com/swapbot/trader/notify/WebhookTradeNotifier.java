package com.swapbot.trader.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swapbot.http.ExternalCallException;
import com.swapbot.http.HttpRequestFactory;
import com.swapbot.http.SwapBotHttpTransport;
import lombok.NonNull;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts alerts as JSON to a webhook. The transport carries the notification rate limit and retry policy, so a
 * 429 with {@code Retry-After} is waited out before the next attempt.
 */
public class WebhookTradeNotifier implements TradeNotifier {

    private final HttpRequestFactory requestFactory;
    private final SwapBotHttpTransport transport;

    public WebhookTradeNotifier(@NonNull URI webhookUri, @NonNull Duration timeout, @NonNull SwapBotHttpTransport transport) {
        this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(webhookUri, "webhookUri"), Objects.requireNonNull(timeout, "timeout"));
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void send(TradeAlert alert) {
        ObjectNode body = transport.objectMapper().createObjectNode();
        body.put("type", alert.type().name());
        body.put("symbol", alert.symbol());
        body.put("message", alert.message());
        body.put("at", String.valueOf(alert.at()));
        ObjectNode details = body.putObject("details");
        alert.details().forEach(details::put);

        String json;
        try {
            json = transport.objectMapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw ExternalCallException.validation("cannot serialize alert", e);
        }
        transport.sendJson("webhook " + alert.type(), requestFactory.postJson("", json));
    }
}
