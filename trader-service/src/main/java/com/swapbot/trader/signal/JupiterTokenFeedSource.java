package com.swapbot.trader.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.swapbot.http.HttpRequestFactory;
import com.swapbot.http.SwapBotHttpTransport;
import com.swapbot.jupiter.TokenDecimals;
import lombok.NonNull;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Candidates from a Jupiter-style token list: a JSON array of {@code {address, symbol, decimals}} objects,
 * either top level or under {@code tokens}/{@code data}.
 */
public class JupiterTokenFeedSource implements CandidateSource {

    private final HttpRequestFactory requestFactory;
    private final SwapBotHttpTransport transport;
    private final TokenDecimals decimals;
    private final Duration pollInterval;

    public JupiterTokenFeedSource(
            @NonNull URI feedUri,
            @NonNull Duration timeout,
            @NonNull Duration pollInterval,
            @NonNull SwapBotHttpTransport transport,
            @NonNull TokenDecimals decimals
    ) {
        this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(feedUri, "feedUri"), Objects.requireNonNull(timeout, "timeout"));
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decimals = Objects.requireNonNull(decimals, "decimals");
    }

    @Override
    public String name() {
        return "jupiter-token-feed";
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public List<CandidateAsset> extractCandidates() {
        JsonNode root = transport.sendJson("token feed", requestFactory.get("", Map.of()));
        JsonNode tokens = root.isArray() ? root : root.has("tokens") ? root.get("tokens") : root.path("data");
        if (!tokens.isArray()) {
            return List.of();
        }
        List<CandidateAsset> out = new ArrayList<>(tokens.size());
        for (JsonNode token : tokens) {
            String address = text(token, "address", "mint", "id");
            String symbol = text(token, "symbol");
            if (symbol == null) {
                continue;
            }
            Integer tokenDecimals = token.hasNonNull("decimals") ? token.get("decimals").asInt() : null;
            if (address != null && tokenDecimals != null) {
                decimals.register(address, tokenDecimals);
            }
            BigDecimal price = token.path("price").isNumber() ? token.get("price").decimalValue() : null;
            out.add(new CandidateAsset(symbol, address, name(), price, tokenDecimals, token));
        }
        return out;
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
