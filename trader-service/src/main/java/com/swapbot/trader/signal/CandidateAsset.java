package com.swapbot.trader.signal;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * An asset reported by a signal source.
 *
 * @param price      last price in the base currency when the source reports one, otherwise {@code null}
 * @param decimals   token precision when the source reports it, otherwise {@code null}
 * @param rawContext the source's original record, for diagnostics; may be {@code null}
 */
public record CandidateAsset(
        String symbol,
        String address,
        String source,
        BigDecimal price,
        Integer decimals,
        JsonNode rawContext
) {

    public CandidateAsset {
        symbol = symbol == null ? null : symbol.trim();
        address = address == null ? null : address.trim();
    }

    public boolean hasAddress() {
        return address != null && !address.isEmpty();
    }
}
