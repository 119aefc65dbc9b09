package com.swapbot.jupiter;

/**
 * Unsigned swap transaction returned by {@code /swap}, base64 encoded.
 */
public record SwapTransaction(SwapQuote quote, String payload, long lastValidBlockHeight) {
}
