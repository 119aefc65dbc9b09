package com.swapbot.jupiter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swapbot.http.ExternalCallException;
import com.swapbot.http.HttpRequestFactory;
import com.swapbot.http.SwapBotHttpTransport;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Jupiter swap API (v6): quotes, swap transactions and prices.
 *
 * Calls return {@link Optional#empty()} when the service is unavailable, i.e. retryable failures ran out or
 * the response lacks the fields needed. Authorization and validation failures are thrown as
 * {@link ExternalCallException}.
 */
@Slf4j
public class JupiterClient {

  /**
   * Symbol callers use for the base currency.
   */
  public static final String BASE_SENTINEL = "SOL";
  public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";
  public static final int BASE_DECIMALS = 9;

  private final HttpRequestFactory requestFactory;
  private final SwapBotHttpTransport transport;
  private final TokenDecimals decimals;

  public JupiterClient(@NonNull URI baseUri, @NonNull Duration timeout, @NonNull SwapBotHttpTransport transport, @NonNull TokenDecimals decimals) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"), Objects.requireNonNull(timeout, "timeout"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.decimals = Objects.requireNonNull(decimals, "decimals");
  }

  public TokenDecimals decimals() {
    return decimals;
  }

  public static String resolveMint(String asset) {
    if (asset == null || asset.isBlank()) {
      throw ExternalCallException.validation("asset must not be blank");
    }
    String trimmed = asset.trim();
    return BASE_SENTINEL.equalsIgnoreCase(trimmed) ? WRAPPED_SOL_MINT : trimmed;
  }

  /**
   * Converts a human amount to smallest units, truncating below the asset's precision.
   *
   * @throws ExternalCallException with a validation category when the amount is not positive after conversion
   */
  public static BigInteger toRawAmount(BigDecimal amount, int decimals) {
    if (amount == null || amount.signum() <= 0) {
      throw ExternalCallException.validation("amount must be > 0, was " + amount);
    }
    BigInteger raw = amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    if (raw.signum() <= 0) {
      throw ExternalCallException.validation("amount " + amount.toPlainString() + " is below the smallest unit (decimals=" + decimals + ")");
    }
    return raw;
  }

  public Optional<SwapQuote> getQuote(String input, String output, BigDecimal amount, int slippageBps) {
    String inputMint = resolveMint(input);
    String outputMint = resolveMint(output);
    if (inputMint.equals(outputMint)) {
      throw ExternalCallException.validation("input and output mint are the same: " + inputMint);
    }
    int inputDecimals = decimals.decimalsOf(inputMint);
    int outputDecimals = decimals.decimalsOf(outputMint);
    BigInteger rawAmount = toRawAmount(amount, inputDecimals);

    Map<String, String> query = new LinkedHashMap<>();
    query.put("inputMint", inputMint);
    query.put("outputMint", outputMint);
    query.put("amount", rawAmount.toString());
    query.put("slippageBps", Integer.toString(slippageBps));

    Optional<JsonNode> response = call("quote", requestFactory.get("/quote", query));
    if (response.isEmpty()) {
      return Optional.empty();
    }
    JsonNode body = response.get();
    BigInteger inAmount = readAmount(body, "inAmount");
    BigInteger outAmount = readAmount(body, "outAmount");
    if (inAmount == null || outAmount == null || inAmount.signum() <= 0 || outAmount.signum() <= 0) {
      log.warn("quote {} -> {} returned no usable amounts: {}", inputMint, outputMint, abbreviate(body));
      return Optional.empty();
    }
    return Optional.of(new SwapQuote(inputMint, outputMint, inAmount, outAmount, inputDecimals, outputDecimals, slippageBps, body));
  }

  public Optional<SwapTransaction> getSwapTransaction(SwapQuote quote, String walletPublicKey) {
    Objects.requireNonNull(quote, "quote");
    if (walletPublicKey == null || walletPublicKey.isBlank()) {
      throw ExternalCallException.validation("walletPublicKey must not be blank");
    }
    ObjectNode payload = transport.objectMapper().createObjectNode();
    payload.set("quoteResponse", quote.raw());
    payload.put("userPublicKey", walletPublicKey);
    payload.put("wrapAndUnwrapSol", true);

    HttpRequest request;
    try {
      request = requestFactory.postJson("/swap", transport.objectMapper().writeValueAsString(payload));
    } catch (JsonProcessingException e) {
      throw ExternalCallException.validation("cannot serialize swap request", e);
    }
    Optional<JsonNode> response = call("swap", request);
    if (response.isEmpty()) {
      return Optional.empty();
    }
    String transaction = response.get().path("swapTransaction").asText("");
    if (transaction.isBlank()) {
      log.warn("swap {} -> {} returned no transaction: {}", quote.inputMint(), quote.outputMint(), abbreviate(response.get()));
      return Optional.empty();
    }
    long lastValidBlockHeight = response.get().path("lastValidBlockHeight").asLong(0L);
    return Optional.of(new SwapTransaction(quote, transaction, lastValidBlockHeight));
  }

  /**
   * Price of one whole unit of {@code assetAddress} in the base currency. Shares the rate budget with trade quotes.
   */
  public Optional<BigDecimal> getPrice(String assetAddress, int slippageBps) {
    String mint = resolveMint(assetAddress);
    if (WRAPPED_SOL_MINT.equals(mint)) {
      return Optional.of(BigDecimal.ONE);
    }
    return getQuote(mint, WRAPPED_SOL_MINT, BigDecimal.ONE, slippageBps)
        .map(SwapQuote::outputPerInputUnit)
        .map(price -> price.round(MathContext.DECIMAL64));
  }

  private Optional<JsonNode> call(String operation, HttpRequest request) {
    try {
      return Optional.ofNullable(transport.sendJson("jupiter " + operation, request));
    } catch (ExternalCallException e) {
      if (e.category().retryable()) {
        log.warn("jupiter {} unavailable: {}", operation, e.getMessage());
        return Optional.empty();
      }
      throw e;
    }
  }

  private static BigInteger readAmount(JsonNode body, String field) {
    JsonNode node = body.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    try {
      return new BigInteger(node.asText().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String abbreviate(JsonNode body) {
    String text = String.valueOf(body);
    return text.length() <= 200 ? text : text.substring(0, 200) + "...";
  }
}
