package com.swapbot.jupiter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swapbot.http.ErrorCategory;
import com.swapbot.http.ExternalCallException;
import com.swapbot.http.StubHttpTransport;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JupiterClientTest {

  private static final String TOKEN = "TokenMint1111111111111111111111111111111111";

  private final StubHttpTransport transport = new StubHttpTransport();
  private final TokenDecimals decimals = new TokenDecimals(9, Map.of("UsdcLikeMint", 6));
  private final JupiterClient client = new JupiterClient(URI.create("https://quote-api.jup.ag/v6"), Duration.ofSeconds(5), transport, decimals);

  @Test
  void quoteMapsBaseSentinelAndConvertsToSmallestUnits() {
    transport.respond("""
        {"inputMint":"So11111111111111111111111111111111111111112","outputMint":"%s",
         "inAmount":"100000000","outAmount":"50000000000","routePlan":[]}
        """.formatted(TOKEN));

    SwapQuote quote = client.getQuote("SOL", TOKEN, new BigDecimal("0.1"), 50).orElseThrow();

    URI uri = transport.lastRequest().uri();
    assertThat(uri.getPath()).isEqualTo("/v6/quote");
    assertThat(uri.getQuery())
        .contains("inputMint=" + JupiterClient.WRAPPED_SOL_MINT)
        .contains("outputMint=" + TOKEN)
        .contains("amount=100000000")
        .contains("slippageBps=50");
    assertThat(quote.inAmount()).isEqualTo(BigInteger.valueOf(100_000_000L));
    assertThat(quote.outAmountUi()).isEqualByComparingTo("50");
    assertThat(quote.inputPerOutputUnit()).isEqualByComparingTo("0.002");
    assertThat(quote.raw().path("routePlan").isArray()).isTrue();
  }

  @Test
  void quoteUsesKnownDecimalsForInput() {
    transport.respond("{\"inAmount\":\"2500000\",\"outAmount\":\"1000000000\"}");

    client.getQuote("UsdcLikeMint", "SOL", new BigDecimal("2.5"), 50);

    assertThat(transport.lastRequest().uri().getQuery()).contains("amount=2500000");
  }

  @Test
  void unknownDecimalsFallBackToDefaultAndAreFlagged() {
    transport.respond("{\"inAmount\":\"1000000000\",\"outAmount\":\"5\"}");

    client.getQuote(TOKEN, "SOL", BigDecimal.ONE, 50);

    assertThat(decimals.usedDefault(TOKEN)).isTrue();
    decimals.register(TOKEN, 6);
    assertThat(decimals.usedDefault(TOKEN)).isFalse();
    assertThat(decimals.decimalsOf(TOKEN)).isEqualTo(6);
  }

  @Test
  void amountBelowSmallestUnitIsRejectedBeforeAnyCall() {
    assertThatThrownBy(() -> client.getQuote("SOL", TOKEN, new BigDecimal("0.0000000001"), 50))
        .isInstanceOf(ExternalCallException.class)
        .satisfies(e -> assertThat(((ExternalCallException) e).category()).isEqualTo(ErrorCategory.DOMAIN_VALIDATION));
    assertThat(transport.requests()).isEmpty();
  }

  @Test
  void exhaustedTransientFailureIsUnavailable() {
    transport.fail(ExternalCallException.transientNetwork("quote failed: HTTP 503", null));

    assertThat(client.getQuote("SOL", TOKEN, BigDecimal.ONE, 50)).isEmpty();
  }

  @Test
  void responseWithoutAmountsIsUnavailable() {
    transport.respond("{\"error\":\"no route\"}");

    assertThat(client.getQuote("SOL", TOKEN, BigDecimal.ONE, 50)).isEmpty();
  }

  @Test
  void fatalFailurePropagates() {
    transport.fail(ExternalCallException.unauthorized("quote failed: HTTP 401"));

    assertThatThrownBy(() -> client.getQuote("SOL", TOKEN, BigDecimal.ONE, 50))
        .isInstanceOf(ExternalCallException.class)
        .hasMessageContaining("401");
  }

  @Test
  void swapEchoesQuoteAndWallet() throws Exception {
    transport.respond("{\"inAmount\":\"100000000\",\"outAmount\":\"50000000000\",\"otherAmountThreshold\":\"49750000000\"}");
    SwapQuote quote = client.getQuote("SOL", TOKEN, new BigDecimal("0.1"), 50).orElseThrow();
    transport.respond("{\"swapTransaction\":\"AQAAAbase64==\",\"lastValidBlockHeight\":279000000}");

    SwapTransaction swap = client.getSwapTransaction(quote, "Wallet111").orElseThrow();

    assertThat(swap.payload()).isEqualTo("AQAAAbase64==");
    assertThat(swap.lastValidBlockHeight()).isEqualTo(279_000_000L);
    assertThat(transport.lastRequest().uri().getPath()).isEqualTo("/v6/swap");
    assertThat(transport.lastRequest().method()).isEqualTo("POST");
    JsonNode body = new ObjectMapper().readTree(StubHttpTransport.bodyOf(transport.lastRequest()));
    assertThat(body.path("userPublicKey").asText()).isEqualTo("Wallet111");
    assertThat(body.path("quoteResponse").path("otherAmountThreshold").asText()).isEqualTo("49750000000");
    assertThat(body.path("wrapAndUnwrapSol").asBoolean()).isTrue();
  }

  @Test
  void swapWithoutTransactionIsUnavailable() {
    transport.respond("{\"inAmount\":\"1\",\"outAmount\":\"1\"}");
    SwapQuote quote = client.getQuote("SOL", TOKEN, BigDecimal.ONE, 50).orElseThrow();
    transport.respond("{}");

    assertThat(client.getSwapTransaction(quote, "Wallet111")).isEmpty();
  }

  @Test
  void priceIsOutputOverInputForOneUnit() {
    decimals.register(TOKEN, 6);
    transport.respond("{\"inAmount\":\"1000000\",\"outAmount\":\"4000000\"}");

    Optional<BigDecimal> price = client.getPrice(TOKEN, 50);

    assertThat(price).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("0.004"));
    assertThat(transport.lastRequest().uri().getQuery())
        .contains("inputMint=" + TOKEN)
        .contains("outputMint=" + JupiterClient.WRAPPED_SOL_MINT)
        .contains("amount=1000000");
  }

  @Test
  void priceOfBaseCurrencyIsOne() {
    assertThat(client.getPrice("SOL", 50)).contains(BigDecimal.ONE);
    assertThat(transport.requests()).isEmpty();
  }
}
