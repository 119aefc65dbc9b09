package com.swapbot.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swapbot.http.ExternalCallException;
import com.swapbot.http.HttpRequestFactory;
import com.swapbot.http.SwapBotHttpTransport;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal Solana JSON-RPC client: balances, token holdings, raw transaction submission and signature status.
 */
@Slf4j
public class SolanaRpcClient {

  /**
   * JSON-RPC error codes that mean "try again later" (node behind, slot skipped, rate limited).
   */
  private static final int NODE_UNHEALTHY = -32005;
  private static final int SLOT_SKIPPED = -32007;
  private static final int BLOCK_NOT_AVAILABLE = -32004;
  private static final int RPC_RATE_LIMITED = -32429;

  private final HttpRequestFactory requestFactory;
  private final SwapBotHttpTransport transport;
  private final AtomicLong requestIds = new AtomicLong();

  public SolanaRpcClient(@NonNull URI rpcUri, @NonNull Duration timeout, @NonNull SwapBotHttpTransport transport) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(rpcUri, "rpcUri"), Objects.requireNonNull(timeout, "timeout"));
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /**
   * @return balance in lamports
   */
  public BigInteger getBalance(String publicKey) {
    ArrayNode params = params();
    params.add(requireKey(publicKey, "publicKey"));
    params.addObject().put("commitment", "confirmed");
    JsonNode result = call("getBalance", params);
    JsonNode value = result.path("value");
    if (!value.isNumber()) {
      throw ExternalCallException.validation("getBalance returned no value: " + result);
    }
    return value.bigIntegerValue();
  }

  /**
   * Sums every token account the owner holds for {@code mint}. Empty when the owner has no account for it.
   */
  public Optional<TokenHolding> getTokenHolding(String owner, String mint) {
    ArrayNode params = params();
    params.add(requireKey(owner, "owner"));
    params.addObject().put("mint", requireKey(mint, "mint"));
    ObjectNode config = params.addObject();
    config.put("encoding", "jsonParsed");
    config.put("commitment", "confirmed");

    JsonNode accounts = call("getTokenAccountsByOwner", params).path("value");
    if (!accounts.isArray() || accounts.isEmpty()) {
      return Optional.empty();
    }
    BigInteger total = BigInteger.ZERO;
    Integer decimals = null;
    for (JsonNode account : accounts) {
      JsonNode tokenAmount = account.path("account").path("data").path("parsed").path("info").path("tokenAmount");
      if (tokenAmount.isMissingNode()) {
        continue;
      }
      try {
        total = total.add(new BigInteger(tokenAmount.path("amount").asText("0")));
      } catch (NumberFormatException e) {
        throw ExternalCallException.validation("unreadable token amount for " + mint + ": " + tokenAmount, e);
      }
      if (decimals == null && tokenAmount.hasNonNull("decimals")) {
        decimals = tokenAmount.get("decimals").asInt();
      }
    }
    if (decimals == null) {
      return Optional.empty();
    }
    return Optional.of(new TokenHolding(mint, total, decimals));
  }

  /**
   * Submits a signed, base64 encoded transaction.
   *
   * @return the transaction signature
   */
  public String sendTransaction(String signedTransactionBase64) {
    if (signedTransactionBase64 == null || signedTransactionBase64.isBlank()) {
      throw ExternalCallException.validation("transaction must not be blank");
    }
    ArrayNode params = params();
    params.add(signedTransactionBase64);
    ObjectNode config = params.addObject();
    config.put("encoding", "base64");
    config.put("preflightCommitment", "confirmed");
    JsonNode result = call("sendTransaction", params);
    String signature = result.asText("");
    if (signature.isBlank()) {
      throw ExternalCallException.validation("sendTransaction returned no signature");
    }
    return signature;
  }

  /**
   * Status of a recently submitted transaction. Empty while the cluster has not seen it.
   */
  public Optional<SignatureStatus> getSignatureStatus(String signature) {
    ArrayNode params = params();
    params.addArray().add(requireKey(signature, "signature"));
    params.addObject().put("searchTransactionHistory", false);

    JsonNode statuses = call("getSignatureStatuses", params).path("value");
    JsonNode status = statuses.isArray() && !statuses.isEmpty() ? statuses.get(0) : null;
    if (status == null || status.isNull()) {
      return Optional.empty();
    }
    JsonNode error = status.get("err");
    return Optional.of(new SignatureStatus(signature, status.path("confirmationStatus").asText(null),
        error == null || error.isNull() ? null : error));
  }

  public long getBlockHeight() {
    ArrayNode params = params();
    params.addObject().put("commitment", "confirmed");
    JsonNode result = call("getBlockHeight", params);
    if (!result.isIntegralNumber()) {
      throw ExternalCallException.validation("getBlockHeight returned no height: " + result);
    }
    return result.asLong();
  }

  private JsonNode call(String method, ArrayNode params) {
    ObjectNode request = transport.objectMapper().createObjectNode();
    request.put("jsonrpc", "2.0");
    request.put("id", requestIds.incrementAndGet());
    request.put("method", method);
    request.set("params", params);

    String body;
    try {
      body = transport.objectMapper().writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw ExternalCallException.validation("cannot serialize " + method + " request", e);
    }

    return transport.sendJson("solana " + method, requestFactory.postJson("", body), response -> unwrap(method, response));
  }

  private static JsonNode unwrap(String method, JsonNode response) {
    JsonNode error = response.get("error");
    if (error != null && !error.isNull()) {
      throw rpcError(method, error);
    }
    JsonNode result = response.get("result");
    if (result == null) {
      throw ExternalCallException.validation(method + " returned neither result nor error");
    }
    return result;
  }

  static ExternalCallException rpcError(String method, JsonNode error) {
    int code = error.path("code").asInt();
    String message = "%s failed: rpc error %d %s".formatted(method, code, error.path("message").asText(""));
    return switch (code) {
      case NODE_UNHEALTHY, SLOT_SKIPPED, BLOCK_NOT_AVAILABLE -> ExternalCallException.transientNetwork(message, null);
      case RPC_RATE_LIMITED -> ExternalCallException.throttled(message, Duration.ofSeconds(1));
      default -> ExternalCallException.validation(message);
    };
  }

  private ArrayNode params() {
    return transport.objectMapper().createArrayNode();
  }

  private static String requireKey(String value, String name) {
    if (value == null || value.isBlank()) {
      throw ExternalCallException.validation(name + " must not be blank");
    }
    return value.trim();
  }
}
