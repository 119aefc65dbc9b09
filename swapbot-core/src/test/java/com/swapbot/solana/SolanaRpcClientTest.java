package com.swapbot.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swapbot.http.ErrorCategory;
import com.swapbot.http.ExternalCallException;
import com.swapbot.http.StubHttpTransport;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolanaRpcClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final StubHttpTransport transport = new StubHttpTransport();
  private final SolanaRpcClient client = new SolanaRpcClient(URI.create("https://rpc.example"), Duration.ofSeconds(5), transport);

  @Test
  void balanceIsReadFromResultValue() throws Exception {
    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":1},\"value\":2500000000}}");

    assertThat(client.getBalance("Wallet111")).isEqualTo(BigInteger.valueOf(2_500_000_000L));

    JsonNode request = objectMapper.readTree(StubHttpTransport.bodyOf(transport.lastRequest()));
    assertThat(request.path("method").asText()).isEqualTo("getBalance");
    assertThat(request.path("params").get(0).asText()).isEqualTo("Wallet111");
  }

  @Test
  void tokenHoldingSumsAllAccounts() {
    transport.respond("""
        {"jsonrpc":"2.0","id":1,"result":{"value":[
          {"account":{"data":{"parsed":{"info":{"tokenAmount":{"amount":"1500000","decimals":6}}}}}},
          {"account":{"data":{"parsed":{"info":{"tokenAmount":{"amount":"500000","decimals":6}}}}}}
        ]}}
        """);

    TokenHolding holding = client.getTokenHolding("Wallet111", "MintA").orElseThrow();

    assertThat(holding.rawAmount()).isEqualTo(BigInteger.valueOf(2_000_000L));
    assertThat(holding.decimals()).isEqualTo(6);
    assertThat(holding.uiAmount()).isEqualByComparingTo("2");
  }

  @Test
  void noTokenAccountIsEmpty() {
    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[]}}");

    assertThat(client.getTokenHolding("Wallet111", "MintA")).isEmpty();
  }

  @Test
  void sendTransactionReturnsSignature() throws Exception {
    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"5sig\"}");

    assertThat(client.sendTransaction("AQAB")).isEqualTo("5sig");

    JsonNode request = objectMapper.readTree(StubHttpTransport.bodyOf(transport.lastRequest()));
    assertThat(request.path("params").get(1).path("encoding").asText()).isEqualTo("base64");
  }

  @Test
  void signatureStatusReportsConfirmationAndErrors() throws Exception {
    transport.respond("""
        {"jsonrpc":"2.0","id":1,"result":{"context":{"slot":9},"value":[
          {"slot":8,"confirmations":1,"err":null,"confirmationStatus":"confirmed"}
        ]}}
        """);
    transport.respond("""
        {"jsonrpc":"2.0","id":2,"result":{"context":{"slot":9},"value":[
          {"slot":8,"confirmations":null,"err":{"InstructionError":[2,{"Custom":6001}]},"confirmationStatus":"finalized"}
        ]}}
        """);
    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{\"context\":{\"slot\":9},\"value\":[null]}}");

    SignatureStatus landed = client.getSignatureStatus("5sig").orElseThrow();
    assertThat(landed.landed()).isTrue();
    JsonNode request = objectMapper.readTree(StubHttpTransport.bodyOf(transport.lastRequest()));
    assertThat(request.path("method").asText()).isEqualTo("getSignatureStatuses");
    assertThat(request.path("params").get(0).get(0).asText()).isEqualTo("5sig");

    SignatureStatus reverted = client.getSignatureStatus("6sig").orElseThrow();
    assertThat(reverted.failed()).isTrue();
    assertThat(reverted.landed()).isFalse();

    assertThat(client.getSignatureStatus("7sig")).isEmpty();
  }

  @Test
  void blockHeightIsReadFromResult() {
    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":245000123}");

    assertThat(client.getBlockHeight()).isEqualTo(245_000_123L);
  }

  @Test
  void rpcErrorsAreClassified() {
    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"Node is behind\"}}");
    assertThatThrownBy(() -> client.getBalance("Wallet111"))
        .isInstanceOf(ExternalCallException.class)
        .satisfies(e -> assertThat(((ExternalCallException) e).category()).isEqualTo(ErrorCategory.TRANSIENT_NETWORK));

    transport.respond("{\"jsonrpc\":\"2.0\",\"id\":2,\"error\":{\"code\":-32002,\"message\":\"Transaction simulation failed\"}}");
    assertThatThrownBy(() -> client.sendTransaction("AQAB"))
        .isInstanceOf(ExternalCallException.class)
        .hasMessageContaining("simulation failed")
        .satisfies(e -> assertThat(((ExternalCallException) e).category()).isEqualTo(ErrorCategory.DOMAIN_VALIDATION));
  }
}
