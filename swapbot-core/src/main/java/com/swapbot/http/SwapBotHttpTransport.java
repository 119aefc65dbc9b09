package com.swapbot.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * JSON-over-HTTP transport. Every request goes through the {@link ResilientExecutor}; non-2xx responses
 * are turned into {@link ExternalCallException}s by the executor's {@link ErrorClassifier}.
 */
@Slf4j
public class SwapBotHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ResilientExecutor executor;

  public SwapBotHttpTransport(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper, @NonNull ResilientExecutor executor) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public JsonNode sendJson(String operation, HttpRequest request) {
    return sendJson(operation, request, UnaryOperator.identity());
  }

  /**
   * Like {@link #sendJson(String, HttpRequest)}, with {@code check} applied to the parsed body inside the retry
   * loop, so errors a service reports in a 2xx body are retried according to their category.
   */
  public JsonNode sendJson(String operation, HttpRequest request, UnaryOperator<JsonNode> check) {
    return executor.execute(operation, () -> {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      int status = response.statusCode();
      String body = response.body();
      if (status < 200 || status >= 300) {
        log.debug("{} {} -> HTTP {}", operation, request.uri(), status);
        throw executor.classifier().fromResponse(
            operation,
            status,
            response.headers().firstValue("Retry-After").orElse(null),
            body
        );
      }
      JsonNode json = body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
      return check.apply(json);
    });
  }
}
